/**
 * Handles the low-level input streams for message parsing.
 *
 * <p>The following streams are available:
 * <ul>
 *     <li>{@link com.mimecast.mailbuilder.io.LineInputStream} - Reads raw lines including their terminators.</li>
 *     <li>{@link com.mimecast.mailbuilder.io.DotInputStream} - Decodes dot-encoded text protocol blocks.</li>
 * </ul>
 */
package com.mimecast.mailbuilder.io;
