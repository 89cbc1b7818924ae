/**
 * MIME message tree.
 *
 * <p>This package holds the message model and the two operations working on it:
 * <ul>
 *     <li>{@link com.mimecast.mailbuilder.mime.MessageDecomposer} turns raw bytes into a tree of
 *     {@link com.mimecast.mailbuilder.mime.Message} nodes.</li>
 *     <li>{@link com.mimecast.mailbuilder.mime.MessageBuilder} turns the tree back into bytes.</li>
 * </ul>
 *
 * <p>Decomposed nodes keep their raw header bytes and multipart framing,
 * <br>so a tree rebuilt without edits reproduces the input it came from.
 */
package com.mimecast.mailbuilder.mime;
