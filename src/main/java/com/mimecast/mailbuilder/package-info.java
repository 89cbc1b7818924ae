/**
 * Fidelity preserving MIME decomposition and rebuilding.
 *
 * <p>Raw messages are broken down into a navigable tree of headers, bodies, parts and nested messages.
 * <br>The tree can be edited and written back, unchanged parts come out byte for byte as they went in.
 *
 * @see com.mimecast.mailbuilder.mime.MessageDecomposer
 * @see com.mimecast.mailbuilder.mime.MessageBuilder
 */
package com.mimecast.mailbuilder;
