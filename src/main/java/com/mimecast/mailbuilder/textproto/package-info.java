/**
 * Text protocol reading.
 *
 * <p>Header level reader on top of {@link com.mimecast.mailbuilder.io.LineInputStream}.
 * <br>It unfolds header lines, parses MIME header blocks and decodes dot-encoded blocks.
 *
 * <p>Every header line parsed keeps its raw bytes so the block can be reproduced as read.
 */
package com.mimecast.mailbuilder.textproto;
