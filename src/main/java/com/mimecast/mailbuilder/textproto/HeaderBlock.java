package com.mimecast.mailbuilder.textproto;

import com.mimecast.mailbuilder.mime.headers.MimeHeaders;

/**
 * Parsed MIME header block.
 *
 * <p>Holds the header map together with the exact bytes of every header line read,
 * <br>terminators included and the blank separator line excluded.
 * <br>The separator line is kept apart, it is empty when the block ended at end of stream.
 */
public class HeaderBlock {
    private final MimeHeaders headers;
    private final byte[] raw;
    private final byte[] separator;

    /**
     * Constructs a new HeaderBlock instance.
     *
     * @param headers   MimeHeaders instance.
     * @param raw       Raw header bytes.
     * @param separator Blank line bytes ending the block.
     */
    public HeaderBlock(MimeHeaders headers, byte[] raw, byte[] separator) {
        this.headers = headers;
        this.raw = raw;
        this.separator = separator;
    }

    /**
     * Gets headers.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getHeaders() {
        return headers;
    }

    /**
     * Gets raw header bytes.
     *
     * @return Byte array.
     */
    public byte[] getRaw() {
        return raw;
    }

    /**
     * Gets separator.
     *
     * @return Blank line bytes as read or an empty array.
     */
    public byte[] getSeparator() {
        return separator;
    }
}
