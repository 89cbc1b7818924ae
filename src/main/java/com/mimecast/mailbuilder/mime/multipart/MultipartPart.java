package com.mimecast.mailbuilder.mime.multipart;

import com.mimecast.mailbuilder.mime.headers.MimeHeaders;

/**
 * Single part read from a multipart body.
 */
public class MultipartPart {
    private final MimeHeaders headers;
    private final byte[] rawHeader;
    private final byte[] headerSeparator;
    private final byte[] delimiterSuffix;
    private final byte[] trailingBreak;
    private final byte[] body;

    /**
     * Constructs a new MultipartPart instance.
     *
     * @param headers         Part headers.
     * @param rawHeader       Raw part header bytes.
     * @param headerSeparator Blank line bytes ending the part header.
     * @param delimiterSuffix Bytes after the boundary on the delimiter line opening the part.
     * @param trailingBreak   Line break between the part and the next delimiter line.
     * @param body            Part body bytes.
     */
    public MultipartPart(MimeHeaders headers, byte[] rawHeader, byte[] headerSeparator,
                         byte[] delimiterSuffix, byte[] trailingBreak, byte[] body) {
        this.headers = headers;
        this.rawHeader = rawHeader;
        this.headerSeparator = headerSeparator;
        this.delimiterSuffix = delimiterSuffix;
        this.trailingBreak = trailingBreak;
        this.body = body;
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
     * Gets raw header bytes as read.
     *
     * @return Byte array.
     */
    public byte[] getRawHeader() {
        return rawHeader;
    }

    /**
     * Gets header separator.
     * <p>Empty when the part ended within its header, the line break before the next delimiter then closes it.
     *
     * @return Byte array.
     */
    public byte[] getHeaderSeparator() {
        return headerSeparator;
    }

    /**
     * Gets delimiter suffix.
     *
     * @return Transport padding and line terminator of the opening delimiter line.
     */
    public byte[] getDelimiterSuffix() {
        return delimiterSuffix;
    }

    /**
     * Gets trailing break.
     *
     * @return CRLF, LF or empty if the next delimiter line follows the part directly.
     */
    public byte[] getTrailingBreak() {
        return trailingBreak;
    }

    /**
     * Gets body bytes.
     *
     * @return Byte array.
     */
    public byte[] getBody() {
        return body;
    }
}
