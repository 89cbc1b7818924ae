package com.mimecast.mailbuilder.textproto;

import java.nio.charset.StandardCharsets;

/**
 * Line read from a text protocol stream.
 *
 * <p>Holds the line content and, separately, the literal bytes consumed to produce it.
 * <br>For folded header lines the content is unfolded while the raw bytes keep every physical line.
 */
public class Line {
    private final byte[] content;
    private final byte[] raw;

    /**
     * Constructs a new Line instance.
     *
     * @param content Line content without terminator.
     * @param raw     Literal bytes consumed.
     */
    public Line(byte[] content, byte[] raw) {
        this.content = content;
        this.raw = raw;
    }

    /**
     * Gets content.
     *
     * @return Byte array.
     */
    public byte[] getContent() {
        return content;
    }

    /**
     * Gets raw bytes.
     *
     * @return Byte array.
     */
    public byte[] getRaw() {
        return raw;
    }

    /**
     * Is empty.
     *
     * @return True for a blank line.
     */
    public boolean isEmpty() {
        return content.length == 0;
    }

    /**
     * Gets content as UTF-8 string.
     *
     * @return String.
     */
    @Override
    public String toString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
