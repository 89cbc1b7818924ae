package com.mimecast.mailbuilder.codec;

/**
 * Transfer decoding result.
 */
public class DecodedContent {

    /**
     * Decoded bytes.
     */
    private final byte[] bytes;

    /**
     * True if a transform was applied.
     */
    private final boolean transformed;

    /**
     * Constructs a new DecodedContent instance.
     *
     * @param bytes       Decoded bytes.
     * @param transformed True if the bytes were actually decoded.
     */
    public DecodedContent(byte[] bytes, boolean transformed) {
        this.bytes = bytes;
        this.transformed = transformed;
    }

    /**
     * Gets bytes.
     *
     * @return Byte array.
     */
    public byte[] getBytes() {
        return bytes;
    }

    /**
     * Is transformed.
     * <p>False for pass-through encodings like 7bit, 8bit and binary.
     *
     * @return Boolean.
     */
    public boolean isTransformed() {
        return transformed;
    }
}
