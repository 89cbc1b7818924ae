package com.mimecast.mailbuilder.textproto;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Malformed MIME header.
 *
 * <p>Raised for a header block starting with a continuation line or a header line without a colon.
 * <br>Carries a bounded preview of the offending line for diagnostics.
 */
public class MalformedHeaderException extends IOException {

    /**
     * Lines longer than this are shortened in the preview.
     */
    static final int PREVIEW_LIMIT = 100;

    /**
     * Bytes kept from each end of a shortened line.
     */
    static final int PREVIEW_EDGE = 50;

    private final String preview;

    /**
     * Constructs a new MalformedHeaderException.
     *
     * @param message Error message.
     * @param line    Offending line content.
     */
    public MalformedHeaderException(String message, byte[] line) {
        this(message, preview(line));
    }

    /**
     * Constructs a new MalformedHeaderException.
     *
     * @param message Error message.
     * @param preview Line preview.
     */
    private MalformedHeaderException(String message, String preview) {
        super(message + ": " + preview);
        this.preview = preview;
    }

    /**
     * Gets preview of the offending line.
     *
     * @return String.
     */
    public String getPreview() {
        return preview;
    }

    /**
     * Builds the preview of a line.
     * <p>Lines over 100 bytes keep the first and last 50 bytes joined by an ellipsis.
     *
     * @param line Line content.
     * @return Preview string.
     */
    static String preview(byte[] line) {
        if (line.length <= PREVIEW_LIMIT) {
            return new String(line, StandardCharsets.UTF_8);
        }

        byte[] head = Arrays.copyOfRange(line, 0, PREVIEW_EDGE);
        byte[] tail = Arrays.copyOfRange(line, line.length - PREVIEW_EDGE, line.length);
        return new String(head, StandardCharsets.UTF_8) + "..." + new String(tail, StandardCharsets.UTF_8);
    }
}
