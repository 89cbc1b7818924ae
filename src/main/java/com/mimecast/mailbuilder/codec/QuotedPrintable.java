package com.mimecast.mailbuilder.codec;

import org.apache.commons.codec.DecoderException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Quoted-Printable codec for Content-Transfer-Encoding processing.
 *
 * <p>Unlike the Commons Codec implementation this keeps hard line breaks intact when decoding,
 * <br>which text bodies and embedded messages depend on.
 *
 * <p>Encoding follows RFC 2045:
 * <ul>
 *     <li>Lines are kept at or under 76 characters with soft line breaks.</li>
 *     <li>Hard line breaks (CRLF or LF) are preserved as is.</li>
 *     <li>Whitespace before a line break or at the end of data is escaped.</li>
 * </ul>
 */
public class QuotedPrintable {

    /**
     * Maximum encoded line length including the soft break marker.
     */
    private static final int MAX_LINE_LENGTH = 76;

    private static final byte ESCAPE = '=';
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte SPACE = ' ';
    private static final byte TAB = '\t';

    private static final byte[] HEX = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);

    /**
     * Private constructor.
     */
    private QuotedPrintable() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Encodes bytes.
     *
     * @param data    Raw bytes.
     * @param newline Separator used for soft line breaks.
     * @return Encoded bytes.
     */
    public static byte[] encode(byte[] data, String newline) {
        byte[] softBreak = ("=" + newline).getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + data.length / 3);

        int lineLength = 0;
        for (int i = 0; i < data.length; i++) {
            int b = data[i] & 0xFF;

            // Hard line breaks pass through.
            int eol = eolLength(data, i);
            if (eol > 0) {
                out.write(data, i, eol);
                i += eol - 1;
                lineLength = 0;
                continue;
            }

            boolean literal = (b >= 33 && b <= 126 && b != ESCAPE) ||
                    ((b == SPACE || b == TAB) && !isTrailing(data, i));
            int width = literal ? 1 : 3;

            if (lineLength + width > MAX_LINE_LENGTH - 1) {
                out.write(softBreak, 0, softBreak.length);
                lineLength = 0;
            }

            if (literal) {
                out.write(b);
            } else {
                out.write(ESCAPE);
                out.write(HEX[b >> 4]);
                out.write(HEX[b & 0x0F]);
            }
            lineLength += width;
        }

        return out.toByteArray();
    }

    /**
     * Decodes bytes.
     * <p>Handles soft line breaks and hex escapes, hex digits are case insensitive.
     *
     * @param data Encoded bytes.
     * @return Decoded bytes.
     * @throws DecoderException Invalid escape sequence.
     */
    public static byte[] decode(byte[] data) throws DecoderException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);

        int start = 0;
        while (start < data.length) {
            int lf = start;
            while (lf < data.length && data[lf] != LF) {
                lf++;
            }

            // Split line content from its terminator.
            int contentEnd = lf;
            if (lf < data.length && lf > start && data[lf - 1] == CR) {
                contentEnd = lf - 1;
            }
            int next = lf < data.length ? lf + 1 : lf;

            // Transport padding is discarded.
            int end = contentEnd;
            while (end > start && (data[end - 1] == SPACE || data[end - 1] == TAB)) {
                end--;
            }

            boolean soft = end > start && data[end - 1] == ESCAPE;
            if (soft) {
                end--;
            }

            decodeLine(data, start, end, out);

            if (!soft) {
                out.write(data, contentEnd, next - contentEnd);
            }
            start = next;
        }

        return out.toByteArray();
    }

    /**
     * Decodes a single line without its terminator.
     *
     * @param data  Encoded bytes.
     * @param start Start offset.
     * @param end   End offset (exclusive).
     * @param out   Output stream.
     * @throws DecoderException Invalid escape sequence.
     */
    private static void decodeLine(byte[] data, int start, int end, ByteArrayOutputStream out) throws DecoderException {
        for (int i = start; i < end; i++) {
            byte b = data[i];
            if (b != ESCAPE) {
                out.write(b);
                continue;
            }

            if (i + 2 >= end) {
                throw new DecoderException("Invalid quoted-printable escape at offset " + i);
            }
            int high = Character.digit((char) (data[i + 1] & 0xFF), 16);
            int low = Character.digit((char) (data[i + 2] & 0xFF), 16);
            if (high < 0 || low < 0) {
                throw new DecoderException("Invalid quoted-printable escape at offset " + i);
            }
            out.write((high << 4) | low);
            i += 2;
        }
    }

    /**
     * Gets the length of the line terminator starting at offset, if any.
     *
     * @param data   Bytes.
     * @param offset Offset.
     * @return 2 for CRLF, 1 for LF, 0 otherwise.
     */
    private static int eolLength(byte[] data, int offset) {
        if (data[offset] == LF) {
            return 1;
        }
        if (data[offset] == CR && offset + 1 < data.length && data[offset + 1] == LF) {
            return 2;
        }
        return 0;
    }

    /**
     * Checks if the whitespace at offset ends a line or the data.
     *
     * @param data   Bytes.
     * @param offset Offset.
     * @return Boolean.
     */
    private static boolean isTrailing(byte[] data, int offset) {
        return offset + 1 == data.length || eolLength(data, offset + 1) > 0;
    }
}
