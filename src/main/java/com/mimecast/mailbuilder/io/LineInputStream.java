package com.mimecast.mailbuilder.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>InputStream implementation returns lines with EOL as byte array and counts lines.
 * <br>Lines end at LF, a CR directly before the LF is part of the terminator.
 * <br>The returned bytes are exactly the bytes consumed so callers can rebuild the original input.
 */
public class LineInputStream extends PushbackInputStream {

    /**
     * Carrige return byte.
     */
    public static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    public static final int LF = 10; // \n

    /**
     * Default pushback buffer size.
     */
    private static final int DEFAULT_PUSHBACK_SIZE = 1024;

    /**
     * Initial line buffer size (typical header line is 78-998 bytes).
     */
    private static final int LINE_BUFFER_INITIAL_SIZE = 1024;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(LINE_BUFFER_INITIAL_SIZE);

    /**
     * Constructs a new LineInputStream instance with default pushback buffer size.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        this(stream, DEFAULT_PUSHBACK_SIZE);
    }

    /**
     * Constructs a new LineInputStream instance with given pushback buffer size.
     *
     * @param stream InputStream instance.
     * @param size   Pushback buffer size.
     */
    public LineInputStream(InputStream stream, int size) {
        super(stream, size);
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Read line as byte array.
     *
     * @return Byte array including line terminator or null at end of stream.
     * @throws IOException Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        int intByte;
        while ((intByte = read()) != -1) {
            lineBuffer.write(intByte);

            // LF will instantly terminate the read and return.
            if (intByte == LF) {
                lineNumber++;
                return lineBuffer.toByteArray();
            }
        }

        // Return null if nothing was read.
        if (lineBuffer.size() == 0) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }

    /**
     * Peeks at the next byte without consuming it.
     *
     * @return Byte or -1 if end of stream.
     * @throws IOException Unable to read.
     */
    public int peek() throws IOException {
        int intByte = read();
        if (intByte != -1) {
            unread(intByte);
        }
        return intByte;
    }

    /**
     * Reads everything left in the stream.
     *
     * @return Byte array.
     * @throws IOException Unable to read.
     */
    public byte[] readRemaining() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];

        int read;
        while ((read = read(buffer, 0, buffer.length)) != -1) {
            out.write(buffer, 0, read);
        }

        return out.toByteArray();
    }

    /**
     * Strips the line terminator from a line.
     *
     * @param line Line bytes.
     * @return Content length without LF or CRLF.
     */
    public static int contentLength(byte[] line) {
        int length = line.length;
        if (length > 0 && line[length - 1] == LF) {
            length--;
            if (length > 0 && line[length - 1] == CR) {
                length--;
            }
        }
        return length;
    }
}
