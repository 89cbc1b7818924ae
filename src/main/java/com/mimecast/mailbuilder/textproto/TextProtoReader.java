package com.mimecast.mailbuilder.textproto;

import com.mimecast.mailbuilder.io.DotInputStream;
import com.mimecast.mailbuilder.io.LineInputStream;
import com.mimecast.mailbuilder.mime.headers.MimeHeaders;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text protocol reader.
 *
 * <p>Reads lines, folded header lines, MIME header blocks and dot-encoded blocks
 * <br>from a byte stream while keeping the literal bytes consumed for each header line.
 *
 * <p>Unlike a plain header parser the raw bytes of the header block are retained
 * <br>so an unmodified header can be written back exactly as received.
 *
 * @see LineInputStream
 * @see DotInputStream
 */
public class TextProtoReader {

    /**
     * Error message for a header block starting with a continuation line.
     */
    static final String MALFORMED_INITIAL_LINE = "malformed MIME header initial line";

    /**
     * Error message for a header line without a colon.
     */
    static final String MALFORMED_LINE = "malformed MIME header line";

    private final LineInputStream stream;

    /**
     * Active dot block reader if any.
     */
    private DotInputStream dot;

    /**
     * Constructs a new TextProtoReader instance.
     *
     * @param stream InputStream instance.
     */
    public TextProtoReader(InputStream stream) {
        this.stream = stream instanceof LineInputStream ? (LineInputStream) stream : new LineInputStream(stream);
    }

    /**
     * Gets underlying stream.
     * <p>Positioned right after whatever was read last, the message body after {@link #readMimeHeader()}.
     *
     * @return LineInputStream instance.
     */
    public LineInputStream getStream() {
        return stream;
    }

    /**
     * Reads everything left in the stream.
     *
     * @return Byte array.
     * @throws IOException Unable to read.
     */
    public byte[] readRemaining() throws IOException {
        closeDot();
        return stream.readRemaining();
    }

    /**
     * Reads a single line.
     *
     * @return Line instance or null at end of stream.
     * @throws IOException Unable to read.
     */
    public Line readLine() throws IOException {
        closeDot();

        byte[] raw = stream.readLine();
        if (raw == null) {
            return null;
        }

        return new Line(Arrays.copyOf(raw, LineInputStream.contentLength(raw)), raw);
    }

    /**
     * Reads a logical line, unfolding continuation lines.
     * <p>Continuation lines start with a space or tab.
     * <br>Each physical line is trimmed and joined to the previous one with a single space.
     * <br>The raw bytes of the returned line are all physical lines as read.
     *
     * @return Line instance or null at end of stream.
     * @throws IOException Unable to read.
     */
    public Line readContinuedLine() throws IOException {
        Line first = readLine();
        if (first == null || first.isEmpty()) {
            return first;
        }

        // Fast path for unfolded lines.
        int next = stream.peek();
        if (next != ' ' && next != '\t') {
            return new Line(trim(first.getContent()), first.getRaw());
        }

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        content.write(trim(first.getContent()));
        raw.write(first.getRaw());

        while (next == ' ' || next == '\t') {
            Line continuation = readLine();
            if (continuation == null) {
                break;
            }

            content.write(' ');
            content.write(trim(continuation.getContent()));
            raw.write(continuation.getRaw());

            next = stream.peek();
        }

        return new Line(content.toByteArray(), raw.toByteArray());
    }

    /**
     * Reads a MIME header block.
     * <p>Reading stops after the blank line ending the block or at end of stream.
     * <br>Keys are canonicalized, repeated keys accumulate values in order.
     *
     * @return HeaderBlock instance.
     * @throws MalformedHeaderException Header block starts with a continuation line or a line has no colon.
     * @throws IOException              Unable to read.
     */
    public HeaderBlock readMimeHeader() throws IOException {
        closeDot();

        MimeHeaders headers = new MimeHeaders();
        ByteArrayOutputStream raw = new ByteArrayOutputStream();

        int first = stream.peek();
        if (first == ' ' || first == '\t') {
            Line line = readLine();
            throw new MalformedHeaderException(MALFORMED_INITIAL_LINE, line.getContent());
        }

        byte[] separator = new byte[0];
        Line line;
        while ((line = readContinuedLine()) != null) {
            if (line.isEmpty()) {
                separator = line.getRaw();
                break;
            }
            raw.write(line.getRaw());

            byte[] content = line.getContent();
            int colon = indexOf(content, (byte) ':');
            if (colon < 0) {
                throw new MalformedHeaderException(MALFORMED_LINE, content);
            }

            int keyEnd = colon;
            while (keyEnd > 0 && content[keyEnd - 1] == ' ') {
                keyEnd--;
            }

            String key = HeaderKeys.canonical(new String(content, 0, keyEnd, StandardCharsets.UTF_8));
            if (key.isEmpty()) {
                continue;
            }

            int valueStart = colon + 1;
            while (valueStart < content.length && (content[valueStart] == ' ' || content[valueStart] == '\t')) {
                valueStart++;
            }

            headers.add(key, new String(content, valueStart, content.length - valueStart, StandardCharsets.UTF_8));
        }

        return new HeaderBlock(headers, raw.toByteArray(), separator);
    }

    /**
     * Gets a reader for a dot-encoded block.
     * <p>Any previously returned dot reader is drained first.
     *
     * @return DotInputStream instance.
     * @throws IOException Unable to read.
     */
    public DotInputStream dotReader() throws IOException {
        closeDot();
        dot = new DotInputStream(stream);
        return dot;
    }

    /**
     * Reads a dot-encoded block.
     *
     * @return Decoded bytes.
     * @throws EOFException Stream ended before the terminating dot line.
     * @throws IOException  Unable to read.
     */
    public byte[] readDotBytes() throws IOException {
        return dotReader().readAllBytes();
    }

    /**
     * Reads a dot-encoded block as lines.
     * <p>Line terminators are elided and leading escape dots removed.
     *
     * @return List of String.
     * @throws EOFException Stream ended before the terminating dot line.
     * @throws IOException  Unable to read.
     */
    public List<String> readDotLines() throws IOException {
        List<String> lines = new ArrayList<>();

        Line line;
        while ((line = readLine()) != null) {
            byte[] content = line.getContent();
            int offset = 0;
            if (content.length > 0 && content[0] == '.') {
                if (content.length == 1) {
                    return lines;
                }
                offset = 1;
            }
            lines.add(new String(content, offset, content.length - offset, StandardCharsets.UTF_8));
        }

        throw new EOFException("Unexpected EOF in dot-encoded block");
    }

    /**
     * Drains the active dot reader if unfinished.
     *
     * @throws IOException Unable to read.
     */
    private void closeDot() throws IOException {
        if (dot == null) {
            return;
        }

        DotInputStream active = dot;
        dot = null;
        while (!active.isDone()) {
            if (active.read() == -1) {
                break;
            }
        }
    }

    /**
     * Trims spaces and tabs from both ends.
     *
     * @param bytes Byte array.
     * @return Byte array.
     */
    private static byte[] trim(byte[] bytes) {
        int start = 0;
        int end = bytes.length;
        while (start < end && (bytes[start] == ' ' || bytes[start] == '\t')) {
            start++;
        }
        while (end > start && (bytes[end - 1] == ' ' || bytes[end - 1] == '\t')) {
            end--;
        }
        return start == 0 && end == bytes.length ? bytes : Arrays.copyOfRange(bytes, start, end);
    }

    /**
     * Finds the first index of a byte.
     *
     * @param bytes Byte array.
     * @param b     Byte to find.
     * @return Index or -1.
     */
    private static int indexOf(byte[] bytes, byte b) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == b) {
                return i;
            }
        }
        return -1;
    }
}
