package com.mimecast.mailbuilder.mime.multipart;

import com.mimecast.mailbuilder.io.LineInputStream;
import com.mimecast.mailbuilder.textproto.HeaderBlock;
import com.mimecast.mailbuilder.textproto.TextProtoReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Multipart body scanner.
 *
 * <p>Splits a multipart body into parts at its boundary delimiter lines.
 * <br>Part headers are parsed with {@link TextProtoReader} and keep their raw bytes.
 * <br>The bytes before the first delimiter and after the close delimiter are kept as preamble and epilogue.
 *
 * <p>A delimiter line starts with two hyphens and the boundary, the close delimiter adds two more hyphens.
 * <br>Trailing spaces and tabs are allowed after either and kept with the part or in the epilogue.
 * <br>The line break before a delimiter line is not part content, it is kept as the part's trailing break.
 *
 * <pre>
 * MultipartReader reader = new MultipartReader(body, boundary);
 * MultipartPart part;
 * while ((part = reader.nextPart()) != null) {
 *     ...
 * }
 * </pre>
 */
public class MultipartReader {

    private final byte[] body;
    private final byte[] dashBoundary;

    /**
     * Next read position, always at a line start.
     */
    private int position = 0;

    /**
     * Delimiter line opening the part at position.
     */
    private Delimiter opening;

    private boolean started = false;
    private boolean finished = false;

    private byte[] preamble;
    private byte[] epilogue;

    /**
     * Constructs a new MultipartReader instance.
     *
     * @param body     Multipart body bytes.
     * @param boundary Boundary parameter value.
     */
    public MultipartReader(byte[] body, String boundary) {
        this.body = body;
        this.dashBoundary = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Gets preamble.
     *
     * @return Bytes before the first delimiter line or null if not yet read.
     */
    public byte[] getPreamble() {
        return preamble;
    }

    /**
     * Gets epilogue.
     *
     * @return Bytes after the close delimiter text or null if not yet reached.
     */
    public byte[] getEpilogue() {
        return epilogue;
    }

    /**
     * Reads next part.
     *
     * @return MultipartPart instance or null after the close delimiter.
     * @throws IOException Missing delimiter, truncated body or malformed part header.
     */
    public MultipartPart nextPart() throws IOException {
        if (finished) {
            return null;
        }

        if (!started) {
            Delimiter first = findDelimiter(0);
            if (first == null) {
                throw new IOException("multipart: NextPart: EOF, no boundary delimiter found");
            }

            started = true;
            preamble = Arrays.copyOfRange(body, 0, first.start);
            if (first.close) {
                finish(first);
                return null;
            }
            position = first.end;
            opening = first;
        }

        Delimiter next = findDelimiter(position);
        if (next == null) {
            throw new IOException("multipart: NextPart: EOF before close delimiter");
        }

        int contentEnd = next.start;
        if (contentEnd > position && body[contentEnd - 1] == LineInputStream.LF) {
            contentEnd--;
            if (contentEnd > position && body[contentEnd - 1] == LineInputStream.CR) {
                contentEnd--;
            }
        }

        MultipartPart part = readPart(Arrays.copyOfRange(body, position, contentEnd), opening,
                Arrays.copyOfRange(body, contentEnd, next.start));

        if (next.close) {
            finish(next);
        } else {
            position = next.end;
            opening = next;
        }

        return part;
    }

    /**
     * Parses part content into headers and body.
     *
     * @param content   Part bytes.
     * @param delimiter     Delimiter opening the part.
     * @param trailingBreak Line break before the next delimiter.
     * @return MultipartPart instance.
     * @throws IOException Malformed part header.
     */
    private MultipartPart readPart(byte[] content, Delimiter delimiter, byte[] trailingBreak) throws IOException {
        TextProtoReader reader = new TextProtoReader(new ByteArrayInputStream(content));
        HeaderBlock block = reader.readMimeHeader();
        byte[] suffix = Arrays.copyOfRange(body, delimiter.start + dashBoundary.length, delimiter.end);
        return new MultipartPart(block.getHeaders(), block.getRaw(), block.getSeparator(), suffix, trailingBreak,
                reader.readRemaining());
    }

    /**
     * Stores epilogue and marks the body as done.
     *
     * @param close Close delimiter.
     */
    private void finish(Delimiter close) {
        epilogue = Arrays.copyOfRange(body, close.start + dashBoundary.length + 2, body.length);
        finished = true;
    }

    /**
     * Finds the next delimiter line.
     *
     * @param from Line start to search from.
     * @return Delimiter instance or null if none.
     */
    private Delimiter findDelimiter(int from) {
        int start = from;
        while (start < body.length) {
            int end = start;
            while (end < body.length && body[end] != LineInputStream.LF) {
                end++;
            }
            int contentEnd = end;
            if (end < body.length) {
                end++;
                if (contentEnd > start && body[contentEnd - 1] == LineInputStream.CR) {
                    contentEnd--;
                }
            }

            Boolean close = delimiterType(start, contentEnd);
            if (close != null) {
                return new Delimiter(start, end, close);
            }

            start = end;
        }

        return null;
    }

    /**
     * Checks if line content is a delimiter.
     *
     * @param start Content start.
     * @param end   Content end.
     * @return True for close delimiter, false for delimiter, null if neither.
     */
    @SuppressWarnings("squid:S2447")
    private Boolean delimiterType(int start, int end) {
        if (end - start < dashBoundary.length) {
            return null;
        }
        for (int i = 0; i < dashBoundary.length; i++) {
            if (body[start + i] != dashBoundary[i]) {
                return null;
            }
        }

        int rest = start + dashBoundary.length;
        boolean close = false;
        if (end - rest >= 2 && body[rest] == '-' && body[rest + 1] == '-') {
            close = true;
            rest += 2;
        }

        for (int i = rest; i < end; i++) {
            if (body[i] != ' ' && body[i] != '\t') {
                return null;
            }
        }

        return close;
    }

    /**
     * Delimiter line position.
     */
    private static class Delimiter {
        private final int start;
        private final int end;
        private final boolean close;

        Delimiter(int start, int end, boolean close) {
            this.start = start;
            this.end = end;
            this.close = close;
        }
    }
}
