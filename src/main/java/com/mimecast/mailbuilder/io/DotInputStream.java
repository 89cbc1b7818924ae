package com.mimecast.mailbuilder.io;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Dot-encoded block decoding input stream.
 *
 * <p>Dot encoding is the framing used for data blocks in text protocols such as SMTP, POP3 and NNTP.
 * <br>The block is a sequence of lines ending at a line containing just a dot.
 * <br>Lines beginning with a dot carry an additional escaping dot.
 *
 * <p>The decoded form:
 * <ul>
 *     <li>Rewrites CRLF line endings into LF.</li>
 *     <li>Removes leading dot escapes.</li>
 *     <li>Returns -1 after consuming and discarding the terminating dot line.</li>
 * </ul>
 * A source ending before the terminating line raises an {@link EOFException}.
 */
public class DotInputStream extends InputStream {

    /**
     * Decoder state.
     */
    private enum State {
        /** Beginning of line, initial state. */
        BEGIN_LINE,

        /** Read dot at beginning of line. */
        DOT,

        /** Read dot and CR at beginning of line. */
        DOT_CR,

        /** Read CR, possibly at end of line. */
        CR,

        /** Reading data in middle of line. */
        DATA,

        /** Reached the terminating dot line. */
        EOF
    }

    private final LineInputStream source;
    private State state = State.BEGIN_LINE;

    /**
     * Set once the block is finished or the source failed.
     */
    private boolean done = false;

    /**
     * Constructs a new DotInputStream instance.
     *
     * @param source LineInputStream instance positioned at the start of the block.
     */
    public DotInputStream(LineInputStream source) {
        this.source = source;
    }

    /**
     * Is done.
     *
     * @return True once the terminating line was read or the source ended.
     */
    public boolean isDone() {
        return done;
    }

    @Override
    @SuppressWarnings("squid:S128")
    public int read() throws IOException {
        while (state != State.EOF) {
            int c = source.read();
            if (c == -1) {
                done = true;
                throw new EOFException("Unexpected EOF in dot-encoded block");
            }

            switch (state) {
                case BEGIN_LINE:
                    if (c == '.') {
                        state = State.DOT;
                        continue;
                    }
                    if (c == '\r') {
                        state = State.CR;
                        continue;
                    }
                    state = c == '\n' ? State.BEGIN_LINE : State.DATA;
                    return c;

                case DOT:
                    if (c == '\r') {
                        state = State.DOT_CR;
                        continue;
                    }
                    if (c == '\n') {
                        state = State.EOF;
                        continue;
                    }
                    state = State.DATA;
                    return c;

                case DOT_CR:
                    if (c == '\n') {
                        state = State.EOF;
                        continue;
                    }
                    // Not part of .\r\n, drop the leading dot and emit the saved CR.
                    source.unread(c);
                    state = State.DATA;
                    return '\r';

                case CR:
                    if (c == '\n') {
                        state = State.BEGIN_LINE;
                        return c;
                    }
                    // Not part of \r\n, emit the saved CR.
                    source.unread(c);
                    state = State.DATA;
                    return '\r';

                case DATA:
                default:
                    if (c == '\r') {
                        state = State.CR;
                        continue;
                    }
                    if (c == '\n') {
                        state = State.BEGIN_LINE;
                    }
                    return c;
            }
        }

        done = true;
        return -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }

        int n = 0;
        while (n < len) {
            int c = read();
            if (c == -1) {
                break;
            }
            b[off + n++] = (byte) c;
        }

        return n == 0 ? -1 : n;
    }
}
