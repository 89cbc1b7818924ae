package com.mimecast.mailbuilder.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LineInputStreamTest {

    private static LineInputStream stream(String s) {
        return new LineInputStream(new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Lines keep their terminators")
    void readLine() throws IOException {
        LineInputStream stream = stream("a\r\nb\nc");

        assertEquals("a\r\n", new String(stream.readLine(), StandardCharsets.UTF_8));
        assertEquals("b\n", new String(stream.readLine(), StandardCharsets.UTF_8));
        assertEquals("c", new String(stream.readLine(), StandardCharsets.UTF_8));
        assertNull(stream.readLine());
        assertEquals(3, stream.getLineNumber());
    }

    @Test
    @DisplayName("Peek does not consume")
    void peek() throws IOException {
        LineInputStream stream = stream(" x\n");

        assertEquals(' ', stream.peek());
        assertEquals(' ', stream.peek());
        assertEquals(" x\n", new String(stream.readLine(), StandardCharsets.UTF_8));
        assertEquals(-1, stream.peek());
    }

    @Test
    @DisplayName("Read remaining after lines")
    void readRemaining() throws IOException {
        LineInputStream stream = stream("head\r\n\r\nbody\r\nmore");
        stream.readLine();
        stream.readLine();

        assertEquals("body\r\nmore", new String(stream.readRemaining(), StandardCharsets.UTF_8));
        assertEquals(0, stream.readRemaining().length);
    }

    @Test
    @DisplayName("Content length strips LF and CRLF only")
    void contentLength() {
        assertEquals(3, LineInputStream.contentLength("abc\r\n".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(3, LineInputStream.contentLength("abc\n".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(4, LineInputStream.contentLength("abc\r".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(0, LineInputStream.contentLength(new byte[0]));
    }
}
