package com.mimecast.mailbuilder.mime.multipart;

import com.mimecast.mailbuilder.textproto.MalformedHeaderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MultipartReaderTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String string(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Split parts and keep preamble and epilogue")
    void parts() throws IOException {
        MultipartReader reader = new MultipartReader(bytes("pre\r\n" +
                "--abc\r\n" +
                "content-type: text/plain\r\n" +
                "\r\n" +
                "one\r\n" +
                "--abc  \r\n" +
                "\r\n" +
                "two\r\n" +
                "--abc--\r\n" +
                "epi"), "abc");

        MultipartPart first = reader.nextPart();
        assertEquals("text/plain", first.getHeaders().getValue("Content-Type"));
        assertEquals("content-type: text/plain\r\n", string(first.getRawHeader()));
        assertEquals("one", string(first.getBody()));

        MultipartPart second = reader.nextPart();
        assertTrue(second.getHeaders().isEmpty());
        assertEquals(0, second.getRawHeader().length);
        assertEquals("two", string(second.getBody()));

        assertNull(reader.nextPart());
        assertNull(reader.nextPart());
        assertEquals("pre\r\n", string(reader.getPreamble()));
        assertEquals("\r\nepi", string(reader.getEpilogue()));
    }

    @Test
    @DisplayName("Delimiter padding and line breaks are kept with each part")
    void framing() throws IOException {
        MultipartReader reader = new MultipartReader(bytes("--abc \t\r\n" +
                "A: 1\r\n" +
                "\r\n" +
                "--abc\n" +
                "--abc\r\n" +
                "\r\n" +
                "two\n" +
                "--abc--"), "abc");

        MultipartPart first = reader.nextPart();
        assertEquals(" \t\r\n", string(first.getDelimiterSuffix()));
        assertEquals("A: 1\r\n", string(first.getRawHeader()));
        assertEquals(0, first.getHeaderSeparator().length);
        assertEquals(0, first.getBody().length);
        assertEquals("\r\n", string(first.getTrailingBreak()));

        MultipartPart second = reader.nextPart();
        assertEquals("\n", string(second.getDelimiterSuffix()));
        assertTrue(second.getHeaders().isEmpty());
        assertEquals(0, second.getHeaderSeparator().length);
        assertEquals(0, second.getBody().length);
        assertEquals(0, second.getTrailingBreak().length);

        MultipartPart third = reader.nextPart();
        assertEquals("\r\n", string(third.getHeaderSeparator()));
        assertEquals("two", string(third.getBody()));
        assertEquals("\n", string(third.getTrailingBreak()));

        assertNull(reader.nextPart());
    }

    @Test
    @DisplayName("Boundary lookalikes stay in the body")
    void lookalike() throws IOException {
        MultipartReader reader = new MultipartReader(bytes("--abc\n\nx\n--abcdef\n -- abc\n--abc--"), "abc");

        assertEquals("x\n--abcdef\n -- abc", string(reader.nextPart().getBody()));
        assertNull(reader.nextPart());
        assertEquals(0, reader.getPreamble().length);
        assertEquals(0, reader.getEpilogue().length);
    }

    @Test
    @DisplayName("Nested boundaries are not split")
    void nested() throws IOException {
        MultipartReader reader = new MultipartReader(bytes("--a\n" +
                "Content-Type: multipart/mixed; boundary=b\n" +
                "\n" +
                "--b\n" +
                "\n" +
                "inner\n" +
                "--b--\n" +
                "--a--\n"), "a");

        MultipartPart part = reader.nextPart();

        assertEquals("--b\n\ninner\n--b--", string(part.getBody()));
        assertNull(reader.nextPart());
        assertEquals("\n", string(reader.getEpilogue()));
    }

    @Test
    @DisplayName("Close delimiter only yields no parts")
    void closeOnly() throws IOException {
        MultipartReader reader = new MultipartReader(bytes("nothing here\n--abc--\n"), "abc");

        assertNull(reader.nextPart());
        assertEquals("nothing here\n", string(reader.getPreamble()));
        assertEquals("\n", string(reader.getEpilogue()));
    }

    @Test
    @DisplayName("Missing delimiter is an error")
    void noDelimiter() {
        IOException e = assertThrows(IOException.class, () -> new MultipartReader(bytes("plain body\n"), "abc").nextPart());

        assertTrue(e.getMessage().startsWith("multipart:"));
    }

    @Test
    @DisplayName("Missing close delimiter is an error")
    void truncated() {
        MultipartReader reader = new MultipartReader(bytes("--abc\n\none\n"), "abc");

        IOException e = assertThrows(IOException.class, reader::nextPart);
        assertTrue(e.getMessage().startsWith("multipart:"));
    }

    @Test
    @DisplayName("Malformed part header is an error")
    void malformedPartHeader() {
        MultipartReader reader = new MultipartReader(bytes("--abc\nno colon here\n\nbody\n--abc--\n"), "abc");

        assertThrows(MalformedHeaderException.class, reader::nextPart);
    }
}
