package com.mimecast.mailbuilder.textproto;

import com.mimecast.mailbuilder.mime.headers.MimeHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TextProtoReaderTest {

    private static TextProtoReader reader(String s) {
        return new TextProtoReader(new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)));
    }

    private static String string(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Read header block with folding and raw bytes")
    void readMimeHeader() throws IOException {
        String header = "content-type: text/plain\r\n" +
                "Subject: Hello\r\n" +
                "  world \r\n" +
                "\tagain\r\n" +
                "X-Empty:\r\n";
        TextProtoReader reader = reader(header + "\r\nbody\r\n");

        HeaderBlock block = reader.readMimeHeader();
        MimeHeaders headers = block.getHeaders();

        assertEquals("text/plain", headers.getValue("Content-Type"));
        assertEquals("Hello world again", headers.getValue("Subject"));
        assertTrue(headers.contains("X-Empty"));
        assertEquals("", headers.getValue("X-Empty"));
        assertEquals(Arrays.asList("Content-Type", "Subject", "X-Empty"), Arrays.asList(headers.names().toArray()));
        assertEquals(header, string(block.getRaw()));
        assertEquals(6, reader.getStream().getLineNumber());
        assertEquals("body\r\n", string(reader.readRemaining()));
    }

    @Test
    @DisplayName("Repeated fields accumulate in order")
    void repeated() throws IOException {
        HeaderBlock block = reader("Received: one\nreceived: two\n\n").readMimeHeader();

        assertEquals(Arrays.asList("one", "two"), block.getHeaders().getAll("Received"));
    }

    @Test
    @DisplayName("Key trailing spaces and value leading whitespace are trimmed")
    void trimming() throws IOException {
        HeaderBlock block = reader("Subject  :\t  hi there\n\n").readMimeHeader();

        assertEquals("hi there", block.getHeaders().getValue("Subject"));
    }

    @Test
    @DisplayName("Empty keys are skipped")
    void emptyKey() throws IOException {
        HeaderBlock block = reader(": orphan\r\nA: 1\r\n\r\n").readMimeHeader();

        assertEquals(1, block.getHeaders().size());
        assertEquals("1", block.getHeaders().getValue("A"));
        assertEquals(": orphan\r\nA: 1\r\n", string(block.getRaw()));
    }

    @Test
    @DisplayName("End of stream ends the header block")
    void endOfStream() throws IOException {
        HeaderBlock block = reader("A: 1\r\nB: 2").readMimeHeader();

        assertEquals("2", block.getHeaders().getValue("B"));
        assertEquals("A: 1\r\nB: 2", string(block.getRaw()));
        assertEquals(0, block.getSeparator().length);
    }

    @Test
    @DisplayName("Blank line ending the block is kept as separator")
    void separator() throws IOException {
        assertEquals("\r\n", string(reader("A: 1\r\n\r\nbody").readMimeHeader().getSeparator()));
        assertEquals("\n", string(reader("A: 1\n\nbody").readMimeHeader().getSeparator()));
        assertEquals(0, reader("A: 1\r\n").readMimeHeader().getSeparator().length);
    }

    @Test
    @DisplayName("Empty header block")
    void emptyHeader() throws IOException {
        TextProtoReader reader = reader("\r\nbody");
        HeaderBlock block = reader.readMimeHeader();

        assertTrue(block.getHeaders().isEmpty());
        assertEquals(0, block.getRaw().length);
        assertEquals("\r\n", string(block.getSeparator()));
        assertEquals("body", string(reader.readRemaining()));
    }

    @Test
    @DisplayName("Continuation as first line is malformed")
    void malformedInitialLine() {
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class,
                () -> reader("\tFoo: bar\r\nA: 1\r\n\r\n").readMimeHeader());

        assertEquals("\tFoo: bar", e.getPreview());
        assertEquals("malformed MIME header initial line: \tFoo: bar", e.getMessage());
    }

    @Test
    @DisplayName("Line without colon is malformed")
    void malformedLine() {
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class,
                () -> reader("A: 1\r\nnot a header\r\n\r\n").readMimeHeader());

        assertEquals("not a header", e.getPreview());
        assertEquals("malformed MIME header line: not a header", e.getMessage());
    }

    @Test
    @DisplayName("Long malformed lines are shortened in the preview")
    void malformedPreview() {
        String line = "a".repeat(60) + "b".repeat(90);
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class,
                () -> reader("\t" + line + "\r\n\r\n").readMimeHeader());

        assertEquals("\t" + "a".repeat(49) + "..." + "b".repeat(50), e.getPreview());
        assertEquals(103, e.getPreview().length());
    }

    @Test
    @DisplayName("Lines of exactly 100 bytes are not shortened")
    void malformedPreviewLimit() {
        String line = "x".repeat(100);
        MalformedHeaderException e = assertThrows(MalformedHeaderException.class,
                () -> reader("A: 1\n" + line + "\n\n").readMimeHeader());

        assertEquals(line, e.getPreview());
    }

    @Test
    @DisplayName("Continued line keeps every physical line in raw")
    void readContinuedLine() throws IOException {
        TextProtoReader reader = reader("Subject: one\r\n two\n\tthree\r\nNext: x\r\n");

        Line line = reader.readContinuedLine();

        assertEquals("Subject: one two three", line.toString());
        assertEquals("Subject: one\r\n two\n\tthree\r\n", string(line.getRaw()));
        assertEquals("Next: x", reader.readContinuedLine().toString());
        assertNull(reader.readContinuedLine());
    }

    @Test
    @DisplayName("Read dot block as lines")
    void readDotLines() throws IOException {
        TextProtoReader reader = reader("one\r\n..two\r\n.\r\nnext\r\n");

        assertEquals(Arrays.asList("one", ".two"), reader.readDotLines());
        assertEquals("next", reader.readLine().toString());
    }

    @Test
    @DisplayName("Read dot block as bytes")
    void readDotBytes() throws IOException {
        TextProtoReader reader = reader("one\r\n..two\r\n.\r\nnext\r\n");

        assertEquals("one\n.two\n", string(reader.readDotBytes()));
        assertEquals("next", reader.readLine().toString());
    }

    @Test
    @DisplayName("Unfinished dot reader is drained by the next read")
    void drainDotReader() throws IOException {
        TextProtoReader reader = reader("one\r\ntwo\r\n.\r\nnext\r\n");

        assertEquals('o', reader.dotReader().read());
        assertEquals("next", reader.readLine().toString());
    }

    @Test
    @DisplayName("Dot block without terminator is unexpected EOF")
    void dotUnexpectedEof() {
        assertThrows(EOFException.class, () -> reader("one\r\ntwo\r\n").readDotLines());
        assertThrows(EOFException.class, () -> reader("one\r\ntwo\r\n").readDotBytes());
    }
}
