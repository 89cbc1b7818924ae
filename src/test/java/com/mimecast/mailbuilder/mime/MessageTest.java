package com.mimecast.mailbuilder.mime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    @Test
    @DisplayName("New message is an empty leaf")
    void empty() {
        Message message = new Message();

        assertFalse(message.isMultipart());
        assertFalse(message.isRfc822());
        assertEquals(0, message.getBody().length);
        assertNull(message.getRawOriginalHeader());
        assertTrue(message.getHeaderOrder().isEmpty());
        assertEquals("", message.getIdx());
        assertEquals("", message.getBoundary());
        assertNull(message.getParent());
    }

    @Test
    @DisplayName("Parts and body message link back to parent")
    void parent() {
        Message root = new Message();
        Message part = new Message();
        Message nested = new Message();

        root.addPart(part);
        part.setBodyMessage(nested);

        assertTrue(root.isMultipart());
        assertSame(root, part.getParent());
        assertTrue(part.isRfc822());
        assertSame(part, nested.getParent());
    }

    @Test
    @DisplayName("Header order is derived from the raw header")
    void headerOrder() {
        Message message = new Message().setOriginalHeader(("From: a\r\n" +
                "Subject: folded\r\n" +
                " continuation\r\n" +
                "received: one\r\n" +
                "Received : two\r\n" +
                "\r\n").getBytes(StandardCharsets.UTF_8));

        assertEquals(Arrays.asList("From", "Subject", "received", "Received"), message.getHeaderOrder());
        assertEquals("From: a\r\nSubject: folded\r\n continuation\r\nreceived: one\r\nReceived : two",
                new String(message.getRawOriginalHeader(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Trimmed terminators and blank line form the header separator")
    void headerSeparator() {
        Message message = new Message().setOriginalHeader("A: 1\n".getBytes(StandardCharsets.UTF_8),
                "\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("A: 1", new String(message.getRawOriginalHeader(), StandardCharsets.UTF_8));
        assertEquals("\n\n", new String(message.getHeaderSeparator(), StandardCharsets.UTF_8));

        message.setOriginalHeader(null, new byte[0]);
        assertNull(message.getHeaderSeparator());
        assertNull(new Message().getHeaderSeparator());
    }

    @Test
    @DisplayName("Dropping the raw header clears the order")
    void dropRawHeader() {
        Message message = new Message().setOriginalHeader("A: 1".getBytes(StandardCharsets.UTF_8));
        message.setOriginalHeader(null);

        assertNull(message.getRawOriginalHeader());
        assertTrue(message.getHeaderOrder().isEmpty());
    }

    @Test
    @DisplayName("Merge overrides fields, deletes empty ones and takes structure")
    void merge() {
        Message target = new Message();
        target.getHeader().add("A", "1").add("B", "2").add("Keep", "k");
        target.setBody("old".getBytes(StandardCharsets.UTF_8));

        Message other = new Message().setBoundary("xyz");
        other.getHeader().add("A", "9").add("A", "10").add("B", "").add("C", "3");
        other.addPart(new Message()).addPart(new Message());

        target.merge(other);

        assertEquals("9", target.getHeader().getValue("A"));
        assertEquals(1, target.getHeader().getAll("A").size());
        assertFalse(target.getHeader().contains("B"));
        assertEquals("3", target.getHeader().getValue("C"));
        assertEquals("k", target.getHeader().getValue("Keep"));
        assertEquals(0, target.getBody().length);
        assertEquals("xyz", target.getBoundary());
        assertEquals(2, target.getParts().size());
        assertSame(target, target.getParts().get(0).getParent());
        assertTrue(target.isHeaderChanged());
    }
}
