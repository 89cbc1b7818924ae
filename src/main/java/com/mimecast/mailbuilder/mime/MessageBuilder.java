package com.mimecast.mailbuilder.mime;

import com.mimecast.mailbuilder.codec.Boundaries;
import com.mimecast.mailbuilder.codec.ContentEncoding;
import com.mimecast.mailbuilder.config.BuilderConfig;
import com.mimecast.mailbuilder.io.LineInputStream;
import com.mimecast.mailbuilder.mime.headers.MimeHeaders;
import com.mimecast.mailbuilder.textproto.HeaderKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Message builder.
 *
 * <p>Serializes a {@link Message} tree back to bytes.
 * <br>Unchanged decomposed headers are written from their raw bytes, changed or synthetic ones are rebuilt
 * <br>in original field order followed by any new fields.
 * <br>Multipart framing reuses the decomposed preamble and epilogue and generates a boundary where none is set.
 * <br>Nested messages that were transfer decoded during decomposition are encoded again.
 *
 * <p>Example usage:
 * <pre>
 * Message message = new MessageDecomposer().decompose(bytes);
 * MessageBuilder builder = new MessageBuilder();
 * builder.setHeaderField(message, "Subject", "Rewritten");
 * byte[] rebuilt = builder.build(message);
 * </pre>
 *
 * @see MessageDecomposer
 */
public class MessageBuilder {
    private static final Logger log = LogManager.getLogger(MessageBuilder.class);

    private final ContentEncoding encoding;
    private String newline;

    /**
     * Constructs a new MessageBuilder instance with default configuration.
     */
    public MessageBuilder() {
        this(new BuilderConfig());
    }

    /**
     * Constructs a new MessageBuilder instance.
     *
     * @param config BuilderConfig instance.
     */
    public MessageBuilder(BuilderConfig config) {
        this.newline = config.getNewline();
        this.encoding = new ContentEncoding(config);
    }

    /**
     * Sets newline.
     *
     * @param newline Line terminator for rebuilt headers and boundary lines.
     * @return Self.
     */
    public MessageBuilder setNewline(String newline) {
        this.newline = newline;
        return this;
    }

    /**
     * Gets newline.
     *
     * @return String.
     */
    public String getNewline() {
        return newline;
    }

    /**
     * Builds message bytes.
     *
     * @param message Message instance.
     * @return Byte array.
     */
    public byte[] build(Message message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            writeTo(message, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not fail.
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Writes message bytes to stream.
     *
     * @param message Message instance.
     * @param out     OutputStream instance.
     * @throws IOException Unable to write.
     */
    public void writeTo(Message message, OutputStream out) throws IOException {
        List<Object> items = new ArrayList<>();
        items.add(message);
        write(items, out);
    }

    /**
     * Builds header bytes.
     * <p>Without line terminator after the last field.
     *
     * @param message Message instance.
     * @return Byte array.
     */
    public byte[] buildHeader(Message message) {
        byte[] raw = message.getRawOriginalHeader();
        if (raw != null && raw.length > 0 && !message.isHeaderChanged()) {
            return trimTerminators(raw);
        }

        MimeHeaders header = message.getHeader();
        List<String> lines = new ArrayList<>();
        Map<String, Integer> emitted = new HashMap<>();

        for (String name : message.getHeaderOrder()) {
            String key = HeaderKeys.canonical(name);
            List<String> values = header.getAll(key);
            int next = emitted.getOrDefault(key, 0);
            if (next < values.size()) {
                lines.add(name + ": " + values.get(next));
                emitted.put(key, next + 1);
            }
        }

        for (String key : header.names()) {
            List<String> values = header.getAll(key);
            for (int i = emitted.getOrDefault(key, 0); i < values.size(); i++) {
                if (!values.get(i).isEmpty()) {
                    lines.add(key + ": " + values.get(i));
                }
            }
        }

        return String.join(newline, lines).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Builds body bytes.
     * <p>The body is returned as held by the tree, a decoded nested message is not encoded here.
     *
     * @param message Message instance.
     * @return Byte array.
     */
    public byte[] buildBody(Message message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(bodyItems(message), out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not fail.
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Sets a header field and patches the raw header in place.
     * <p>The first top-level line of the field, matched case insensitively, is cut together with its continuation lines
     * <br>and the new field line is put in its place.
     * <br>A field not present is appended at the end of the raw header.
     * <br>The new line takes the terminator of the line it replaces or follows.
     * <br>Header order is derived again from the patched raw header.
     *
     * @param message Message instance.
     * @param field   Header field name.
     * @param value   Header field value.
     */
    public void setHeaderField(Message message, String field, String value) {
        message.getHeader().set(field, value);

        byte[] raw = message.getRawOriginalHeader();
        if (raw == null) {
            return;
        }

        String text = new String(raw, StandardCharsets.ISO_8859_1);
        String pair = new String((field + ": " + value).getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);

        byte[] separator = message.getHeaderSeparator();

        String patched;
        int start = findField(text, field);
        if (start < 0) {
            String terminator = terminator(text, separator);
            if (text.isEmpty()) {
                patched = pair;
                if (separator != null) {
                    // The new field needs its terminator and the header a blank line.
                    separator = separator.length > 0 ? concat(bytes(terminator), separator) : bytes(terminator + terminator);
                }
            } else {
                patched = text + terminator + pair;
            }
        } else {
            int end = lineEnd(text, start);
            while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
                end = lineEnd(text, end);
            }

            String suffix = text.substring(end);
            String terminator = text.startsWith("\r\n", end - 2) ? "\r\n" : "\n";
            patched = text.substring(0, start) + pair + (suffix.isEmpty() ? "" : terminator + suffix);
        }

        message.setOriginalHeader(patched.getBytes(StandardCharsets.ISO_8859_1))
                .setHeaderSeparator(separator);
    }

    /**
     * Writes items in order.
     * <p>Byte arrays are written as they are, messages are expanded in place.
     *
     * @param items List of byte[] or Message.
     * @param out   OutputStream instance.
     * @throws IOException Unable to write.
     */
    private void write(List<Object> items, OutputStream out) throws IOException {
        Deque<Object> stack = new ArrayDeque<>();
        pushAll(stack, items);

        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof byte[]) {
                out.write((byte[]) item);
            } else {
                pushAll(stack, messageItems((Message) item));
            }
        }
    }

    /**
     * Pushes items so the first one is popped first.
     *
     * @param stack Stack.
     * @param items Items.
     */
    private static void pushAll(Deque<Object> stack, List<Object> items) {
        for (int i = items.size() - 1; i >= 0; i--) {
            stack.push(items.get(i));
        }
    }

    /**
     * Gets items of a whole message.
     *
     * @param message Message instance.
     * @return List of byte[] or Message.
     */
    private List<Object> messageItems(Message message) {
        List<Object> items = new ArrayList<>();

        byte[] header = buildHeader(message);
        items.add(header);
        items.add(headerSeparator(message, header));

        if (message.isDecoded()) {
            // Nested build bounded by the rfc822 depth.
            String name = message.getHeader().getValue("Content-Transfer-Encoding");
            items.add(encoding.encode(buildBody(message), name));
        } else {
            items.addAll(bodyItems(message));
        }

        return items;
    }

    /**
     * Gets bytes between header and body.
     * <p>An unchanged decomposed header gets the bytes read after it, anything else a blank line.
     *
     * @param message Message instance.
     * @param header  Built header bytes.
     * @return Byte array.
     */
    private byte[] headerSeparator(Message message, byte[] header) {
        byte[] raw = message.getRawOriginalHeader();
        byte[] separator = message.getHeaderSeparator();
        if (separator != null && raw != null && !message.isHeaderChanged() && (raw.length > 0 || header.length == 0)) {
            return separator;
        }

        return bytes(header.length == 0 ? newline : newline + newline);
    }

    /**
     * Gets items of a message body.
     *
     * @param message Message instance.
     * @return List of byte[] or Message.
     */
    private List<Object> bodyItems(Message message) {
        List<Object> items = new ArrayList<>();

        if (message.isRfc822()) {
            items.add(message.getBodyMessage());
        } else if (message.getBody().length > 0) {
            items.add(message.getBody());
        }

        if (message.isMultipart()) {
            if (message.getBoundary().isEmpty()) {
                message.setBoundary(Boundaries.random());
                log.debug("Generated boundary for part {}", message.getIdx());
            }

            String delimiter = "--" + message.getBoundary();
            List<Message> parts = message.getParts();

            if (message.getPreamble() != null) {
                items.add(message.getPreamble());
                for (int i = 0; i < parts.size(); i++) {
                    Message part = parts.get(i);
                    if (i > 0) {
                        items.add(orNewline(parts.get(i - 1).getTrailingBreak()));
                    }
                    items.add(bytes(delimiter));
                    items.add(orNewline(part.getDelimiterSuffix()));
                    items.add(part);
                }
                items.add(orNewline(parts.get(parts.size() - 1).getTrailingBreak()));
                items.add(bytes(delimiter + "--"));
                if (message.getEpilogue() != null) {
                    items.add(message.getEpilogue());
                }
            } else {
                for (int i = 0; i < parts.size(); i++) {
                    items.add(bytes((i > 0 ? newline : "") + newline + delimiter + newline));
                    items.add(parts.get(i));
                }
                items.add(bytes(newline + delimiter + "--" + newline));
            }
        }

        return items;
    }

    /**
     * Finds the first top-level line of a field.
     *
     * @param text  Raw header text.
     * @param field Field name.
     * @return Line start or -1.
     */
    private static int findField(String text, String field) {
        int start = 0;
        while (start < text.length()) {
            char first = text.charAt(start);
            int end = lineEnd(text, start);
            if (first != ' ' && first != '\t') {
                int colon = text.indexOf(':', start);
                if (colon >= 0 && colon < end && text.substring(start, colon).stripTrailing().equalsIgnoreCase(field)) {
                    return start;
                }
            }
            start = end;
        }
        return -1;
    }

    /**
     * Gets the line terminator to join a new last field with.
     * <p>Taken from the separator read after the header, else from the last header line, else the configured newline.
     *
     * @param text      Raw header text.
     * @param separator Header separator or null.
     * @return Line terminator.
     */
    private String terminator(String text, byte[] separator) {
        if (separator != null && separator.length > 0) {
            if (separator[0] == LineInputStream.LF) {
                return "\n";
            }
            if (separator.length > 1 && separator[0] == LineInputStream.CR && separator[1] == LineInputStream.LF) {
                return "\r\n";
            }
        }

        int lf = text.lastIndexOf('\n');
        if (lf >= 0) {
            return lf > 0 && text.charAt(lf - 1) == '\r' ? "\r\n" : "\n";
        }

        return newline;
    }

    /**
     * Gets the start of the next line.
     *
     * @param text  Text.
     * @param start Line start.
     * @return Index after the line terminator or text length.
     */
    private static int lineEnd(String text, int start) {
        int lf = text.indexOf('\n', start);
        return lf < 0 ? text.length() : lf + 1;
    }

    /**
     * Trims trailing line terminators.
     *
     * @param raw Byte array.
     * @return Byte array.
     */
    private static byte[] trimTerminators(byte[] raw) {
        int end = raw.length;
        while (end > 0 && (raw[end - 1] == LineInputStream.CR || raw[end - 1] == LineInputStream.LF)) {
            end--;
        }
        return end == raw.length ? raw : Arrays.copyOf(raw, end);
    }

    /**
     * Gets framing bytes as read or the configured newline for parts not decomposed.
     *
     * @param read Byte array or null.
     * @return Byte array.
     */
    private byte[] orNewline(byte[] read) {
        return read != null ? read : bytes(newline);
    }

    /**
     * Concatenates byte arrays.
     *
     * @param first  Byte array.
     * @param second Byte array.
     * @return Byte array.
     */
    private static byte[] concat(byte[] first, byte[] second) {
        byte[] joined = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, joined, first.length, second.length);
        return joined;
    }

    /**
     * Gets UTF-8 bytes.
     *
     * @param text String.
     * @return Byte array.
     */
    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
