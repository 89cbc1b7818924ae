package com.mimecast.mailbuilder.mime;

import com.mimecast.mailbuilder.io.LineInputStream;
import com.mimecast.mailbuilder.mime.headers.MimeHeaders;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * MIME message tree node.
 *
 * <p>A node is a message or a part of one and holds at most one of:
 * <ul>
 *     <li>a raw body for leaf parts;</li>
 *     <li>child parts for multipart bodies;</li>
 *     <li>a nested message for message/rfc822 bodies.</li>
 * </ul>
 *
 * <p>Nodes produced by {@link MessageDecomposer} keep the header block exactly as read.
 * <br>As long as {@link #isHeaderChanged()} is false {@link MessageBuilder} writes those bytes back unmodified.
 * <br>The parent link is a back-reference only, a node owns its parts and nested message.
 *
 * @see MessageDecomposer
 * @see MessageBuilder
 */
public class Message {

    /**
     * Header fields by canonical name.
     */
    private MimeHeaders header = new MimeHeaders();

    /**
     * Header names in original order and spelling.
     */
    private List<String> headerOrder = new ArrayList<>();

    /**
     * Header block as read.
     */
    private byte[] rawOriginalHeader;

    /**
     * Bytes between the raw header and the body as read.
     */
    private byte[] headerSeparator;

    private boolean headerChanged = false;
    private byte[] body = new byte[0];
    private List<Message> parts = new ArrayList<>();
    private Message bodyMessage;
    private String boundary = "";
    private byte[] delimiterSuffix;
    private byte[] trailingBreak;
    private byte[] preamble;
    private byte[] epilogue;
    private boolean decoded = false;
    private String idx = "";
    private int rfc822Depth = 0;
    private Message parent;

    /**
     * Gets header.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getHeader() {
        return header;
    }

    /**
     * Sets header.
     *
     * @param header MimeHeaders instance.
     * @return Self.
     */
    public Message setHeader(MimeHeaders header) {
        this.header = header;
        return this;
    }

    /**
     * Gets header order.
     *
     * @return Unmodifiable list of header names.
     */
    public List<String> getHeaderOrder() {
        return Collections.unmodifiableList(headerOrder);
    }

    /**
     * Gets raw original header.
     *
     * @return Byte array or null for nodes not built by decomposition.
     */
    public byte[] getRawOriginalHeader() {
        return rawOriginalHeader;
    }

    /**
     * Sets raw original header and derives the header order from it.
     * <p>Trailing line terminators are trimmed.
     * <br>Names are taken from every line not starting with a space or tab up to the first colon.
     *
     * @param raw Raw header bytes or null to drop it.
     * @return Self.
     */
    public Message setOriginalHeader(byte[] raw) {
        headerOrder = new ArrayList<>();
        if (raw == null) {
            rawOriginalHeader = null;
            return this;
        }

        int end = raw.length;
        while (end > 0 && (raw[end - 1] == LineInputStream.CR || raw[end - 1] == LineInputStream.LF)) {
            end--;
        }
        rawOriginalHeader = Arrays.copyOf(raw, end);

        String text = new String(rawOriginalHeader, StandardCharsets.ISO_8859_1);
        for (String line : text.split("\n", -1)) {
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            if (line.isEmpty()) {
                break;
            }
            if (line.charAt(0) == ' ' || line.charAt(0) == '\t') {
                continue;
            }

            int colon = line.indexOf(':');
            String name = colon < 0 ? line : line.substring(0, colon);
            name = new String(name.stripTrailing().getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
            headerOrder.add(name);
        }

        return this;
    }

    /**
     * Sets raw original header and the bytes read after it.
     * <p>The header separator becomes the trimmed line terminators followed by the blank line.
     *
     * @param raw       Raw header bytes.
     * @param separator Blank line bytes or an empty array if the header ended at end of input.
     * @return Self.
     */
    public Message setOriginalHeader(byte[] raw, byte[] separator) {
        setOriginalHeader(raw);
        if (raw == null) {
            headerSeparator = null;
            return this;
        }

        int trimmed = raw.length - rawOriginalHeader.length;
        headerSeparator = new byte[trimmed + separator.length];
        System.arraycopy(raw, rawOriginalHeader.length, headerSeparator, 0, trimmed);
        System.arraycopy(separator, 0, headerSeparator, trimmed, separator.length);
        return this;
    }

    /**
     * Gets header separator.
     *
     * @return Bytes written between the raw header and the body or null to generate them.
     */
    public byte[] getHeaderSeparator() {
        return headerSeparator;
    }

    /**
     * Sets header separator.
     *
     * @param headerSeparator Byte array or null.
     * @return Self.
     */
    public Message setHeaderSeparator(byte[] headerSeparator) {
        this.headerSeparator = headerSeparator;
        return this;
    }

    /**
     * Is header changed.
     *
     * @return Boolean.
     */
    public boolean isHeaderChanged() {
        return headerChanged;
    }

    /**
     * Sets header changed.
     * <p>A changed header is rebuilt from the header map instead of the raw bytes.
     *
     * @param headerChanged Boolean.
     * @return Self.
     */
    public Message setHeaderChanged(boolean headerChanged) {
        this.headerChanged = headerChanged;
        return this;
    }

    /**
     * Gets body.
     *
     * @return Byte array.
     */
    public byte[] getBody() {
        return body;
    }

    /**
     * Sets body.
     *
     * @param body Byte array.
     * @return Self.
     */
    public Message setBody(byte[] body) {
        this.body = body != null ? body : new byte[0];
        return this;
    }

    /**
     * Gets parts.
     *
     * @return List of Message.
     */
    public List<Message> getParts() {
        return parts;
    }

    /**
     * Adds part.
     *
     * @param part Message instance.
     * @return Self.
     */
    public Message addPart(Message part) {
        part.parent = this;
        parts.add(part);
        return this;
    }

    /**
     * Is multipart.
     *
     * @return True if the node has parts.
     */
    public boolean isMultipart() {
        return !parts.isEmpty();
    }

    /**
     * Gets body message.
     *
     * @return Message instance or null.
     */
    public Message getBodyMessage() {
        return bodyMessage;
    }

    /**
     * Sets body message.
     *
     * @param bodyMessage Message instance.
     * @return Self.
     */
    public Message setBodyMessage(Message bodyMessage) {
        this.bodyMessage = bodyMessage;
        if (bodyMessage != null) {
            bodyMessage.parent = this;
        }
        return this;
    }

    /**
     * Is rfc822.
     *
     * @return True if the body is a nested message.
     */
    public boolean isRfc822() {
        return bodyMessage != null;
    }

    /**
     * Gets boundary.
     *
     * @return String.
     */
    public String getBoundary() {
        return boundary;
    }

    /**
     * Sets boundary.
     *
     * @param boundary String.
     * @return Self.
     */
    public Message setBoundary(String boundary) {
        this.boundary = boundary != null ? boundary : "";
        return this;
    }

    /**
     * Gets delimiter suffix.
     *
     * @return Padding and line terminator after the boundary opening this part or null.
     */
    public byte[] getDelimiterSuffix() {
        return delimiterSuffix;
    }

    /**
     * Sets delimiter suffix.
     *
     * @param delimiterSuffix Byte array.
     * @return Self.
     */
    public Message setDelimiterSuffix(byte[] delimiterSuffix) {
        this.delimiterSuffix = delimiterSuffix;
        return this;
    }

    /**
     * Gets trailing break.
     *
     * @return Line break between this part and the next delimiter or null.
     */
    public byte[] getTrailingBreak() {
        return trailingBreak;
    }

    /**
     * Sets trailing break.
     *
     * @param trailingBreak Byte array.
     * @return Self.
     */
    public Message setTrailingBreak(byte[] trailingBreak) {
        this.trailingBreak = trailingBreak;
        return this;
    }

    /**
     * Gets preamble.
     *
     * @return Bytes before the first delimiter or null if not decomposed.
     */
    public byte[] getPreamble() {
        return preamble;
    }

    /**
     * Sets preamble.
     *
     * @param preamble Byte array.
     * @return Self.
     */
    public Message setPreamble(byte[] preamble) {
        this.preamble = preamble;
        return this;
    }

    /**
     * Gets epilogue.
     *
     * @return Bytes after the close delimiter or null if not decomposed.
     */
    public byte[] getEpilogue() {
        return epilogue;
    }

    /**
     * Sets epilogue.
     *
     * @param epilogue Byte array.
     * @return Self.
     */
    public Message setEpilogue(byte[] epilogue) {
        this.epilogue = epilogue;
        return this;
    }

    /**
     * Is decoded.
     *
     * @return True if the nested message body was transfer decoded.
     */
    public boolean isDecoded() {
        return decoded;
    }

    /**
     * Sets decoded.
     *
     * @param decoded Boolean.
     * @return Self.
     */
    public Message setDecoded(boolean decoded) {
        this.decoded = decoded;
        return this;
    }

    /**
     * Gets idx.
     *
     * @return Dotted part path.
     */
    public String getIdx() {
        return idx;
    }

    /**
     * Sets idx.
     *
     * @param idx String.
     * @return Self.
     */
    public Message setIdx(String idx) {
        this.idx = idx != null ? idx : "";
        return this;
    }

    /**
     * Gets rfc822 depth.
     *
     * @return Number of message/rfc822 levels unwrapped above this node.
     */
    public int getRfc822Depth() {
        return rfc822Depth;
    }

    /**
     * Sets rfc822 depth.
     *
     * @param rfc822Depth Integer.
     * @return Self.
     */
    public Message setRfc822Depth(int rfc822Depth) {
        this.rfc822Depth = rfc822Depth;
        return this;
    }

    /**
     * Gets parent.
     *
     * @return Message instance or null for the root.
     */
    public Message getParent() {
        return parent;
    }

    /**
     * Merges another node into this one.
     * <p>Header fields of the other node replace ours by their first value, an empty value removes the field.
     * <br>Body, body message, boundary, parts, preamble and epilogue are taken over.
     * <br>The header is marked as changed.
     *
     * @param other Message instance.
     * @return Self.
     */
    public Message merge(Message other) {
        for (String name : other.getHeader().names()) {
            String value = other.getHeader().getValue(name);
            if (!value.isEmpty()) {
                header.set(name, value);
            } else {
                header.remove(name);
            }
        }

        setBodyMessage(other.bodyMessage);
        body = other.body;
        boundary = other.boundary;
        preamble = other.preamble;
        epilogue = other.epilogue;

        parts = new ArrayList<>();
        for (Message part : other.parts) {
            addPart(part);
        }

        headerChanged = true;
        return this;
    }
}
