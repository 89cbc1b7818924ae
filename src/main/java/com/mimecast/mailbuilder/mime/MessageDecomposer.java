package com.mimecast.mailbuilder.mime;

import com.mimecast.mailbuilder.codec.ContentEncoding;
import com.mimecast.mailbuilder.codec.DecodedContent;
import com.mimecast.mailbuilder.config.BuilderConfig;
import com.mimecast.mailbuilder.mime.headers.MimeHeaders;
import com.mimecast.mailbuilder.mime.multipart.MultipartPart;
import com.mimecast.mailbuilder.mime.multipart.MultipartReader;
import com.mimecast.mailbuilder.textproto.HeaderBlock;
import com.mimecast.mailbuilder.textproto.TextProtoReader;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Message decomposer.
 *
 * <p>Builds a {@link Message} tree from raw bytes.
 * <br>Header blocks are read with {@link TextProtoReader} keeping their raw bytes and field order.
 * <br>Multipart bodies are split with {@link MultipartReader}, each part becoming a child node.
 * <br>Bodies of message/rfc822 parts are transfer decoded and parsed as nested messages up to a configured depth.
 *
 * <p>Multipart nesting is walked with a work-list so deeply nested input cannot exhaust the call stack.
 * <br>Only the bounded message/rfc822 unwrapping starts a nested decomposition.
 *
 * <p>Example usage:
 * <pre>
 * Message message = new MessageDecomposer().decompose(bytes);
 * message.getParts().get(0).getHeader().getValue("Content-Type");
 * </pre>
 *
 * @see MessageBuilder
 */
public class MessageDecomposer {
    private static final Logger log = LogManager.getLogger(MessageDecomposer.class);

    /**
     * Content type prefix of nested messages.
     */
    private static final String RFC822 = "message/rfc822";

    private final int maxRfc822Depth;
    private final ContentEncoding encoding;

    /**
     * Constructs a new MessageDecomposer instance with default configuration.
     */
    public MessageDecomposer() {
        this(new BuilderConfig());
    }

    /**
     * Constructs a new MessageDecomposer instance.
     *
     * @param config BuilderConfig instance.
     */
    public MessageDecomposer(BuilderConfig config) {
        this.maxRfc822Depth = config.getMaxRfc822Depth();
        this.encoding = new ContentEncoding(config);
    }

    /**
     * Decomposes a message read from a stream.
     *
     * @param stream InputStream instance.
     * @return Message instance.
     * @throws IOException Unable to read or malformed message.
     */
    public Message decompose(InputStream stream) throws IOException {
        return decompose(stream.readAllBytes(), "");
    }

    /**
     * Decomposes a message.
     *
     * @param raw Raw message bytes.
     * @return Message instance.
     * @throws IOException Malformed header or multipart body.
     */
    public Message decompose(byte[] raw) throws IOException {
        return decompose(raw, "");
    }

    /**
     * Decomposes a message with given part path prefix.
     *
     * @param raw Raw message bytes.
     * @param idx Part path of the root node.
     * @return Message instance.
     * @throws IOException Malformed header or multipart body.
     */
    public Message decompose(byte[] raw, String idx) throws IOException {
        return decompose(raw, idx, 0);
    }

    /**
     * Extracts multipart boundary from headers.
     *
     * @param headers MimeHeaders instance.
     * @return Boundary or null if none.
     * @throws ParseException Unparseable Content-Type value.
     */
    public String extractBoundary(MimeHeaders headers) throws ParseException {
        String value = headers.getValue("Content-Type");
        if (StringUtils.isBlank(value)) {
            return null;
        }

        String boundary = new ContentType(value).getParameter("boundary");
        return StringUtils.isEmpty(boundary) ? null : boundary;
    }

    /**
     * Decomposes a message at given rfc822 depth.
     * <p>Every node of the resulting tree carries the depth.
     *
     * @param raw   Raw message bytes.
     * @param idx   Part path of the root node.
     * @param depth Number of message/rfc822 levels unwrapped above.
     * @return Message instance.
     * @throws IOException Malformed header or multipart body.
     */
    private Message decompose(byte[] raw, String idx, int depth) throws IOException {
        TextProtoReader reader = new TextProtoReader(new ByteArrayInputStream(raw));
        HeaderBlock block = reader.readMimeHeader();

        Message root = new Message()
                .setHeader(block.getHeaders())
                .setOriginalHeader(block.getRaw(), block.getSeparator())
                .setIdx(idx)
                .setRfc822Depth(depth);

        Deque<Pending> pending = new ArrayDeque<>();
        pending.add(new Pending(root, reader.readRemaining()));

        while (!pending.isEmpty()) {
            Pending next = pending.poll();
            readParts(next.message, next.body, pending);
        }

        return root;
    }

    /**
     * Extracts parts, nested message or body of a node.
     * <p>Child parts are queued for extraction.
     *
     * @param message Message instance.
     * @param body    Body bytes.
     * @param pending Work-list.
     * @throws IOException Malformed multipart body or part header.
     */
    private void readParts(Message message, byte[] body, Deque<Pending> pending) throws IOException {
        String boundary = null;
        try {
            boundary = extractBoundary(message.getHeader());
        } catch (ParseException e) {
            log.debug("Treating part {} as non-multipart, unparseable Content-Type: {}", message.getIdx(), e.getMessage());
        }

        if (boundary != null) {
            message.setBoundary(boundary);

            MultipartReader reader = new MultipartReader(body, boundary);
            int count = 0;
            MultipartPart part;
            while ((part = reader.nextPart()) != null) {
                count++;

                Message child = new Message()
                        .setHeader(part.getHeaders())
                        .setOriginalHeader(part.getRawHeader(), part.getHeaderSeparator())
                        .setDelimiterSuffix(part.getDelimiterSuffix())
                        .setTrailingBreak(part.getTrailingBreak())
                        .setIdx(message.getIdx().isEmpty() ? String.valueOf(count) : message.getIdx() + "-" + count)
                        .setRfc822Depth(message.getRfc822Depth());

                message.addPart(child);
                pending.add(new Pending(child, part.getBody()));
            }

            if (count > 0) {
                message.setPreamble(reader.getPreamble());
                message.setEpilogue(reader.getEpilogue());
            } else {
                // Close delimiter only, keep whatever was there.
                message.setBody(body);
            }
            return;
        }

        String contentType = StringUtils.strip(message.getHeader().getValue("Content-Type"), " \t");
        if (contentType.startsWith(RFC822) && message.getRfc822Depth() < maxRfc822Depth) {
            Message nested = unwrap(message, body);
            if (nested != null) {
                message.setBodyMessage(nested);
                return;
            }
        }

        message.setBody(body);
    }

    /**
     * Attempts to parse a message/rfc822 body as a nested message.
     *
     * @param message Message instance.
     * @param body    Body bytes.
     * @return Nested Message instance or null if the body is not a parseable message.
     */
    private Message unwrap(Message message, byte[] body) {
        try {
            DecodedContent decoded = encoding.decode(body, message.getHeader().getValue("Content-Transfer-Encoding"));
            Message nested = decompose(decoded.getBytes(), message.getIdx() + "-0", message.getRfc822Depth() + 1);
            message.setDecoded(decoded.isTransformed());
            return nested;

        } catch (IOException e) {
            log.debug("Keeping part {} as opaque body, unable to unwrap message/rfc822: {}", message.getIdx(), e.getMessage());
            return null;
        }
    }

    /**
     * Node awaiting part extraction.
     */
    private static class Pending {
        private final Message message;
        private final byte[] body;

        Pending(Message message, byte[] body) {
            this.message = message;
            this.body = body;
        }
    }
}
