package com.mimecast.mailbuilder.codec;

import com.mimecast.mailbuilder.config.BuilderConfig;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;

/**
 * Content-Transfer-Encoding codec.
 *
 * <p>Stateless encode and decode for the base64 and quoted-printable transfer encodings.
 * <br>Any other encoding name (7bit, 8bit, binary or none) is passed through unchanged.
 */
public class ContentEncoding {

    /**
     * Base64 encoding name.
     */
    public static final String BASE64 = "base64";

    /**
     * Quoted-Printable encoding name.
     */
    public static final String QUOTED_PRINTABLE = "quoted-printable";

    /**
     * Line separator for wrapped output.
     */
    private final String lineSeparator;

    /**
     * Base64 line length.
     */
    private final int lineLength;

    /**
     * Strict base64 decoder.
     */
    private final Base64 base64 = new Base64(0, null, false, CodecPolicy.STRICT);

    /**
     * Constructs a new ContentEncoding instance with default configuration.
     */
    public ContentEncoding() {
        this(new BuilderConfig());
    }

    /**
     * Constructs a new ContentEncoding instance.
     *
     * @param config BuilderConfig instance.
     */
    public ContentEncoding(BuilderConfig config) {
        this(config.getNewline(), config.getBase64LineLength());
    }

    /**
     * Constructs a new ContentEncoding instance.
     *
     * @param lineSeparator Line separator for wrapped output.
     * @param lineLength    Base64 line length.
     */
    public ContentEncoding(String lineSeparator, int lineLength) {
        this.lineSeparator = lineSeparator;
        this.lineLength = lineLength;
    }

    /**
     * Encodes body with given transfer encoding.
     *
     * @param body     Raw bytes.
     * @param encoding Content-Transfer-Encoding value.
     * @return Encoded bytes.
     */
    public byte[] encode(byte[] body, String encoding) {
        String name = normalize(encoding);

        if (BASE64.equals(name)) {
            String encoded = Base64.encodeBase64String(body);
            return breakLines(encoded, lineLength, lineSeparator).getBytes(StandardCharsets.US_ASCII);

        } else if (QUOTED_PRINTABLE.equals(name)) {
            return QuotedPrintable.encode(body, lineSeparator);
        }

        return body;
    }

    /**
     * Decodes body with given transfer encoding.
     *
     * @param body     Encoded bytes.
     * @param encoding Content-Transfer-Encoding value.
     * @return DecodedContent instance.
     * @throws TransferDecodeException Invalid payload.
     */
    public DecodedContent decode(byte[] body, String encoding) throws TransferDecodeException {
        String name = normalize(encoding);

        if (BASE64.equals(name)) {
            byte[] trimmed = StringUtils.strip(new String(body, StandardCharsets.ISO_8859_1), " \r\n\t")
                    .getBytes(StandardCharsets.ISO_8859_1);

            if (!Base64.isBase64(trimmed)) {
                throw new TransferDecodeException("Invalid base64 alphabet");
            }

            try {
                return new DecodedContent(base64.decode(trimmed), true);
            } catch (IllegalArgumentException e) {
                throw new TransferDecodeException("Invalid base64 payload: " + e.getMessage(), e);
            }

        } else if (QUOTED_PRINTABLE.equals(name)) {
            try {
                return new DecodedContent(QuotedPrintable.decode(body), true);
            } catch (DecoderException e) {
                throw new TransferDecodeException("Invalid quoted-printable payload: " + e.getMessage(), e);
            }
        }

        return new DecodedContent(body, false);
    }

    /**
     * Breaks a string into lines of given length.
     * <p>No separator is added after the last line.
     *
     * @param data          String to wrap.
     * @param length        Characters per line.
     * @param lineSeparator Separator.
     * @return Wrapped string.
     */
    public static String breakLines(String data, int length, String lineSeparator) {
        StringBuilder sb = new StringBuilder(data.length() + (data.length() / Math.max(1, length) + 1) * lineSeparator.length());

        for (int start = 0; start < data.length(); start += length) {
            if (start > 0) {
                sb.append(lineSeparator);
            }
            sb.append(data, start, Math.min(data.length(), start + length));
        }

        return sb.toString();
    }

    /**
     * Normalizes encoding name.
     *
     * @param encoding Encoding value.
     * @return Lower case trimmed name or empty string.
     */
    private static String normalize(String encoding) {
        return encoding == null ? "" : encoding.trim().toLowerCase();
    }
}
