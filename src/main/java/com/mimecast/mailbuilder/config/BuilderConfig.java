package com.mimecast.mailbuilder.config;

import java.io.IOException;
import java.util.Map;

/**
 * Decomposer and builder configuration.
 *
 * <p>This class provides type safe access to the message rebuild settings.
 *
 * <p>Example JSON5:
 * <pre>
 * {
 *   // Line terminator for reconstructed headers and boundary lines.
 *   newline: "\r\n",
 *   maxRfc822Depth: 5,
 *   base64LineLength: 76
 * }
 * </pre>
 */
public class BuilderConfig extends ConfigFoundation {

    /**
     * Default line terminator.
     */
    public static final String DEFAULT_NEWLINE = "\r\n";

    /**
     * Default nested message/rfc822 unwrap limit.
     */
    public static final long DEFAULT_MAX_RFC822_DEPTH = 5L;

    /**
     * Default base64 output line length.
     */
    public static final long DEFAULT_BASE64_LINE_LENGTH = 76L;

    /**
     * Constructs a new BuilderConfig instance with defaults.
     */
    public BuilderConfig() {
        super();
    }

    /**
     * Constructs a new BuilderConfig instance.
     *
     * @param map Configuration map.
     */
    public BuilderConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Loads configuration from a JSON5 file.
     *
     * @param path File path.
     * @return BuilderConfig instance.
     * @throws IOException Unable to read file.
     */
    public static BuilderConfig fromFile(String path) throws IOException {
        return new BuilderConfig(readFile(path));
    }

    /**
     * Loads configuration from a JSON5 string.
     *
     * @param json JSON string.
     * @return BuilderConfig instance.
     * @throws IOException Unable to parse.
     */
    public static BuilderConfig fromJson(String json) throws IOException {
        return new BuilderConfig(readJson(json));
    }

    /**
     * Gets line terminator used for reconstructed header lines and multipart boundary lines.
     *
     * @return Newline string.
     */
    public String getNewline() {
        String newline = getStringProperty("newline", DEFAULT_NEWLINE);
        return newline.isEmpty() ? DEFAULT_NEWLINE : newline;
    }

    /**
     * Gets maximum number of nested message/rfc822 levels to unwrap.
     *
     * @return Depth limit.
     */
    public int getMaxRfc822Depth() {
        return Math.toIntExact(Math.max(0L, getLongProperty("maxRfc822Depth", DEFAULT_MAX_RFC822_DEPTH)));
    }

    /**
     * Gets base64 output line length.
     *
     * @return Line length.
     */
    public int getBase64LineLength() {
        long length = getLongProperty("base64LineLength", DEFAULT_BASE64_LINE_LENGTH);
        return Math.toIntExact(length > 0 ? length : DEFAULT_BASE64_LINE_LENGTH);
    }
}
