package com.mimecast.mailbuilder.codec;

import org.apache.commons.codec.binary.Hex;

import java.security.SecureRandom;

/**
 * Multipart boundary generator.
 */
public class Boundaries {

    /**
     * Random bytes per boundary.
     */
    private static final int BOUNDARY_BYTES = 30;

    private static final SecureRandom random = new SecureRandom();

    /**
     * Private constructor.
     */
    private Boundaries() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Generates a random boundary.
     * <p>Thirty random bytes rendered as 60 lower case hex characters.
     *
     * @return Boundary string.
     */
    public static String random() {
        byte[] bytes = new byte[BOUNDARY_BYTES];
        random.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
