package com.phillippitts.voicebridge.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Produces opaque lowercase-hex tokens for session ids, request ids and claim tokens.
 */
public final class TokenGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private TokenGenerator() {}

    /**
     * @param bytes number of random bytes; the token has twice as many characters
     * @return random hex token
     */
    public static String hex(int bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("bytes must be positive");
        }
        byte[] buf = new byte[bytes];
        RANDOM.nextBytes(buf);
        return HEX.formatHex(buf);
    }
}
