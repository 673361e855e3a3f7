package com.exhibition.ledger.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex digest helpers used for identity hashing.
 */
public final class Digests {

    private Digests() {
        // Utility class
    }

    /**
     * Returns the first {@code length} lowercase hex characters of the SHA-256 digest of the UTF-8 input.
     */
    public static String sha256Prefix(String input, int length) {
        return prefix("SHA-256", input, length);
    }

    /**
     * Returns the first {@code length} lowercase hex characters of the MD5 digest of the UTF-8 input.
     */
    public static String md5Prefix(String input, int length) {
        return prefix("MD5", input, length);
    }

    private static String prefix(String algorithm, String input, int length) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(hash);
            return hex.substring(0, Math.min(length, hex.length()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
