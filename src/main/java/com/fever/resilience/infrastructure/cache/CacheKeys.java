package com.fever.resilience.infrastructure.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fixed-length, filesystem-safe digests of logical cache keys
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String sha256Hex(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Key for the result of {@code operation} applied to {@code input}
     */
    public static String forCall(String operation, Object input) {
        return sha256Hex(operation + ":" + input);
    }
}
