package com.sitewatch.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints used for change detection.
 */
public final class HashingUtils {
    private HashingUtils() {
    }

    /**
     * @return lowercase hex SHA-256 of {@code content}
     */
    public static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public static String sha256(String content) {
        return sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Fingerprint of a fetched body after volatile fragments are removed, so that clocks and
     * counters on a page do not register as content changes.
     */
    public static String contentFingerprint(String body) {
        return sha256(ContentNormalizer.forComparison(body));
    }
}
