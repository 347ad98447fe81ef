package io.codescalpel.license;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Helpers for referring to license tokens without exposing them.
 *
 * <p>A token is only ever identified outside this module by its SHA-256 hash, and
 * in logs and error messages by a truncated hint of that hash.
 */
public final class LicenseTokens {

    private LicenseTokens() {}

    /**
     * Hex-encoded SHA-256 of the stripped token.
     */
    public static String sha256(String token) {
        String normalized = token == null ? "" : token.strip();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Short, non-sensitive identifier for a token hash (e.g. "3fa2c1...9be07d").
     */
    public static String hashHint(String tokenHash) {
        String h = tokenHash == null ? "" : tokenHash.strip();
        if (h.length() <= 12) {
            return h;
        }
        return h.substring(0, 6) + "..." + h.substring(h.length() - 6);
    }

    /**
     * Hash hint computed directly from a token.
     */
    public static String hintFor(String token) {
        return hashHint(sha256(token));
    }
}
