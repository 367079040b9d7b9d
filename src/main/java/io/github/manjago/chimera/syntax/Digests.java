package io.github.manjago.chimera.syntax;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by coordinates, change detection and persistence.
 */
public final class Digests {

    /** Bytes kept for coordinate segments (16 hex chars) */
    private static final int SHORT_LENGTH = 8;

    private static final HexFormat HEX = HexFormat.of();

    private Digests() {}

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        return HEX.formatHex(sha256(bytes));
    }

    /**
     * Truncated digest used as an unordered-collection coordinate segment.
     */
    public static String shortHex(String text) {
        byte[] full = sha256(text.getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(full, 0, SHORT_LENGTH);
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
