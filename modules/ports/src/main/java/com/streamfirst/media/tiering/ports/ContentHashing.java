package com.streamfirst.media.tiering.ports;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Hashing and naming helpers shared by all providers.
 */
public final class ContentHashing {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final Map<String, String> MIME_TYPES = Map.of(
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "png", "image/png",
            "gif", "image/gif",
            "webp", "image/webp",
            "mp4", "video/mp4",
            "webm", "video/webm",
            "mov", "video/quicktime");

    private ContentHashing() {}

    /**
     * Lowercase hex SHA-256 of {@code data}.
     */
    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Content type derived from the file extension.
     */
    public static String mimeTypeFor(String relativePath) {
        String name = fileName(relativePath);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_MIME_TYPE;
        }
        return MIME_TYPES.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), DEFAULT_MIME_TYPE);
    }

    /**
     * Last path component.
     */
    public static String fileName(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }
}
