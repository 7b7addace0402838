package com.streamfirst.media.tiering.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, provider-agnostic location of an asset's bytes:
 * {@code profiles/{personId}/{yyyy}/{mm}/{assetId}.{extension}}.
 *
 * <p>Sharding by subject and month bounds directory fan-out on the filesystem tiers. The same
 * string is used as the object key suffix on the remote store.
 *
 * @param personId owning subject
 * @param year four digit year
 * @param month month of year, 1-12
 * @param assetId asset identifier, used as the file stem
 * @param extension file extension without the dot
 */
public record CanonicalPath(String personId, int year, int month, String assetId, String extension) {

    public static final String ROOT = "profiles";

    private static final Pattern PATTERN =
            Pattern.compile("^profiles/([^/]+)/(\\d{4})/(\\d{2})/([^/]+)\\.(\\w+)$");

    public CanonicalPath {
        requireSegment(personId, "personId");
        requireSegment(assetId, "assetId");
        requireSegment(extension, "extension");
        if (!extension.matches("\\w+")) {
            throw new IllegalArgumentException("Extension must be alphanumeric: " + extension);
        }
        if (year < 1000 || year > 9999) {
            throw new IllegalArgumentException("Year must have four digits: " + year);
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
    }

    /**
     * Builds the canonical path for an asset written on {@code date}.
     */
    public static String generate(String personId, String assetId, String extension, LocalDate date) {
        Objects.requireNonNull(date, "date cannot be null");
        return new CanonicalPath(personId, date.getYear(), date.getMonthValue(), assetId, extension).path();
    }

    /**
     * Builds the canonical path for an asset written at {@code instant}, bucketed by UTC month.
     */
    public static String generate(String personId, String assetId, String extension, Instant instant) {
        Objects.requireNonNull(instant, "instant cannot be null");
        return generate(personId, assetId, extension, LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    /**
     * Inverse of {@link #generate}. Empty for any path not following the scheme.
     */
    public static Optional<CanonicalPath> parse(String relativePath) {
        if (relativePath == null) {
            return Optional.empty();
        }
        Matcher m = PATTERN.matcher(relativePath);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new CanonicalPath(m.group(1), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), m.group(4), m.group(5)));
        } catch (IllegalArgumentException e) {
            // matches the layout but not the value rules (year, month, segments)
            return Optional.empty();
        }
    }

    /**
     * File name component, {@code {assetId}.{extension}}.
     */
    public String fileName() {
        return assetId + "." + extension;
    }

    public String path() {
        return String.format("%s/%s/%04d/%02d/%s", ROOT, personId, year, month, fileName());
    }

    @Override
    public String toString() {
        return path();
    }

    private static void requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        if (value.contains("/") || value.contains("..")) {
            throw new IllegalArgumentException(name + " must be a single path segment: " + value);
        }
    }
}
