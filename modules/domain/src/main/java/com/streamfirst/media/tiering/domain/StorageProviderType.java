package com.streamfirst.media.tiering.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of storage tiers an asset can live on. Exactly one of these is recorded per catalog
 * row as the current location of truth.
 */
public enum StorageProviderType {
    /** Container-local volume, the always-available baseline. */
    LOCAL("local", true),
    /** Removable SSD cache mounted next to the container. */
    CACHE("cache", true),
    /** Private remote object store bucket. */
    REMOTE("remote", false);

    private final String wireName;
    private final boolean legacyLocal;

    StorageProviderType(String wireName, boolean legacyLocal) {
        this.wireName = wireName;
        this.legacyLocal = legacyLocal;
    }

    /**
     * Name stored in the catalog column.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Whether rows on this tier are swept by the legacy migration to the object store.
     */
    public boolean isLegacyLocal() {
        return legacyLocal;
    }

    /**
     * Parses a catalog value. Accepts the current wire names and the historical
     * {@code docker}, {@code ssd} and {@code s3} spellings.
     */
    public static Optional<StorageProviderType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "local", "docker" -> Optional.of(LOCAL);
            case "cache", "ssd" -> Optional.of(CACHE);
            case "remote", "s3" -> Optional.of(REMOTE);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
