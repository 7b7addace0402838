package com.streamfirst.media.tiering.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time counts of the catalog used for before/after comparison.
 *
 * @param takenAt capture time
 * @param totalAssets number of rows
 * @param byProvider rows per tier
 * @param byOrigin row count and byte total per origin ({@code unknown} when absent)
 * @param duplicateGroups number of (sourceUrl, personId) groups with more than one row
 */
public record CatalogSnapshot(Instant takenAt, long totalAssets, Map<StorageProviderType, Long> byProvider,
                              Map<String, OriginStats> byOrigin, int duplicateGroups) {

    public CatalogSnapshot {
        byProvider = Map.copyOf(byProvider);
        byOrigin = Map.copyOf(byOrigin);
    }

    public long count(StorageProviderType type) {
        return byProvider.getOrDefault(type, 0L);
    }

    public record OriginStats(long count, long sizeBytes) {}
}
