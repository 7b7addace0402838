package com.streamfirst.media.tiering.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Summary of a full consolidation run: dedup, legacy migration, broken scan.
 * Broken references are reported only; they are never removed by the run itself.
 */
@Value
@Builder
public class ConsolidationReport {

    @NonNull Instant startedAt;
    @NonNull Instant finishedAt;
    boolean dryRun;

    @NonNull CatalogSnapshot before;
    @NonNull CatalogSnapshot after;

    @NonNull DeduplicationResult deduplication;
    @NonNull LegacyMigrationResult migration;
    @NonNull BrokenScanResult brokenScan;

    @Singular
    List<String> errors;

    public int duplicatesRemoved() {
        return deduplication.duplicatesRemoved();
    }

    public int assetsMigrated() {
        return migration.migrated();
    }

    public int brokenReferencesFound() {
        return brokenScan.broken().size();
    }
}
