package com.streamfirst.media.tiering.domain;

import java.util.List;

/**
 * Outcome of the legacy local-tier sweep.
 *
 * @param dryRun whether mutations were suppressed
 * @param candidates rows found on a legacy local tier
 * @param located rows whose bytes were found under one of the known layouts
 * @param migrated rows moved to the object store (always zero on a dry run)
 * @param failed rows whose upload or catalog update failed
 * @param skipped rows whose bytes were not found; left untouched
 * @param errors capped list of failure messages
 */
public record LegacyMigrationResult(boolean dryRun, int candidates, int located, int migrated,
                                    int failed, int skipped, List<String> errors) {

    public LegacyMigrationResult {
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return failed == 0;
    }
}
