package com.streamfirst.media.tiering.domain;

import java.util.List;

/**
 * Outcome of the explicit broken-row cleanup step.
 *
 * @param dryRun whether mutations were suppressed
 * @param confirmed references still absent on re-check
 * @param removed rows deleted from the catalog
 * @param reappeared references whose bytes were present on re-check; kept
 * @param errors capped list of failure messages
 */
public record BrokenCleanupResult(boolean dryRun, int confirmed, int removed, int reappeared,
                                  List<String> errors) {

    public BrokenCleanupResult {
        errors = List.copyOf(errors);
    }
}
