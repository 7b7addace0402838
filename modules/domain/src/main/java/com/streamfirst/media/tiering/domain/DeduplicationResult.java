package com.streamfirst.media.tiering.domain;

import java.util.List;

/**
 * Outcome of a duplicate removal pass. In dry-run mode {@code duplicatesRemoved} is zero and
 * {@code groups} lists what would have been removed.
 */
public record DeduplicationResult(boolean dryRun, int duplicatesFound, int duplicatesRemoved,
                                  List<DuplicateGroup> groups, List<String> errors) {

    public DeduplicationResult {
        groups = List.copyOf(groups);
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return errors.isEmpty();
    }

    /** Rows a non-dry run removes: every member of every group except its keeper. */
    public int removableRows() {
        return groups.stream().mapToInt(g -> g.removals().size()).sum();
    }
}
