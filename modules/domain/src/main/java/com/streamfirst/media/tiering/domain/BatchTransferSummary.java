package com.streamfirst.media.tiering.domain;

import java.util.List;

/**
 * Aggregated outcome of a batch transfer run.
 */
public record BatchTransferSummary(int transferred, int failed, int skipped, List<String> errors) {

    public BatchTransferSummary {
        errors = List.copyOf(errors);
    }

    public static BatchTransferSummary empty() {
        return new BatchTransferSummary(0, 0, 0, List.of());
    }

    public int total() {
        return transferred + failed + skipped;
    }
}
