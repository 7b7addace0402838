package com.streamfirst.media.tiering.domain;

import java.util.List;
import java.util.Map;

/**
 * Audit overview of the verified flags across active rows.
 *
 * @param active active rows
 * @param unchecked rows never verified
 * @param present rows last seen on the remote store
 * @param missing rows last found absent
 * @param missingByOrigin missing rows per origin
 * @param recentMissing most recently uploaded missing rows, newest first
 */
public record VerificationReport(long active, long unchecked, long present, long missing,
                                 Map<String, Long> missingByOrigin, List<MediaAsset> recentMissing) {

    public VerificationReport {
        missingByOrigin = Map.copyOf(missingByOrigin);
        recentMissing = List.copyOf(recentMissing);
    }

    public double percent(long part) {
        return active == 0 ? 0.0 : (part * 100.0) / active;
    }
}
