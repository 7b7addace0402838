package com.streamfirst.media.tiering.domain;

import java.util.List;

/**
 * Read-only result of a broken-reference scan. Rows whose existence could not be determined
 * (provider error, provider not registered) are counted in {@code unchecked}, never reported as
 * broken.
 */
public record BrokenScanResult(int checked, int unchecked, List<BrokenReference> broken) {

    public BrokenScanResult {
        broken = List.copyOf(broken);
    }
}
