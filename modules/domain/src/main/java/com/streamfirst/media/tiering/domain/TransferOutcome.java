package com.streamfirst.media.tiering.domain;

/**
 * Typed result of a single-asset transfer.
 */
public enum TransferOutcome {
    /** Bytes copied, verified, catalog committed. */
    TRANSFERRED,
    /** Catalog row already on the destination; nothing executed. */
    SKIPPED,
    /** No catalog row with that id. */
    ASSET_NOT_FOUND,
    /** Source provider has no bytes at the row's path. */
    SOURCE_MISSING,
    /** Destination refused the write with an expected failure. */
    WRITE_FAILED,
    /** Destination stats did not reproduce the written hash; destination copy removed. */
    VERIFICATION_MISMATCH;

    public boolean isSuccess() {
        return this == TRANSFERRED || this == SKIPPED;
    }
}
