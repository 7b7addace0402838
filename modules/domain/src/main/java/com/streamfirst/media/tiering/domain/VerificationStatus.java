package com.streamfirst.media.tiering.domain;

/**
 * Audit flag recording whether an asset's bytes were last seen on the remote store.
 * Never authoritative for serving decisions.
 */
public enum VerificationStatus {
    /** Not checked yet. */
    UNKNOWN,
    /** Object was found at the last check. */
    PRESENT,
    /** Object was absent at the last check. Requires explicit cleanup, never auto-deleted. */
    MISSING
}
