package com.streamfirst.media.tiering.domain;

/**
 * Result of one hash backfill sweep.
 */
public record BackfillResult(int updated, int failed) {}
