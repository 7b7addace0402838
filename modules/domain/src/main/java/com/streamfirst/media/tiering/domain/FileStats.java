package com.streamfirst.media.tiering.domain;

import java.time.Instant;

/**
 * Stat of an object as currently stored on a provider. The hash is always recomputed from the
 * stored bytes so it can expose corruption.
 */
public record FileStats(long size, String sha256, String mimeType, Instant modifiedAt) {}
