package com.streamfirst.media.tiering.domain;

import java.time.Duration;

/**
 * Counts from one remote verification pass.
 */
public record VerificationRunResult(boolean dryRun, int totalChecked, int present, int missing,
                                    int errors, Duration duration) {}
