package com.streamfirst.media.tiering.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Result of moving one asset between tiers.
 */
@Value
@Builder
public class TransferResult {

    @NonNull String assetId;
    @NonNull TransferOutcome outcome;
    @NonNull StorageProviderType source;
    @NonNull StorageProviderType destination;

    @Builder.Default
    String relativePath = "";

    long size;

    @Builder.Default
    String sha256 = "";

    boolean symlinkCreated;

    /** Human readable reason for non-transferred outcomes */
    String error;

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
