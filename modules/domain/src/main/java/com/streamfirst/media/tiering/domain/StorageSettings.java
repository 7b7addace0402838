package com.streamfirst.media.tiering.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Storage configuration handed to providers and services. Loaded and validated by the caller;
 * nothing in the core reads configuration files.
 */
@Value
@Builder(toBuilder = true)
public class StorageSettings {

    @Builder.Default
    @NonNull StorageMode mode = StorageMode.FAVOR_REMOTE;

    @Builder.Default
    boolean localEnabled = true;

    @Builder.Default
    boolean cacheEnabled = true;

    @Builder.Default
    boolean remoteEnabled = false;

    @Builder.Default
    @NonNull Path localRoot = Path.of("/app/data/images");

    @Builder.Default
    @NonNull Path cacheRoot = Path.of("/mnt/ssd/mhc-images");

    @Builder.Default
    @NonNull String remoteBucket = "";

    @Builder.Default
    @NonNull String remoteRegion = "us-east-1";

    @Builder.Default
    @NonNull String remotePrefix = "mhc/media/";

    /** Endpoint override for S3-compatible stores, null for AWS */
    String remoteEndpoint;

    /** Static credentials; the default AWS provider chain is used when absent */
    String remoteAccessKeyId;

    String remoteSecretAccessKey;

    @Builder.Default
    @NonNull Duration signedUrlTtl = Duration.ofHours(1);

    public boolean isEnabled(StorageProviderType type) {
        return switch (type) {
            case LOCAL -> localEnabled;
            case CACHE -> cacheEnabled;
            case REMOTE -> remoteEnabled;
        };
    }

    public Optional<String> remoteEndpoint() {
        return Optional.ofNullable(remoteEndpoint).filter(s -> !s.isBlank());
    }

    public boolean hasStaticCredentials() {
        return remoteAccessKeyId != null && !remoteAccessKeyId.isBlank()
               && remoteSecretAccessKey != null && !remoteSecretAccessKey.isBlank();
    }

    @Override
    public String toString() {
        return "StorageSettings{" +
               "mode=" + mode +
               ", localEnabled=" + localEnabled +
               ", cacheEnabled=" + cacheEnabled +
               ", remoteEnabled=" + remoteEnabled +
               ", remoteBucket='" + remoteBucket + '\'' +
               ", remotePrefix='" + remotePrefix + '\'' +
               '}';
    }
}
