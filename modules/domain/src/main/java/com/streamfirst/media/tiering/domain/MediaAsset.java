package com.streamfirst.media.tiering.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Optional;

/**
 * One catalog row per stored file. The {@code relativePath} identifies the bytes independently
 * of the tier currently holding them; {@code storageProvider} names that tier.
 */
@Value
@With
@Builder(toBuilder = true)
@EqualsAndHashCode
public class MediaAsset {

    /** Stable identifier for the lifetime of the asset */
    @NonNull String id;

    /** Owning subject */
    @NonNull String personId;

    /** Provider-agnostic path, normally a {@link CanonicalPath} */
    @NonNull String relativePath;

    /** Tier that currently holds the bytes */
    @NonNull StorageProviderType storageProvider;

    /** Hex SHA-256 of the stored bytes, null until computed */
    String sha256;

    long fileSize;

    /** Origin URL, the natural dedup key together with personId */
    String sourceUrl;

    /** Producer of the asset (affiliate_api, manual_upload, screensnap, ...) */
    String origin;

    @NonNull Instant uploadedAt;

    @Builder.Default
    @NonNull VerificationStatus verified = VerificationStatus.UNKNOWN;

    Instant verifiedAt;

    /** Set when the row was soft-deleted */
    Instant deletedAt;

    public boolean isActive() {
        return deletedAt == null;
    }

    public Optional<String> sha256() {
        return Optional.ofNullable(sha256);
    }

    public Optional<String> sourceUrl() {
        return Optional.ofNullable(sourceUrl);
    }

    @Override
    public String toString() {
        return "MediaAsset{" +
               "id='" + id + '\'' +
               ", personId='" + personId + '\'' +
               ", relativePath='" + relativePath + '\'' +
               ", storageProvider=" + storageProvider +
               '}';
    }
}
