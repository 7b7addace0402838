package com.streamfirst.media.tiering.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Point-in-time view of the tiers: reachability, where each one stores its bytes, how many
 * catalog rows it holds, and which tier automatic selection would write to now.
 */
@Value
@Builder
public class StorageStatus {

    /** Null when no tier is currently usable for writes */
    StorageProviderType writeTier;

    @Singular
    List<TierStatus> tiers;

    public Optional<StorageProviderType> currentWriteTier() {
        return Optional.ofNullable(writeTier);
    }

    public Optional<TierStatus> tier(StorageProviderType type) {
        return tiers.stream().filter(t -> t.type() == type).findFirst();
    }

    /**
     * @param type the tier
     * @param enabled whether the tier is enabled and registered
     * @param available result of the tier's availability check, false when not enabled
     * @param location root directory or bucket name
     * @param assetCount catalog rows currently recorded on the tier
     */
    public record TierStatus(StorageProviderType type, boolean enabled, boolean available,
                             String location, long assetCount) {}
}
