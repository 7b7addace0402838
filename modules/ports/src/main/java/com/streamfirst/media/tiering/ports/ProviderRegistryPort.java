package com.streamfirst.media.tiering.ports;

import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StorageSettings;

import java.util.Collection;
import java.util.Optional;

/**
 * Resolves provider instances by tier. Constructed by the composition root and injected into the
 * services; there is no global registry.
 */
public interface ProviderRegistryPort {

    /**
     * Provider for a tier, empty when the tier is not configured or disabled.
     */
    Optional<StorageProviderPort> find(StorageProviderType type);

    /**
     * Provider for a tier.
     *
     * @throws IllegalArgumentException if the tier is not configured
     */
    default StorageProviderPort require(StorageProviderType type) {
        return find(type).orElseThrow(
                () -> new IllegalArgumentException("No storage provider configured for " + type));
    }

    /**
     * All configured providers.
     */
    Collection<StorageProviderPort> providers();

    /**
     * Settings the registry was built from; consulted by routing policy.
     */
    StorageSettings settings();
}
