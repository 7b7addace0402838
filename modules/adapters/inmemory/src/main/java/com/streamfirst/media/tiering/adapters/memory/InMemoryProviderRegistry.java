package com.streamfirst.media.tiering.adapters.memory;

import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StorageSettings;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed provider registry. Providers are registered once by the composition root;
 * a provider whose tier is disabled in the settings is not resolvable.
 */
@Slf4j
public class InMemoryProviderRegistry implements ProviderRegistryPort {

    private final Map<StorageProviderType, StorageProviderPort> providers = new EnumMap<>(StorageProviderType.class);
    private final StorageSettings settings;

    public InMemoryProviderRegistry(@NonNull StorageSettings settings) {
        this.settings = settings;
    }

    public InMemoryProviderRegistry(@NonNull StorageSettings settings, @NonNull List<StorageProviderPort> providers) {
        this(settings);
        providers.forEach(this::register);
    }

    /**
     * Registers a provider for its tier.
     *
     * @throws IllegalArgumentException if a different provider is already registered for the tier
     */
    public synchronized InMemoryProviderRegistry register(@NonNull StorageProviderPort provider) {
        StorageProviderPort existing = providers.get(provider.type());
        if (existing != null && existing != provider) {
            throw new IllegalArgumentException(
                "Storage provider conflict for " + provider.type() + ": " + existing + " already registered");
        }
        providers.put(provider.type(), provider);
        log.info("Registered storage provider {} (enabled={})", provider.type(), settings.isEnabled(provider.type()));
        return this;
    }

    @Override
    public synchronized Optional<StorageProviderPort> find(StorageProviderType type) {
        if (!settings.isEnabled(type)) {
            log.debug("Storage provider {} is disabled", type);
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(type));
    }

    @Override
    public synchronized Collection<StorageProviderPort> providers() {
        return providers.entrySet().stream()
                .filter(e -> settings.isEnabled(e.getKey()))
                .map(Map.Entry::getValue)
                .toList();
    }

    @Override
    public StorageSettings settings() {
        return settings;
    }
}
