package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StorageSettings;
import com.streamfirst.media.tiering.domain.StorageStatus;
import com.streamfirst.media.tiering.ports.MediaCatalogPort;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only questions about the tiers as a whole: which tier holds a given path, and the current
 * health and occupancy of each.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageStatusService {

  /** Cheapest tier first; the object store is asked last. */
  static final List<StorageProviderType> LOOKUP_ORDER =
      List.of(StorageProviderType.CACHE, StorageProviderType.LOCAL, StorageProviderType.REMOTE);

  @NonNull private final MediaCatalogPort catalog;
  @NonNull private final ProviderRegistryPort registry;
  @NonNull private final AutoDestinationPolicy destinationPolicy;

  /**
   * Finds the first configured tier that holds {@code relativePath}, independent of what the
   * catalog records. A tier whose lookup fails is passed over.
   */
  public Optional<StorageProviderType> locate(@NonNull String relativePath) {
    for (StorageProviderType type : LOOKUP_ORDER) {
      Optional<StorageProviderPort> provider = registry.find(type);
      if (provider.isEmpty()) {
        continue;
      }
      try {
        if (provider.get().exists(relativePath)) {
          log.debug("Found {} on {}", relativePath, type);
          return Optional.of(type);
        }
      } catch (RuntimeException e) {
        log.warn("Could not check {} on {}: {}", relativePath, type, e.getMessage());
      }
    }
    log.debug("{} not found on any tier", relativePath);
    return Optional.empty();
  }

  public StorageStatus status() {
    StorageSettings settings = registry.settings();
    Map<StorageProviderType, Long> counts = catalog.countByProvider();

    StorageStatus.StorageStatusBuilder status = StorageStatus.builder()
        .writeTier(destinationPolicy.select().orElse(null));
    for (StorageProviderType type : StorageProviderType.values()) {
      Optional<StorageProviderPort> provider = registry.find(type);
      status.tier(new StorageStatus.TierStatus(
          type,
          provider.isPresent(),
          provider.map(StorageProviderPort::isAvailable).orElse(false),
          location(settings, type),
          counts.getOrDefault(type, 0L)));
    }
    return status.build();
  }

  private static String location(StorageSettings settings, StorageProviderType type) {
    return switch (type) {
      case LOCAL -> settings.getLocalRoot().toString();
      case CACHE -> settings.getCacheRoot().toString();
      case REMOTE -> settings.getRemoteBucket();
    };
  }
}
