package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.StorageMode;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Picks a destination tier when the caller does not name one. Prefers the object store when the
 * configured mode favours durability and the store is reachable, then the SSD cache. Declines
 * otherwise; the caller must choose explicitly.
 */
@Slf4j
@RequiredArgsConstructor
public class AutoDestinationPolicy {

  private final ProviderRegistryPort registry;

  public Optional<StorageProviderType> select() {
    if (registry.settings().getMode() == StorageMode.FAVOR_REMOTE
        && isUsable(StorageProviderType.REMOTE)) {
      return Optional.of(StorageProviderType.REMOTE);
    }
    if (isUsable(StorageProviderType.CACHE)) {
      return Optional.of(StorageProviderType.CACHE);
    }
    log.debug("No destination available for automatic selection");
    return Optional.empty();
  }

  private boolean isUsable(StorageProviderType type) {
    return registry.find(type).map(StorageProviderPort::isAvailable).orElse(false);
  }
}
