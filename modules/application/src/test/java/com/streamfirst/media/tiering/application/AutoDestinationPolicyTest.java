package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.adapters.memory.InMemoryProviderRegistry;
import com.streamfirst.media.tiering.adapters.memory.InMemoryStorageProvider;
import com.streamfirst.media.tiering.domain.StorageMode;
import com.streamfirst.media.tiering.domain.StorageSettings;
import org.junit.jupiter.api.Test;

import static com.streamfirst.media.tiering.domain.StorageProviderType.CACHE;
import static com.streamfirst.media.tiering.domain.StorageProviderType.LOCAL;
import static com.streamfirst.media.tiering.domain.StorageProviderType.REMOTE;
import static org.assertj.core.api.Assertions.assertThat;

class AutoDestinationPolicyTest {

  private final InMemoryStorageProvider local = new InMemoryStorageProvider(LOCAL);
  private final InMemoryStorageProvider cache = new InMemoryStorageProvider(CACHE);
  private final InMemoryStorageProvider remote = new InMemoryStorageProvider(REMOTE);

  @Test
  void favours_remote_when_reachable() {
    AutoDestinationPolicy policy = policy(StorageSettings.builder().remoteEnabled(true).build());

    assertThat(policy.select()).contains(REMOTE);
  }

  @Test
  void falls_back_to_cache_when_remote_is_down() {
    remote.setAvailable(false);
    AutoDestinationPolicy policy = policy(StorageSettings.builder().remoteEnabled(true).build());

    assertThat(policy.select()).contains(CACHE);
  }

  @Test
  void favour_local_mode_never_picks_remote() {
    AutoDestinationPolicy policy = policy(StorageSettings.builder()
        .mode(StorageMode.FAVOR_LOCAL)
        .remoteEnabled(true)
        .build());

    assertThat(policy.select()).contains(CACHE);
  }

  @Test
  void disabled_remote_is_ignored() {
    AutoDestinationPolicy policy = policy(StorageSettings.builder().remoteEnabled(false).build());

    assertThat(policy.select()).contains(CACHE);
  }

  @Test
  void declines_when_nothing_is_usable() {
    remote.setAvailable(false);
    cache.setAvailable(false);
    AutoDestinationPolicy policy = policy(StorageSettings.builder().remoteEnabled(true).build());

    assertThat(policy.select()).isEmpty();
  }

  private AutoDestinationPolicy policy(StorageSettings settings) {
    return new AutoDestinationPolicy(new InMemoryProviderRegistry(settings)
        .register(local)
        .register(cache)
        .register(remote));
  }
}
