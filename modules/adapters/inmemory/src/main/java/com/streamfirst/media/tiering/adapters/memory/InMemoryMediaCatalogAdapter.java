package com.streamfirst.media.tiering.adapters.memory;

import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.VerificationStatus;
import com.streamfirst.media.tiering.ports.MediaCatalogPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * In-memory implementation of MediaCatalogPort for testing and development. Provides a simple,
 * thread-safe catalog keyed by asset id. Data is lost when the application stops - not suitable
 * for production use.
 */
@Slf4j
public class InMemoryMediaCatalogAdapter implements MediaCatalogPort {

  private static final Comparator<MediaAsset> OLDEST_FIRST =
      Comparator.comparing(MediaAsset::getUploadedAt).thenComparing(MediaAsset::getId);

  private final Map<String, MediaAsset> rows = new ConcurrentHashMap<>();
  private final AtomicLong mutations = new AtomicLong();

  /** Inserts or replaces a row. Used for ingestion in tests and demos. */
  public MediaAsset save(MediaAsset asset) {
    rows.put(asset.getId(), asset);
    log.debug("Saved catalog row {}", asset);
    return asset;
  }

  public void saveAll(Collection<MediaAsset> assets) {
    assets.forEach(this::save);
  }

  @Override
  public Optional<MediaAsset> findById(String assetId) {
    return Optional.ofNullable(rows.get(assetId));
  }

  @Override
  public List<MediaAsset> findByProvider(StorageProviderType provider, int limit) {
    return rows.values().stream()
        .filter(a -> a.getStorageProvider() == provider)
        .sorted(OLDEST_FIRST)
        .limit(limit)
        .toList();
  }

  @Override
  public List<MediaAsset> findByProviders(Set<StorageProviderType> providers) {
    return rows.values().stream()
        .filter(a -> providers.contains(a.getStorageProvider()))
        .sorted(OLDEST_FIRST.reversed())
        .toList();
  }

  @Override
  public List<MediaAsset> findAll() {
    return rows.values().stream().sorted(OLDEST_FIRST).toList();
  }

  @Override
  public List<MediaAsset> findMissingSha256(int limit) {
    return rows.values().stream()
        .filter(a -> a.getSha256() == null)
        .sorted(OLDEST_FIRST)
        .limit(limit)
        .toList();
  }

  @Override
  public List<MediaAsset> findForVerification(boolean onlyUncheckedOrMissing, Integer limit) {
    Stream<MediaAsset> active = rows.values().stream()
        .filter(MediaAsset::isActive)
        .filter(a -> !onlyUncheckedOrMissing || a.getVerified() != VerificationStatus.PRESENT)
        .sorted(OLDEST_FIRST);
    return (limit != null ? active.limit(limit) : active).toList();
  }

  @Override
  public Map<StorageProviderType, Long> countByProvider() {
    Map<StorageProviderType, Long> counts = new EnumMap<>(StorageProviderType.class);
    rows.values().forEach(a -> counts.merge(a.getStorageProvider(), 1L, Long::sum));
    return counts;
  }

  @Override
  public void updateLocation(String assetId, StorageProviderType provider, String sha256) {
    update(assetId, a -> a.withStorageProvider(provider).withSha256(sha256));
    log.debug("Catalog row {} now on {}", assetId, provider);
  }

  @Override
  public void relocate(String assetId, StorageProviderType provider, String relativePath, String sha256) {
    update(assetId, a -> a.toBuilder()
        .storageProvider(provider)
        .relativePath(relativePath)
        .sha256(sha256)
        .build());
    log.debug("Catalog row {} relocated to {}:{}", assetId, provider, relativePath);
  }

  @Override
  public void updateSha256(String assetId, String sha256) {
    update(assetId, a -> a.withSha256(sha256));
  }

  @Override
  public void markVerified(Collection<String> assetIds, VerificationStatus status, Instant verifiedAt) {
    for (String id : assetIds) {
      rows.computeIfPresent(id, (k, a) -> a.withVerified(status).withVerifiedAt(verifiedAt));
    }
    mutations.incrementAndGet();
  }

  @Override
  public int deleteByIds(Collection<String> assetIds) {
    int removed = 0;
    for (String id : assetIds) {
      if (rows.remove(id) != null) {
        removed++;
      }
    }
    mutations.incrementAndGet();
    log.debug("Deleted {} catalog rows", removed);
    return removed;
  }

  /** Number of mutating calls received, for asserting that read-only passes stay read-only. */
  public long mutationCount() {
    return mutations.get();
  }

  public int size() {
    return rows.size();
  }

  private void update(String assetId, UnaryOperator<MediaAsset> change) {
    MediaAsset updated = rows.computeIfPresent(assetId, (k, a) -> change.apply(a));
    if (updated == null) {
      throw new IllegalArgumentException("Catalog row " + assetId + " does not exist");
    }
    mutations.incrementAndGet();
  }
}
