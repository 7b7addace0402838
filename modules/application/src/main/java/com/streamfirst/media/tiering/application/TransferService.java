package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.BackfillResult;
import com.streamfirst.media.tiering.domain.BatchTransferSummary;
import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.TransferOutcome;
import com.streamfirst.media.tiering.domain.TransferResult;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.MediaCatalogPort;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import com.streamfirst.media.tiering.ports.SubjectDirectoryPort;
import com.streamfirst.media.tiering.ports.SymlinkCapability;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Moves asset bytes between tiers with a verify-before-commit protocol:
 *
 * <ol>
 *   <li>skip when the catalog already points at the destination
 *   <li>read from the source ({@link TransferOutcome#SOURCE_MISSING} if absent)
 *   <li>write to the destination
 *   <li>re-stat the destination and compare hashes; on mismatch delete the copy and stop
 *   <li>commit the new location to the catalog
 *   <li>delete the source copy, best effort
 *   <li>refresh the username symlink on a symlink-capable destination, best effort
 * </ol>
 *
 * A transfer either ends with a verified copy recorded in the catalog, or leaves source and
 * catalog exactly as they were. Callers must serialise transfers of the same asset.
 */
@Slf4j
@RequiredArgsConstructor
public class TransferService {

  @NonNull private final MediaCatalogPort catalog;
  @NonNull private final ProviderRegistryPort registry;
  @NonNull private final SubjectDirectoryPort subjects;
  @NonNull private final AutoDestinationPolicy destinationPolicy;
  @NonNull private final Executor executor;
  @NonNull private final Clock clock;

  public TransferService(MediaCatalogPort catalog, ProviderRegistryPort registry,
      SubjectDirectoryPort subjects, AutoDestinationPolicy destinationPolicy, Executor executor) {
    this(catalog, registry, subjects, destinationPolicy, executor, Clock.systemUTC());
  }

  public TransferResult transferFile(String assetId, StorageProviderType source,
      StorageProviderType destination) {
    return transferFile(assetId, source, destination, TransferOptions.defaults(), new TransferCounters());
  }

  /**
   * Transfers one asset.
   *
   * @return the outcome; expected failures are reported as values
   * @throws com.streamfirst.media.tiering.ports.StorageIOException on unexpected I/O failure,
   *     after removing any unverified destination copy
   * @throws IllegalArgumentException when a tier is not configured or source equals destination
   */
  public TransferResult transferFile(@NonNull String assetId, @NonNull StorageProviderType source,
      @NonNull StorageProviderType destination, @NonNull TransferOptions options,
      @NonNull TransferCounters counters) {
    try {
      TransferResult result = doTransfer(assetId, source, destination, options);
      counters.record(result);
      return result;
    } catch (RuntimeException e) {
      counters.recordFailure(assetId + ": " + e.getMessage());
      throw e;
    } finally {
      counters.finishRun(clock.instant());
    }
  }

  public CompletableFuture<TransferResult> transferFileAsync(String assetId,
      StorageProviderType source, StorageProviderType destination, TransferOptions options,
      TransferCounters counters) {
    return CompletableFuture.supplyAsync(
        () -> transferFile(assetId, source, destination, options, counters), executor);
  }

  /**
   * Transfers up to {@code batchSize} assets currently on {@code source}, oldest upload first.
   * A failure or exception on one asset is recorded and the batch moves on.
   */
  public BatchTransferSummary transferBatch(@NonNull StorageProviderType source,
      @NonNull StorageProviderType destination, int batchSize, @NonNull TransferCounters counters) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    requireDistinct(source, destination);
    List<MediaAsset> batch = catalog.findByProvider(source, batchSize);
    log.info("Starting batch transfer of {} assets from {} to {}", batch.size(), source, destination);
    counters.startBatch(batch.size());

    int transferred = 0;
    int failed = 0;
    int skipped = 0;
    ErrorLog errors = new ErrorLog();

    for (MediaAsset asset : batch) {
      try {
        TransferResult result = doTransfer(asset.getId(), source, destination, TransferOptions.defaults());
        counters.record(result);
        switch (result.getOutcome()) {
          case TRANSFERRED -> transferred++;
          case SKIPPED -> skipped++;
          default -> {
            failed++;
            errors.add(asset.getId() + ": " + result.errorMessage().orElse(result.getOutcome().name()));
          }
        }
      } catch (RuntimeException e) {
        failed++;
        String message = asset.getId() + ": " + e.getMessage();
        errors.add(message);
        counters.recordFailure(message);
        log.error("Transfer of {} failed", asset.getId(), e);
      } finally {
        counters.advance();
      }
    }

    counters.finishRun(clock.instant());
    log.info("Batch transfer {} -> {} complete: {} transferred, {} failed, {} skipped, {} errors",
        source, destination, transferred, failed, skipped, errors.total());
    return new BatchTransferSummary(transferred, failed, skipped, errors.toList());
  }

  public CompletableFuture<BatchTransferSummary> transferBatchAsync(StorageProviderType source,
      StorageProviderType destination, int batchSize, TransferCounters counters) {
    return CompletableFuture.supplyAsync(
        () -> transferBatch(source, destination, batchSize, counters), executor);
  }

  /** Number of assets currently on a tier. */
  public long pendingCount(StorageProviderType source) {
    return catalog.countByProvider().getOrDefault(source, 0L);
  }

  public Optional<StorageProviderType> autoDestination() {
    return destinationPolicy.select();
  }

  /**
   * Computes missing hashes from the bytes on the tier each row claims.
   */
  public BackfillResult backfillSha256(int batchSize) {
    List<MediaAsset> rows = catalog.findMissingSha256(batchSize);
    log.info("Backfilling SHA-256 for {} assets", rows.size());

    int updated = 0;
    int failed = 0;
    for (MediaAsset asset : rows) {
      try {
        Optional<StorageProviderPort> provider = registry.find(asset.getStorageProvider());
        if (provider.isEmpty()) {
          log.warn("No provider for {} while backfilling {}", asset.getStorageProvider(), asset.getId());
          failed++;
          continue;
        }
        Optional<FileStats> stats = provider.get().stats(asset.getRelativePath());
        if (stats.isEmpty()) {
          log.warn("File not found while backfilling {}: {}", asset.getId(), asset.getRelativePath());
          failed++;
          continue;
        }
        catalog.updateSha256(asset.getId(), stats.get().sha256());
        updated++;
      } catch (RuntimeException e) {
        log.error("Failed to backfill hash for {}", asset.getId(), e);
        failed++;
      }
    }

    log.info("SHA-256 backfill complete: {} updated, {} failed", updated, failed);
    return new BackfillResult(updated, failed);
  }

  private TransferResult doTransfer(String assetId, StorageProviderType source,
      StorageProviderType destination, TransferOptions options) {
    requireDistinct(source, destination);
    TransferResult.TransferResultBuilder result = TransferResult.builder()
        .assetId(assetId)
        .source(source)
        .destination(destination);

    Optional<MediaAsset> found = catalog.findById(assetId);
    if (found.isEmpty()) {
      log.warn("Transfer requested for unknown asset {}", assetId);
      return result.outcome(TransferOutcome.ASSET_NOT_FOUND).error("Asset not found").build();
    }
    MediaAsset asset = found.get();
    String path = asset.getRelativePath();
    result.relativePath(path);

    if (asset.getStorageProvider() == destination) {
      log.debug("Asset {} already on {}", assetId, destination);
      return result.outcome(TransferOutcome.SKIPPED)
          .sha256(asset.sha256().orElse(""))
          .error("Already on " + destination)
          .build();
    }
    if (asset.getStorageProvider() != source) {
      log.warn("Asset {} is recorded on {} but transfer reads from {}",
          assetId, asset.getStorageProvider(), source);
    }

    StorageProviderPort sourceProvider = registry.require(source);
    StorageProviderPort destinationProvider = registry.require(destination);

    Optional<StoredObject> read = sourceProvider.read(path);
    if (read.isEmpty()) {
      log.warn("Source file missing for {} on {}: {}", assetId, source, path);
      return result.outcome(TransferOutcome.SOURCE_MISSING)
          .error("Source file not found: " + path)
          .build();
    }
    StoredObject bytes = read.get();

    WriteResult written = destinationProvider.write(path, bytes.data(), bytes.mimeType());
    if (!written.success()) {
      log.warn("Write to {} failed for {}: {}", destination, assetId, written.error());
      return result.outcome(TransferOutcome.WRITE_FAILED)
          .error(written.errorMessage().orElse("Write failed"))
          .build();
    }

    try {
      Optional<FileStats> stats = destinationProvider.stats(path);
      String storedHash = stats.map(FileStats::sha256).orElse(null);
      if (!written.sha256().equals(storedHash)) {
        log.error("Verification failed for {} on {}: wrote {}, stored {}",
            assetId, destination, written.sha256(), storedHash);
        discardDestination(destinationProvider, path);
        return result.outcome(TransferOutcome.VERIFICATION_MISMATCH)
            .error("Hash mismatch after write to " + destination)
            .build();
      }

      catalog.updateLocation(assetId, destination, written.sha256());
    } catch (RuntimeException e) {
      // the catalog still points at the source; the destination copy is unverified
      discardDestination(destinationProvider, path);
      throw e;
    }

    Optional<String> username = usernameFor(asset);
    if (options.isDeleteSource()) {
      deleteSource(sourceProvider, asset, username);
    }

    boolean symlinkCreated = false;
    if (options.isCreateSymlinks() && username.isPresent()) {
      symlinkCreated = SymlinkCapability.of(destinationProvider)
          .map(links -> createSymlink(links, path, username.get()))
          .orElse(false);
    }

    log.info("Transferred {} from {} to {} ({} bytes)", assetId, source, destination, written.size());
    return result.outcome(TransferOutcome.TRANSFERRED)
        .size(written.size())
        .sha256(written.sha256())
        .symlinkCreated(symlinkCreated)
        .build();
  }

  // a same-tier transfer would delete the copy it just wrote
  private static void requireDistinct(StorageProviderType source, StorageProviderType destination) {
    if (source == destination) {
      throw new IllegalArgumentException("Source and destination must differ: " + source);
    }
  }

  private void deleteSource(StorageProviderPort sourceProvider, MediaAsset asset, Optional<String> username) {
    String path = asset.getRelativePath();
    try {
      if (!sourceProvider.delete(path)) {
        log.warn("Source delete declined on {} for {}: {}", sourceProvider.type(), asset.getId(), path);
        return;
      }
    } catch (RuntimeException e) {
      log.warn("Failed to delete source copy of {} on {}: {}", asset.getId(), sourceProvider.type(), e.getMessage());
      return;
    }
    username.ifPresent(name -> SymlinkCapability.of(sourceProvider).ifPresent(links -> {
      try {
        links.removeSymlink(path, name);
      } catch (RuntimeException e) {
        log.warn("Failed to remove stale symlink for {}: {}", asset.getId(), e.getMessage());
      }
    }));
  }

  private boolean createSymlink(SymlinkCapability links, String path, String username) {
    try {
      return links.createSymlink(path, username);
    } catch (RuntimeException e) {
      log.warn("Failed to create symlink {} for {}: {}", path, username, e.getMessage());
      return false;
    }
  }

  private void discardDestination(StorageProviderPort destination, String path) {
    try {
      destination.delete(path);
    } catch (RuntimeException e) {
      log.error("Failed to remove unverified copy {} from {}", path, destination.type(), e);
    }
  }

  private Optional<String> usernameFor(MediaAsset asset) {
    try {
      return subjects.usernameFor(asset.getPersonId()).filter(name -> !name.isBlank());
    } catch (RuntimeException e) {
      log.warn("Username lookup failed for {}: {}", asset.getPersonId(), e.getMessage());
      return Optional.empty();
    }
  }
}
