package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.VerificationReport;
import com.streamfirst.media.tiering.domain.VerificationRunResult;
import com.streamfirst.media.tiering.domain.VerificationStatus;
import com.streamfirst.media.tiering.ports.MediaCatalogPort;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Audit job that re-derives the {@code verified} flag of active rows from the object store.
 * The flag is informational; a row found missing is never deleted here.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteVerificationService {

  static final int RECENT_MISSING_SAMPLE = 10;
  private static final String UNKNOWN_ORIGIN = "unknown";

  @NonNull private final MediaCatalogPort catalog;
  @NonNull private final ProviderRegistryPort registry;
  @NonNull private final Clock clock;

  public RemoteVerificationService(MediaCatalogPort catalog, ProviderRegistryPort registry) {
    this(catalog, registry, Clock.systemUTC());
  }

  /**
   * Checks each selected row for existence on the remote tier and stores PRESENT or MISSING,
   * flushing every {@code batchSize} rows. Rows that could not be checked keep their flag.
   *
   * @throws IllegalArgumentException if the remote tier is not configured
   */
  public VerificationRunResult verify(@NonNull VerificationOptions options) {
    if (options.getBatchSize() <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + options.getBatchSize());
    }
    StorageProviderPort remote = registry.require(StorageProviderType.REMOTE);
    Instant started = clock.instant();

    List<MediaAsset> rows = catalog.findForVerification(options.isOnlyUnverified(), options.getLimit());
    log.info("Verifying {} rows against remote storage (dryRun={}, onlyUnverified={})",
        rows.size(), options.isDryRun(), options.isOnlyUnverified());

    List<String> present = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    int presentCount = 0;
    int missingCount = 0;
    int errors = 0;
    int checked = 0;

    for (MediaAsset asset : rows) {
      try {
        if (remote.exists(asset.getRelativePath())) {
          present.add(asset.getId());
          presentCount++;
        } else {
          missing.add(asset.getId());
          missingCount++;
          log.debug("Missing on remote: {} ({})", asset.getId(), asset.getRelativePath());
        }
      } catch (RuntimeException e) {
        errors++;
        log.warn("Could not verify {}: {}", asset.getId(), e.getMessage());
      }
      checked++;

      if (present.size() + missing.size() >= options.getBatchSize()) {
        flush(present, missing, options.isDryRun());
        log.info("Progress: {}/{} checked, {} present, {} missing, {} errors",
            checked, rows.size(), presentCount, missingCount, errors);
      }
    }
    flush(present, missing, options.isDryRun());

    Duration duration = Duration.between(started, clock.instant());
    log.info("Verification complete: {} checked, {} present, {} missing, {} errors in {}",
        checked, presentCount, missingCount, errors, duration);
    return new VerificationRunResult(options.isDryRun(), checked, presentCount, missingCount, errors, duration);
  }

  /** Summary of the stored flags across active rows. Reads the catalog only. */
  public VerificationReport report() {
    List<MediaAsset> active = catalog.findAll().stream().filter(MediaAsset::isActive).toList();

    long unchecked = 0;
    long present = 0;
    long missing = 0;
    Map<String, Long> missingByOrigin = new TreeMap<>();
    List<MediaAsset> missingRows = new ArrayList<>();
    for (MediaAsset asset : active) {
      switch (asset.getVerified()) {
        case UNKNOWN -> unchecked++;
        case PRESENT -> present++;
        case MISSING -> {
          missing++;
          missingRows.add(asset);
          missingByOrigin.merge(asset.getOrigin() != null ? asset.getOrigin() : UNKNOWN_ORIGIN, 1L, Long::sum);
        }
      }
    }

    List<MediaAsset> recentMissing = missingRows.stream()
        .sorted(Comparator.comparing(MediaAsset::getUploadedAt).reversed())
        .limit(RECENT_MISSING_SAMPLE)
        .toList();
    return new VerificationReport(active.size(), unchecked, present, missing, missingByOrigin, recentMissing);
  }

  private void flush(List<String> present, List<String> missing, boolean dryRun) {
    if (!dryRun) {
      Instant now = clock.instant();
      if (!present.isEmpty()) {
        catalog.markVerified(List.copyOf(present), VerificationStatus.PRESENT, now);
      }
      if (!missing.isEmpty()) {
        catalog.markVerified(List.copyOf(missing), VerificationStatus.MISSING, now);
      }
    }
    present.clear();
    missing.clear();
  }
}
