package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.BrokenCleanupResult;
import com.streamfirst.media.tiering.domain.BrokenReference;
import com.streamfirst.media.tiering.domain.BrokenScanResult;
import com.streamfirst.media.tiering.domain.CatalogSnapshot;
import com.streamfirst.media.tiering.domain.ConsolidationReport;
import com.streamfirst.media.tiering.domain.DeduplicationResult;
import com.streamfirst.media.tiering.domain.DuplicateGroup;
import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.LegacyMigrationResult;
import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.ContentHashing;
import com.streamfirst.media.tiering.ports.MediaCatalogPort;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import com.streamfirst.media.tiering.ports.SubjectDirectoryPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Whole-catalog reconciliation: duplicate removal, legacy location migration and broken
 * reference scanning, each runnable alone or as one reported run.
 *
 * <p>Nothing here deletes backing bytes. Dedup removes catalog rows only, the legacy sweep leaves
 * located files in place, and the broken scan is read-only; removing broken rows is a separate
 * call the operator makes on a scan result.
 */
@Slf4j
@RequiredArgsConstructor
public class ConsolidationService {

  private static final String UNKNOWN_ORIGIN = "unknown";
  private static final int PROGRESS_INTERVAL = 1000;

  @NonNull private final MediaCatalogPort catalog;
  @NonNull private final ProviderRegistryPort registry;
  @NonNull private final SubjectDirectoryPort subjects;
  @NonNull private final Clock clock;

  public ConsolidationService(MediaCatalogPort catalog, ProviderRegistryPort registry,
      SubjectDirectoryPort subjects) {
    this(catalog, registry, subjects, Clock.systemUTC());
  }

  // ---- duplicates ----

  /** Active rows sharing origin URL and subject, keeper first in each group. */
  public List<DuplicateGroup> findDuplicates() {
    return groupDuplicates(catalog.findAll());
  }

  /**
   * Deletes every duplicate row except the oldest of its group. Backing files are kept because
   * the surviving row may reference the same path.
   */
  public DeduplicationResult removeDuplicates(boolean dryRun) {
    List<DuplicateGroup> groups = findDuplicates();
    int found = groups.stream().mapToInt(g -> g.removals().size()).sum();
    log.info("Found {} duplicate rows in {} groups", found, groups.size());

    if (dryRun) {
      return new DeduplicationResult(true, found, 0, groups, List.of());
    }

    int removed = 0;
    ErrorLog errors = new ErrorLog();
    for (DuplicateGroup group : groups) {
      try {
        removed += catalog.deleteByIds(group.removalIds());
      } catch (RuntimeException e) {
        log.error("Failed to remove duplicates of {}", group.keeper().getId(), e);
        errors.add("Duplicates of " + group.keeper().getId() + ": " + e.getMessage());
      }
    }

    log.info("Removed {} duplicate rows, {} errors", removed, errors.total());
    return new DeduplicationResult(false, found, removed, groups, errors.toList());
  }

  // ---- legacy migration ----

  /** Rows still recorded on one of the local tiers. */
  public List<MediaAsset> findLegacyAssets() {
    Set<StorageProviderType> legacy = EnumSet.noneOf(StorageProviderType.class);
    Arrays.stream(StorageProviderType.values())
        .filter(StorageProviderType::isLegacyLocal)
        .forEach(legacy::add);
    return catalog.findByProviders(legacy);
  }

  /**
   * Locates the bytes of every legacy row under the known layouts and uploads them to the object
   * store, repointing the row. Rows whose bytes cannot be found are counted as skipped and left
   * alone; a layout nobody tried may still hold them.
   */
  public LegacyMigrationResult migrateLegacyAssets(boolean dryRun) {
    List<MediaAsset> candidates = findLegacyAssets();
    log.info("Legacy migration over {} rows (dryRun={})", candidates.size(), dryRun);

    Optional<StorageProviderPort> remote = registry.find(StorageProviderType.REMOTE);
    if (remote.isEmpty() && !dryRun && !candidates.isEmpty()) {
      log.warn("Remote storage not configured, legacy migration aborted");
      return new LegacyMigrationResult(false, candidates.size(), 0, 0, candidates.size(), 0,
          List.of("Remote storage not configured"));
    }

    int located = 0;
    int migrated = 0;
    int failed = 0;
    int skipped = 0;
    ErrorLog errors = new ErrorLog();

    for (MediaAsset asset : candidates) {
      try {
        String username = usernameFor(asset).orElse(null);
        Optional<LocatedFile> file = locate(asset, username);
        if (file.isEmpty()) {
          log.warn("Legacy file not found for {}: {}", asset.getId(), asset.getRelativePath());
          skipped++;
          continue;
        }
        located++;
        if (dryRun) {
          log.debug("Would migrate {} from {}:{}", asset.getId(), file.get().provider(), file.get().path());
          continue;
        }

        LocatedFile source = file.get();
        String target = LegacyLocations.migratedPath(username != null ? username : asset.getPersonId(), source.path());
        String expected = ContentHashing.sha256Hex(source.bytes().data());

        WriteResult written = remote.get().write(target, source.bytes().data(), source.bytes().mimeType());
        if (!written.success()) {
          failed++;
          errors.add("Failed to upload " + asset.getId() + ": " + written.errorMessage().orElse("unknown error"));
          continue;
        }
        String stored;
        try {
          stored = remote.get().stats(target).map(FileStats::sha256).orElse(null);
        } catch (RuntimeException e) {
          discard(remote.get(), target);
          throw e;
        }
        if (!expected.equals(stored)) {
          log.error("Verification failed migrating {}: located {}, stored {}", asset.getId(), expected, stored);
          failed++;
          errors.add("Hash mismatch uploading " + asset.getId());
          discard(remote.get(), target);
          continue;
        }

        catalog.relocate(asset.getId(), StorageProviderType.REMOTE, target, stored);
        migrated++;
        log.info("Migrated {} to remote: {}", asset.getId(), target);
      } catch (RuntimeException e) {
        failed++;
        errors.add("Error migrating " + asset.getId() + ": " + e.getMessage());
        log.error("Failed to migrate legacy asset {}", asset.getId(), e);
      }
    }

    log.info("Legacy migration complete: {} located, {} migrated, {} failed, {} skipped, {} errors",
        located, migrated, failed, skipped, errors.total());
    return new LegacyMigrationResult(dryRun, candidates.size(), located, migrated, failed, skipped, errors.toList());
  }

  // ---- broken references ----

  /**
   * Checks every row against the tier it claims. Read-only; rows whose existence cannot be
   * determined are counted as unchecked, never as broken.
   */
  public BrokenScanResult scanBrokenReferences() {
    List<MediaAsset> rows = catalog.findAll();
    log.info("Checking {} rows for broken references", rows.size());

    int checked = 0;
    int unchecked = 0;
    List<BrokenReference> broken = new ArrayList<>();

    for (MediaAsset asset : rows) {
      Optional<StorageProviderPort> provider = registry.find(asset.getStorageProvider());
      if (provider.isEmpty()) {
        unchecked++;
        continue;
      }
      try {
        if (!provider.get().exists(asset.getRelativePath())) {
          broken.add(BrokenReference.of(asset));
        }
        checked++;
      } catch (RuntimeException e) {
        log.warn("Could not check {} on {}: {}", asset.getId(), asset.getStorageProvider(), e.getMessage());
        unchecked++;
      }
      if ((checked + unchecked) % PROGRESS_INTERVAL == 0) {
        log.info("Checked {}/{} rows", checked + unchecked, rows.size());
      }
    }

    log.info("Broken reference scan complete: {} checked, {} unchecked, {} broken",
        checked, unchecked, broken.size());
    return new BrokenScanResult(checked, unchecked, broken);
  }

  /**
   * Deletes rows from a scan whose files are still absent on a fresh check against the row's
   * current location. Rows that moved or whose files reappeared are kept.
   */
  public BrokenCleanupResult removeBrokenReferences(@NonNull BrokenScanResult scan, boolean dryRun) {
    int confirmed = 0;
    int reappeared = 0;
    List<String> toRemove = new ArrayList<>();
    ErrorLog errors = new ErrorLog();

    for (BrokenReference reference : scan.broken()) {
      try {
        Optional<MediaAsset> row = catalog.findById(reference.assetId());
        if (row.isEmpty()) {
          continue;
        }
        MediaAsset asset = row.get();
        Optional<StorageProviderPort> provider = registry.find(asset.getStorageProvider());
        if (provider.isEmpty()) {
          errors.add(asset.getId() + ": no provider for " + asset.getStorageProvider());
          continue;
        }
        if (provider.get().exists(asset.getRelativePath())) {
          reappeared++;
          log.info("File for {} is present again, keeping row", asset.getId());
          continue;
        }
        confirmed++;
        toRemove.add(asset.getId());
      } catch (RuntimeException e) {
        errors.add(reference.assetId() + ": " + e.getMessage());
        log.warn("Could not re-check {}: {}", reference.assetId(), e.getMessage());
      }
    }

    int removed = 0;
    if (!dryRun && !toRemove.isEmpty()) {
      try {
        removed = catalog.deleteByIds(toRemove);
      } catch (RuntimeException e) {
        errors.add("Failed to delete broken rows: " + e.getMessage());
        log.error("Failed to delete {} broken rows", toRemove.size(), e);
      }
    }

    log.info("Broken reference cleanup: {} confirmed, {} removed, {} reappeared, {} errors (dryRun={})",
        confirmed, removed, reappeared, errors.total(), dryRun);
    return new BrokenCleanupResult(dryRun, confirmed, removed, reappeared, errors.toList());
  }

  // ---- reporting ----

  public CatalogSnapshot snapshot() {
    List<MediaAsset> rows = catalog.findAll();

    Map<StorageProviderType, Long> byProvider = new EnumMap<>(StorageProviderType.class);
    Map<String, long[]> origins = new HashMap<>();
    for (MediaAsset asset : rows) {
      byProvider.merge(asset.getStorageProvider(), 1L, Long::sum);
      String origin = asset.getOrigin() != null ? asset.getOrigin() : UNKNOWN_ORIGIN;
      long[] totals = origins.computeIfAbsent(origin, k -> new long[2]);
      totals[0]++;
      totals[1] += asset.getFileSize();
    }
    Map<String, CatalogSnapshot.OriginStats> byOrigin = origins.entrySet().stream()
        .collect(Collectors.toMap(Map.Entry::getKey,
            e -> new CatalogSnapshot.OriginStats(e.getValue()[0], e.getValue()[1])));

    return new CatalogSnapshot(clock.instant(), rows.size(), byProvider, byOrigin,
        groupDuplicates(rows).size());
  }

  /**
   * Snapshot, dedup, legacy migration, broken scan, snapshot. A dry run performs every analysis
   * and commits nothing. Broken rows are reported, not removed.
   */
  public ConsolidationReport runFullConsolidation(boolean dryRun) {
    Instant startedAt = clock.instant();
    log.info("Starting full consolidation (dryRun={})", dryRun);

    CatalogSnapshot before = snapshot();
    DeduplicationResult deduplication = removeDuplicates(dryRun);
    LegacyMigrationResult migration = migrateLegacyAssets(dryRun);
    BrokenScanResult brokenScan = scanBrokenReferences();
    CatalogSnapshot after = snapshot();

    ErrorLog errors = new ErrorLog();
    deduplication.errors().forEach(errors::add);
    migration.errors().forEach(errors::add);

    ConsolidationReport report = ConsolidationReport.builder()
        .startedAt(startedAt)
        .finishedAt(clock.instant())
        .dryRun(dryRun)
        .before(before)
        .after(after)
        .deduplication(deduplication)
        .migration(migration)
        .brokenScan(brokenScan)
        .errors(errors.toList())
        .build();

    log.info("Consolidation complete: {} duplicates removed, {} migrated, {} broken references, rows {} -> {}",
        report.duplicatesRemoved(), report.assetsMigrated(), report.brokenReferencesFound(),
        before.totalAssets(), after.totalAssets());
    return report;
  }

  private List<DuplicateGroup> groupDuplicates(List<MediaAsset> rows) {
    Map<List<String>, List<MediaAsset>> byKey = new LinkedHashMap<>();
    for (MediaAsset asset : rows) {
      if (asset.getSourceUrl() == null || !asset.isActive()) {
        continue;
      }
      byKey.computeIfAbsent(List.of(asset.getSourceUrl(), asset.getPersonId()), k -> new ArrayList<>())
          .add(asset);
    }
    return byKey.entrySet().stream()
        .filter(e -> e.getValue().size() > 1)
        .map(e -> new DuplicateGroup(e.getKey().get(0), e.getKey().get(1), e.getValue()))
        .sorted(Comparator.comparing(DuplicateGroup::keeper, DuplicateGroup.KEEPER_ORDER))
        .toList();
  }

  /** Own tier first, then the other local tier; each tries every known layout. */
  private Optional<LocatedFile> locate(MediaAsset asset, String username) {
    List<StorageProviderType> tiers = new ArrayList<>();
    tiers.add(asset.getStorageProvider());
    Arrays.stream(StorageProviderType.values())
        .filter(t -> t.isLegacyLocal() && t != asset.getStorageProvider())
        .forEach(tiers::add);

    List<String> paths = LegacyLocations.candidates(asset, username);
    for (StorageProviderType tier : tiers) {
      Optional<StorageProviderPort> provider = registry.find(tier);
      if (provider.isEmpty()) {
        continue;
      }
      for (String path : paths) {
        try {
          Optional<StoredObject> bytes = provider.get().read(path);
          if (bytes.isPresent()) {
            return Optional.of(new LocatedFile(tier, path, bytes.get()));
          }
        } catch (RuntimeException e) {
          log.debug("Lookup of {} on {} failed: {}", path, tier, e.getMessage());
        }
      }
    }
    return Optional.empty();
  }

  private void discard(StorageProviderPort provider, String path) {
    try {
      provider.delete(path);
    } catch (RuntimeException e) {
      log.error("Failed to remove unverified copy {} from {}", path, provider.type(), e);
    }
  }

  private Optional<String> usernameFor(MediaAsset asset) {
    return subjects.usernameFor(asset.getPersonId()).filter(name -> !name.isBlank());
  }

  private record LocatedFile(StorageProviderType provider, String path, StoredObject bytes) {}
}
