package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.adapters.memory.InMemoryMediaCatalogAdapter;
import com.streamfirst.media.tiering.adapters.memory.InMemoryProviderRegistry;
import com.streamfirst.media.tiering.adapters.memory.InMemoryStorageProvider;
import com.streamfirst.media.tiering.adapters.memory.InMemorySubjectDirectoryAdapter;
import com.streamfirst.media.tiering.domain.BrokenCleanupResult;
import com.streamfirst.media.tiering.domain.BrokenReference;
import com.streamfirst.media.tiering.domain.BrokenScanResult;
import com.streamfirst.media.tiering.domain.CatalogSnapshot;
import com.streamfirst.media.tiering.domain.ConsolidationReport;
import com.streamfirst.media.tiering.domain.DeduplicationResult;
import com.streamfirst.media.tiering.domain.DuplicateGroup;
import com.streamfirst.media.tiering.domain.LegacyMigrationResult;
import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StorageSettings;
import com.streamfirst.media.tiering.ports.ContentHashing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.streamfirst.media.tiering.domain.StorageProviderType.CACHE;
import static com.streamfirst.media.tiering.domain.StorageProviderType.LOCAL;
import static com.streamfirst.media.tiering.domain.StorageProviderType.REMOTE;
import static org.assertj.core.api.Assertions.assertThat;

class ConsolidationServiceTest {

  private static final String URL = "https://cdn.example.com/a.jpg";

  private InMemoryMediaCatalogAdapter catalog;
  private InMemoryStorageProvider local;
  private InMemoryStorageProvider cache;
  private InMemoryStorageProvider remote;
  private InMemoryProviderRegistry registry;
  private ConsolidationService service;

  @BeforeEach
  void setUp() {
    catalog = new InMemoryMediaCatalogAdapter();
    local = new InMemoryStorageProvider(LOCAL);
    cache = new InMemoryStorageProvider(CACHE);
    remote = new InMemoryStorageProvider(REMOTE);
    registry = new InMemoryProviderRegistry(StorageSettings.builder().remoteEnabled(true).build())
        .register(local)
        .register(cache)
        .register(remote);
    InMemorySubjectDirectoryAdapter subjects = new InMemorySubjectDirectoryAdapter().register("p1", "alice");
    service = new ConsolidationService(catalog, registry, subjects,
        Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void duplicates_keep_the_oldest_row_and_never_touch_bytes() {
    catalog.save(row("d2", "p1", REMOTE, "2024-02-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("d1", "p1", REMOTE, "2024-01-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("d3", "p1", REMOTE, "2024-03-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("other", "p2", REMOTE, "2024-01-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("nourl", "p1", REMOTE, "2024-01-01T00:00:00Z"));
    remote.put(path("d1", "p1"), new byte[]{1});

    DeduplicationResult result = service.removeDuplicates(false);

    assertThat(result.duplicatesFound()).isEqualTo(2);
    assertThat(result.duplicatesRemoved()).isEqualTo(2);
    assertThat(result.groups()).singleElement()
        .extracting(g -> g.keeper().getId()).isEqualTo("d1");
    assertThat(catalog.findById("d1")).isPresent();
    assertThat(catalog.findById("d2")).isEmpty();
    assertThat(catalog.findById("d3")).isEmpty();
    assertThat(catalog.findById("other")).isPresent();
    assertThat(catalog.findById("nourl")).isPresent();
    assertThat(remote.deleteCount()).isZero();
    assertThat(local.deleteCount()).isZero();
    assertThat(cache.deleteCount()).isZero();
  }

  @Test
  void tied_upload_times_keep_the_lowest_id() {
    catalog.save(row("b", "p1", REMOTE, "2024-01-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("a", "p1", REMOTE, "2024-01-01T00:00:00Z").withSourceUrl(URL));

    List<DuplicateGroup> groups = service.findDuplicates();

    assertThat(groups).singleElement().extracting(g -> g.keeper().getId()).isEqualTo("a");
  }

  @Test
  void dry_run_dedup_reports_without_deleting() {
    catalog.save(row("d1", "p1", REMOTE, "2024-01-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("d2", "p1", REMOTE, "2024-02-01T00:00:00Z").withSourceUrl(URL));

    DeduplicationResult result = service.removeDuplicates(true);

    assertThat(result.dryRun()).isTrue();
    assertThat(result.duplicatesFound()).isEqualTo(1);
    assertThat(result.duplicatesRemoved()).isZero();
    assertThat(result.removableRows()).isEqualTo(1);
    assertThat(catalog.size()).isEqualTo(2);
  }

  @Test
  void legacy_rows_are_found_under_known_layouts() {
    MediaAsset canonical = catalog.save(row("l1", "p1", LOCAL, "2024-01-01T00:00:00Z"));
    local.put(canonical.getRelativePath(), new byte[]{1});

    MediaAsset nested = catalog.save(row("l2", "p1", CACHE, "2024-01-02T00:00:00Z")
        .withRelativePath("p1/2024/01/l2.jpg"));
    cache.put("profiles/p1/2024/01/l2.jpg", new byte[]{2});

    MediaAsset flat = catalog.save(row("l3", "p1", CACHE, "2024-01-03T00:00:00Z"));
    // per-user layout on the other local tier
    local.put("people/alice/l3.jpg", new byte[]{3});

    catalog.save(row("l4", "p1", LOCAL, "2024-01-04T00:00:00Z"));

    LegacyMigrationResult result = service.migrateLegacyAssets(false);

    assertThat(result.candidates()).isEqualTo(4);
    assertThat(result.located()).isEqualTo(3);
    assertThat(result.migrated()).isEqualTo(3);
    assertThat(result.skipped()).isEqualTo(1);
    assertThat(result.failed()).isZero();
    assertThat(result.success()).isTrue();

    MediaAsset migrated = catalog.findById(nested.getId()).orElseThrow();
    assertThat(migrated.getStorageProvider()).isEqualTo(REMOTE);
    assertThat(migrated.getRelativePath()).isEqualTo("people/alice/migrated/l2.jpg");
    assertThat(migrated.getSha256()).isEqualTo(ContentHashing.sha256Hex(new byte[]{2}));
    assertThat(remote.exists("people/alice/migrated/l1.jpg")).isTrue();
    assertThat(remote.exists("people/alice/migrated/l3.jpg")).isTrue();
    assertThat(catalog.findById(flat.getId()).orElseThrow().getStorageProvider()).isEqualTo(REMOTE);

    // located bytes stay where they were
    assertThat(local.exists(canonical.getRelativePath())).isTrue();
    assertThat(local.deleteCount()).isZero();
  }

  @Test
  void unlocated_legacy_rows_are_left_untouched() {
    MediaAsset lost = catalog.save(row("lost", "p9", LOCAL, "2024-01-01T00:00:00Z"));

    LegacyMigrationResult result = service.migrateLegacyAssets(false);

    assertThat(result.skipped()).isEqualTo(1);
    assertThat(catalog.findById("lost")).contains(lost);
    assertThat(catalog.mutationCount()).isZero();
  }

  @Test
  void legacy_migration_without_a_username_uses_the_person_id() {
    MediaAsset row = catalog.save(row("x1", "p9", LOCAL, "2024-01-01T00:00:00Z"));
    local.put(row.getRelativePath(), new byte[]{7});

    service.migrateLegacyAssets(false);

    assertThat(catalog.findById("x1").orElseThrow().getRelativePath()).isEqualTo("people/p9/migrated/x1.jpg");
  }

  @Test
  void legacy_upload_failure_is_counted_and_row_kept() {
    MediaAsset row = catalog.save(row("l1", "p1", LOCAL, "2024-01-01T00:00:00Z"));
    local.put(row.getRelativePath(), new byte[]{1});
    remote.setAvailable(false);

    LegacyMigrationResult result = service.migrateLegacyAssets(false);

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.errors()).hasSize(1);
    assertThat(catalog.findById("l1").orElseThrow().getStorageProvider()).isEqualTo(LOCAL);
  }

  @Test
  void corrupted_legacy_upload_is_discarded_and_row_kept() {
    MediaAsset row = catalog.save(row("c1", "p1", LOCAL, "2024-01-01T00:00:00Z"));
    local.put(row.getRelativePath(), new byte[]{1, 2, 3});
    remote.setCorruptWrites(true);

    LegacyMigrationResult result = service.migrateLegacyAssets(false);

    assertThat(result.migrated()).isZero();
    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.errors()).singleElement().asString().contains("Hash mismatch");
    assertThat(catalog.findById("c1")).contains(row);
    assertThat(remote.paths()).isEmpty();
    assertThat(local.exists(row.getRelativePath())).isTrue();
  }

  @Test
  void broken_scan_is_read_only_and_repeatable() {
    catalog.save(row("ok", "p1", REMOTE, "2024-01-01T00:00:00Z"));
    remote.put(path("ok", "p1"), new byte[]{1});
    catalog.save(row("broken", "p1", REMOTE, "2024-01-02T00:00:00Z"));

    BrokenScanResult first = service.scanBrokenReferences();
    BrokenScanResult second = service.scanBrokenReferences();

    assertThat(first.broken()).extracting(BrokenReference::assetId).containsExactly("broken");
    assertThat(first.checked()).isEqualTo(2);
    assertThat(second).isEqualTo(first);
    assertThat(catalog.mutationCount()).isZero();
  }

  @Test
  void provider_errors_are_unchecked_not_broken() {
    catalog.save(row("r1", "p1", REMOTE, "2024-01-01T00:00:00Z"));
    catalog.save(row("c1", "p1", CACHE, "2024-01-01T00:00:00Z"));
    remote.setFailIo(true);
    InMemoryProviderRegistry withoutCache = new InMemoryProviderRegistry(
        StorageSettings.builder().remoteEnabled(true).build()).register(remote);
    ConsolidationService scanOnly = new ConsolidationService(catalog, withoutCache, new InMemorySubjectDirectoryAdapter());

    BrokenScanResult result = scanOnly.scanBrokenReferences();

    assertThat(result.broken()).isEmpty();
    assertThat(result.unchecked()).isEqualTo(2);
    assertThat(result.checked()).isZero();
  }

  @Test
  void cleanup_keeps_rows_whose_files_reappeared() {
    catalog.save(row("gone", "p1", REMOTE, "2024-01-01T00:00:00Z"));
    catalog.save(row("back", "p1", REMOTE, "2024-01-02T00:00:00Z"));
    BrokenScanResult scan = service.scanBrokenReferences();
    remote.put(path("back", "p1"), new byte[]{1});

    BrokenCleanupResult dry = service.removeBrokenReferences(scan, true);
    assertThat(dry.confirmed()).isEqualTo(1);
    assertThat(dry.removed()).isZero();
    assertThat(catalog.size()).isEqualTo(2);

    BrokenCleanupResult result = service.removeBrokenReferences(scan, false);

    assertThat(result.confirmed()).isEqualTo(1);
    assertThat(result.removed()).isEqualTo(1);
    assertThat(result.reappeared()).isEqualTo(1);
    assertThat(catalog.findById("gone")).isEmpty();
    assertThat(catalog.findById("back")).isPresent();
  }

  @Test
  void snapshot_counts_by_provider_and_origin() {
    catalog.save(row("a", "p1", REMOTE, "2024-01-01T00:00:00Z").withOrigin("affiliate_api").withFileSize(100));
    catalog.save(row("b", "p1", LOCAL, "2024-01-02T00:00:00Z").withOrigin("affiliate_api").withFileSize(50));
    catalog.save(row("c", "p1", LOCAL, "2024-01-03T00:00:00Z").withFileSize(10));

    CatalogSnapshot snapshot = service.snapshot();

    assertThat(snapshot.totalAssets()).isEqualTo(3);
    assertThat(snapshot.count(LOCAL)).isEqualTo(2);
    assertThat(snapshot.count(CACHE)).isZero();
    assertThat(snapshot.byOrigin().get("affiliate_api")).isEqualTo(new CatalogSnapshot.OriginStats(2, 150));
    assertThat(snapshot.byOrigin().get("unknown")).isEqualTo(new CatalogSnapshot.OriginStats(1, 10));
    assertThat(snapshot.takenAt()).isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));
  }

  @Test
  void dry_run_consolidation_commits_nothing() {
    seedMixedCatalog();
    long writesBefore = remote.writeCount();

    ConsolidationReport report = service.runFullConsolidation(true);

    assertThat(report.isDryRun()).isTrue();
    assertThat(report.getDeduplication().duplicatesFound()).isEqualTo(1);
    assertThat(report.getMigration().located()).isEqualTo(1);
    assertThat(report.getMigration().migrated()).isZero();
    assertThat(report.getBefore().totalAssets()).isEqualTo(report.getAfter().totalAssets());
    assertThat(catalog.mutationCount()).isZero();
    assertThat(remote.writeCount()).isEqualTo(writesBefore);
  }

  @Test
  void full_consolidation_runs_every_step() {
    seedMixedCatalog();

    ConsolidationReport report = service.runFullConsolidation(false);

    assertThat(report.duplicatesRemoved()).isEqualTo(1);
    assertThat(report.assetsMigrated()).isEqualTo(1);
    assertThat(report.brokenReferencesFound()).isEqualTo(1);
    assertThat(report.getBefore().totalAssets()).isEqualTo(4);
    assertThat(report.getAfter().totalAssets()).isEqualTo(3);
    assertThat(report.getAfter().count(LOCAL)).isZero();
    assertThat(report.getAfter().duplicateGroups()).isZero();
    assertThat(report.getErrors()).isEmpty();
    // broken rows are reported only
    assertThat(catalog.findById("broken")).isPresent();
  }

  private void seedMixedCatalog() {
    catalog.save(row("d1", "p1", REMOTE, "2024-01-01T00:00:00Z").withSourceUrl(URL));
    catalog.save(row("d2", "p1", REMOTE, "2024-02-01T00:00:00Z").withSourceUrl(URL));
    remote.put(path("d1", "p1"), new byte[]{1});
    remote.put(path("d2", "p1"), new byte[]{1});

    MediaAsset legacy = catalog.save(row("legacy", "p1", LOCAL, "2024-01-05T00:00:00Z"));
    local.put(legacy.getRelativePath(), new byte[]{5});

    catalog.save(row("broken", "p1", REMOTE, "2024-01-06T00:00:00Z"));
  }

  private static MediaAsset row(String id, String personId, StorageProviderType provider, String uploadedAt) {
    return MediaAsset.builder()
        .id(id)
        .personId(personId)
        .relativePath(path(id, personId))
        .storageProvider(provider)
        .uploadedAt(Instant.parse(uploadedAt))
        .build();
  }

  private static String path(String id, String personId) {
    return "profiles/" + personId + "/2024/01/" + id + ".jpg";
  }
}
