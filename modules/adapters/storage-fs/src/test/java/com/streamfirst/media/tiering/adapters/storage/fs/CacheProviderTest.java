package com.streamfirst.media.tiering.adapters.storage.fs;

import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.SymlinkCapability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CacheProviderTest {

  private static final String PATH = "profiles/p1/2024/01/img1.jpg";

  @TempDir
  Path tmp;

  private Path root;
  private MutableClock clock;
  private CacheProvider provider;

  @BeforeEach
  void setUp() throws Exception {
    root = Files.createDirectories(tmp.resolve("ssd"));
    clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
    provider = new CacheProvider(root, clock);
  }

  @Test
  void is_symlink_capable() {
    assertThat(SymlinkCapability.of(provider)).containsSame(provider);
    assertThat(provider.type()).isEqualTo(StorageProviderType.CACHE);
    assertThat(provider.serveUrl(PATH)).isEqualTo("/ssd-images/" + PATH);
  }

  @Test
  void probe_leaves_no_marker_behind() {
    assertThat(provider.isAvailable()).isTrue();
    assertThat(root.resolve(".ssd-test")).doesNotExist();
    assertThat(provider.lastHealthCheck()).contains(clock.instant());
    assertThat(provider.lastError()).isEmpty();
  }

  @Test
  void availability_is_cached_for_a_few_seconds() throws Exception {
    assertThat(provider.isAvailable()).isTrue();

    deleteRecursively(root);
    assertThat(provider.isAvailable()).isTrue();

    clock.advance(Duration.ofSeconds(6));
    assertThat(provider.isAvailable()).isFalse();
    assertThat(provider.unavailableSince()).contains(clock.instant());
    assertThat(provider.lastError()).isPresent();
  }

  @Test
  void recheck_bypasses_the_cache() throws Exception {
    assertThat(provider.isAvailable()).isTrue();
    deleteRecursively(root);

    assertThat(provider.recheckAvailability()).isFalse();

    Files.createDirectories(root);
    assertThat(provider.recheckAvailability()).isTrue();
    assertThat(provider.unavailableSince()).isEmpty();
  }

  @Test
  void writes_are_refused_while_unmounted() {
    CacheProvider unmounted = new CacheProvider(tmp.resolve("missing"), clock);

    WriteResult result = unmounted.write(PATH, new byte[]{1});

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).hasValueSatisfying(e -> assertThat(e).contains("not available"));
    assertThat(tmp.resolve("missing")).doesNotExist();
  }

  @Test
  void symlink_points_at_canonical_file() throws Exception {
    byte[] data = "bytes".getBytes(StandardCharsets.UTF_8);
    provider.write(PATH, data);

    assertThat(provider.createSymlink(PATH, "Alice")).isTrue();

    Path link = root.resolve("usernames/alice/img1.jpg");
    assertThat(Files.isSymbolicLink(link)).isTrue();
    assertThat(Files.readSymbolicLink(link)).isEqualTo(Path.of("../../" + PATH));
    assertThat(Files.readAllBytes(link)).isEqualTo(data);
    assertThat(provider.symlinkPath(PATH, "Alice")).isEqualTo(link);
  }

  @Test
  void symlink_is_replaced_when_recreated() throws Exception {
    provider.write(PATH, new byte[]{1});
    assertThat(provider.createSymlink(PATH, "alice")).isTrue();
    assertThat(provider.createSymlink(PATH, "alice")).isTrue();

    assertThat(Files.isSymbolicLink(root.resolve("usernames/alice/img1.jpg"))).isTrue();
  }

  @Test
  void empty_username_creates_nothing() {
    provider.write(PATH, new byte[]{1});

    assertThat(provider.createSymlink(PATH, "")).isFalse();
    assertThat(provider.createSymlink(PATH, null)).isFalse();
    assertThat(root.resolve("usernames")).doesNotExist();
  }

  @Test
  void removing_a_missing_symlink_succeeds() throws Exception {
    provider.write(PATH, new byte[]{1});
    provider.createSymlink(PATH, "alice");

    assertThat(provider.removeSymlink(PATH, "alice")).isTrue();
    assertThat(Files.exists(root.resolve("usernames/alice/img1.jpg"), java.nio.file.LinkOption.NOFOLLOW_LINKS)).isFalse();
    assertThat(provider.removeSymlink(PATH, "alice")).isTrue();
    assertThat(provider.exists(PATH)).isTrue();
  }

  @Test
  void disk_space_reports_usage() {
    CacheProvider.DiskSpace space = provider.diskSpace().orElseThrow();

    assertThat(space.total()).isPositive();
    assertThat(space.used() + space.free()).isEqualTo(space.total());
    assertThat(space.usedPercent()).isBetween(0, 100);
  }

  private static void deleteRecursively(Path dir) throws Exception {
    try (var paths = Files.walk(dir)) {
      paths.sorted(java.util.Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
    }
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneOffset getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(java.time.ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
