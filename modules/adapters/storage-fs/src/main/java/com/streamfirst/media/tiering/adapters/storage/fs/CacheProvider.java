package com.streamfirst.media.tiering.adapters.storage.fs;

import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.ContentHashing;
import com.streamfirst.media.tiering.ports.StorageIOException;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import com.streamfirst.media.tiering.ports.SymlinkCapability;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Fast local mirror on a removable SSD. Same contract as the local volume, plus a username-keyed
 * symlink tree for browsing:
 *
 * <pre>
 * {root}/profiles/{personId}/{yyyy}/{mm}/{assetId}.{ext}     canonical files
 * {root}/usernames/{username}/{assetId}.{ext}                -> ../../profiles/...
 * </pre>
 *
 * <p>The mount can disappear at any time, so availability is probed by writing a marker file and
 * the answer is cached for a few seconds. Writes are refused while the mount is unavailable.
 */
@Slf4j
public final class CacheProvider implements StorageProviderPort, SymlinkCapability {

  public static final String SERVE_PREFIX = "/ssd-images/";
  public static final String SYMLINK_DIR = "usernames";

  static final Duration AVAILABILITY_CACHE = Duration.ofSeconds(5);
  private static final String PROBE_FILE = ".ssd-test";

  private final RootedFileStore files;
  private final Path symlinkRoot;
  private final Clock clock;

  private Instant lastAvailabilityCheck = Instant.EPOCH;
  private boolean lastAvailable = false;
  private Instant lastHealthCheck;
  private String lastError;
  private Instant unavailableSince;

  public CacheProvider(@NonNull Path root) {
    this(root, Clock.systemUTC());
  }

  public CacheProvider(@NonNull Path root, @NonNull Clock clock) {
    this.files = new RootedFileStore(StorageProviderType.CACHE, root);
    this.symlinkRoot = files.root().resolve(SYMLINK_DIR);
    this.clock = clock;
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.CACHE;
  }

  @Override
  public synchronized boolean isAvailable() {
    Instant now = clock.instant();
    if (Duration.between(lastAvailabilityCheck, now).compareTo(AVAILABILITY_CACHE) < 0) {
      return lastAvailable;
    }
    lastHealthCheck = now;
    lastAvailabilityCheck = now;

    try {
      if (!Files.isDirectory(files.root())) {
        return markUnavailable(now, "Mount point is not a directory");
      }
      // a stale mount can still look like a directory; only a real write proves it
      Path probe = files.root().resolve(PROBE_FILE);
      Files.writeString(probe, "test");
      Files.delete(probe);
    } catch (IOException | SecurityException e) {
      return markUnavailable(now, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    if (!lastAvailable && unavailableSince != null) {
      log.info("Cache storage at {} is available again", files.root());
    }
    lastAvailable = true;
    lastError = null;
    unavailableSince = null;
    return true;
  }

  /** Re-probes the mount, ignoring the cached answer. */
  public synchronized boolean recheckAvailability() {
    lastAvailabilityCheck = Instant.EPOCH;
    return isAvailable();
  }

  @Override
  public WriteResult write(String relativePath, byte[] data, String mimeType) {
    if (!isAvailable()) {
      log.warn("Write skipped, cache storage unavailable: {}", relativePath);
      return WriteResult.failed(relativePath, "Cache storage is not available");
    }
    try {
      return files.write(relativePath, data);
    } catch (StorageIOException e) {
      // most likely ejected or remounted read-only
      synchronized (this) {
        markUnavailable(clock.instant(), e.getCause() != null ? e.getCause().toString() : e.getMessage());
      }
      throw e;
    }
  }

  @Override
  public Optional<StoredObject> read(String relativePath) {
    return files.read(relativePath);
  }

  @Override
  public boolean exists(String relativePath) {
    return files.exists(relativePath);
  }

  @Override
  public boolean delete(String relativePath) {
    return files.delete(relativePath);
  }

  @Override
  public String serveUrl(String relativePath) {
    return SERVE_PREFIX + relativePath;
  }

  @Override
  public Optional<FileStats> stats(String relativePath) {
    return files.stats(relativePath);
  }

  /**
   * Creates {@code usernames/{username}/{fileName}} pointing at the canonical file through a
   * relative link, replacing any existing link of that name.
   */
  @Override
  public boolean createSymlink(String relativePath, String username) {
    if (username == null || username.isBlank()) {
      log.warn("Cannot create symlink for {}: username is empty", relativePath);
      return false;
    }
    Path link = symlinkPath(relativePath, username);
    Path target = Path.of("..", "..").resolve(relativePath);
    try {
      Files.createDirectories(link.getParent());
      Files.deleteIfExists(link);
      Files.createSymbolicLink(link, target);
      log.debug("Created symlink: {} -> {}", link, target);
      return true;
    } catch (IOException | UnsupportedOperationException e) {
      log.error("Failed to create symlink for {}/{}: {}", username, ContentHashing.fileName(relativePath), e.getMessage());
      return false;
    }
  }

  @Override
  public boolean removeSymlink(String relativePath, String username) {
    if (username == null || username.isBlank()) {
      return false;
    }
    Path link = symlinkPath(relativePath, username);
    try {
      if (Files.deleteIfExists(link)) {
        log.debug("Removed symlink: {}", link);
      }
      return true;
    } catch (IOException e) {
      log.error("Failed to remove symlink {}: {}", link, e.getMessage());
      return false;
    }
  }

  /** Location of the username link for a canonical path. */
  public Path symlinkPath(String relativePath, String username) {
    Path userDir = symlinkRoot.resolve(username.toLowerCase(Locale.ROOT)).normalize();
    if (!userDir.startsWith(symlinkRoot)) {
      throw new IllegalArgumentException("Invalid username for symlink: " + username);
    }
    return userDir.resolve(ContentHashing.fileName(relativePath));
  }

  /** Disk usage of the mount, empty when it cannot be determined. */
  public Optional<DiskSpace> diskSpace() {
    try {
      FileStore store = Files.getFileStore(files.root());
      long total = store.getTotalSpace();
      long free = store.getUnallocatedSpace();
      return Optional.of(DiskSpace.of(total, free));
    } catch (IOException e) {
      log.debug("Failed to get disk space for {}: {}", files.root(), e.getMessage());
      return Optional.empty();
    }
  }

  public Path root() {
    return files.root();
  }

  public Path symlinkRoot() {
    return symlinkRoot;
  }

  public synchronized Optional<Instant> lastHealthCheck() {
    return Optional.ofNullable(lastHealthCheck);
  }

  public synchronized Optional<String> lastError() {
    return Optional.ofNullable(lastError);
  }

  public synchronized Optional<Instant> unavailableSince() {
    return Optional.ofNullable(unavailableSince);
  }

  private boolean markUnavailable(Instant now, String error) {
    if (lastAvailable || unavailableSince == null) {
      unavailableSince = now;
      log.warn("Cache storage became unavailable at {}: {}", files.root(), error);
    }
    lastError = error;
    lastAvailable = false;
    lastAvailabilityCheck = now;
    return false;
  }

  @Override
  public String toString() {
    return "CacheProvider{" + files.root() + '}';
  }

  /**
   * Disk usage of the cache mount.
   */
  public record DiskSpace(long total, long used, long free, int usedPercent) {

    static DiskSpace of(long total, long free) {
      long used = total - free;
      int percent = total > 0 ? (int) Math.round(used * 100.0 / total) : 0;
      return new DiskSpace(total, used, free, percent);
    }
  }
}
