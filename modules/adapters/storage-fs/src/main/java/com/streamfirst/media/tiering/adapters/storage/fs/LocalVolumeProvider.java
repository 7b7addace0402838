package com.streamfirst.media.tiering.adapters.storage.fs;

import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Baseline tier on the container-local volume. Served statically under {@code /images/}.
 */
@Slf4j
public final class LocalVolumeProvider implements StorageProviderPort {

  public static final String SERVE_PREFIX = "/images/";

  private final RootedFileStore files;

  public LocalVolumeProvider(@NonNull Path root) {
    this.files = new RootedFileStore(StorageProviderType.LOCAL, root);
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.LOCAL;
  }

  @Override
  public boolean isAvailable() {
    try {
      return files.isWritableDirectory();
    } catch (SecurityException e) {
      log.warn("Cannot inspect local volume {}: {}", files.root(), e.getMessage());
      return false;
    }
  }

  @Override
  public WriteResult write(String relativePath, byte[] data, String mimeType) {
    return files.write(relativePath, data);
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

  public Path root() {
    return files.root();
  }

  @Override
  public String toString() {
    return "LocalVolumeProvider{" + files.root() + '}';
  }
}
