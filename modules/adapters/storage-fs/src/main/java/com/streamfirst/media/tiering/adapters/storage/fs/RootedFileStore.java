package com.streamfirst.media.tiering.adapters.storage.fs;

import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.ContentHashing;
import com.streamfirst.media.tiering.ports.StorageIOException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Filesystem operations on relative paths under a fixed root. Shared by the local tiers through
 * composition; each provider decides its own availability and failure policy.
 */
@Slf4j
final class RootedFileStore {

  private final StorageProviderType type;
  private final Path root;

  RootedFileStore(StorageProviderType type, Path root) {
    this.type = type;
    this.root = root.toAbsolutePath().normalize();
  }

  Path root() {
    return root;
  }

  /** Resolves a relative path, rejecting anything that escapes the root. */
  Path resolve(String relativePath) {
    Path resolved = root.resolve(relativePath).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new IllegalArgumentException("Path escapes storage root: " + relativePath);
    }
    return resolved;
  }

  boolean isWritableDirectory() {
    return Files.isDirectory(root) && Files.isReadable(root) && Files.isWritable(root);
  }

  WriteResult write(String relativePath, byte[] data) {
    Path target = resolve(relativePath);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, data);
    } catch (IOException e) {
      throw new StorageIOException(type, relativePath, "Write failed", e);
    }
    log.debug("[{}] Wrote file: {} ({} bytes)", type, relativePath, data.length);
    return WriteResult.written(relativePath, target.toString(), data.length, ContentHashing.sha256Hex(data));
  }

  Optional<StoredObject> read(String relativePath) {
    Path source = resolve(relativePath);
    try {
      byte[] data = Files.readAllBytes(source);
      return Optional.of(new StoredObject(data, ContentHashing.mimeTypeFor(relativePath)));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageIOException(type, relativePath, "Read failed", e);
    }
  }

  boolean exists(String relativePath) {
    return Files.isRegularFile(resolve(relativePath));
  }

  boolean delete(String relativePath) {
    try {
      if (Files.deleteIfExists(resolve(relativePath))) {
        log.debug("[{}] Deleted file: {}", type, relativePath);
      }
      return true;
    } catch (IOException e) {
      throw new StorageIOException(type, relativePath, "Delete failed", e);
    }
  }

  /** Stats the file and re-hashes its current content from disk. */
  Optional<FileStats> stats(String relativePath) {
    Path source = resolve(relativePath);
    try {
      BasicFileAttributes attributes = Files.readAttributes(source, BasicFileAttributes.class);
      byte[] data = Files.readAllBytes(source);
      return Optional.of(new FileStats(attributes.size(), ContentHashing.sha256Hex(data),
          ContentHashing.mimeTypeFor(relativePath), attributes.lastModifiedTime().toInstant()));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageIOException(type, relativePath, "Stat failed", e);
    }
  }
}
