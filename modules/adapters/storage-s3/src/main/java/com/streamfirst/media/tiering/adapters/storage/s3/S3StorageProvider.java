package com.streamfirst.media.tiering.adapters.storage.s3;

import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StorageSettings;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.ContentHashing;
import com.streamfirst.media.tiering.ports.StorageIOException;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Instant;
import java.util.Optional;

/**
 * Private, durable object store tier. Keys are {@code prefix + relativePath}; clients get
 * time-limited signed URLs, never public ones.
 *
 * <p>Built without a client (bucket not configured) the provider degrades: writes fail with a
 * structured error, reads and stats report nothing stored, exists and delete return false.
 */
@Slf4j
public final class S3StorageProvider implements StorageProviderPort {

  static final String PROBE_KEY = "__availability_probe__";

  private final StorageSettings settings;
  private final S3Client client;
  private final S3Presigner presigner;
  private final String bucket;
  private final String prefix;

  /**
   * @param client SDK client, null when the remote tier is not configured
   * @param presigner signer for serve URLs, null when the remote tier is not configured
   */
  public S3StorageProvider(@NonNull StorageSettings settings, S3Client client, S3Presigner presigner) {
    this.settings = settings;
    this.client = client;
    this.presigner = presigner;
    this.bucket = settings.getRemoteBucket();
    this.prefix = settings.getRemotePrefix();
    if (client == null) {
      log.warn("S3 storage has no client: remote tier disabled");
    } else {
      log.info("S3 storage initialized: bucket={}, prefix={}", bucket, prefix);
    }
  }

  /**
   * Provider with clients built from the settings, or a degraded one when no bucket is set.
   */
  public static S3StorageProvider fromSettings(StorageSettings settings) {
    if (settings.getRemoteBucket().isBlank()) {
      return new S3StorageProvider(settings, null, null);
    }
    return new S3StorageProvider(settings,
        S3ClientFactory.createClient(settings), S3ClientFactory.createPresigner(settings));
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.REMOTE;
  }

  /**
   * HEAD on a probe key. A 404 proves the bucket is reachable with working credentials; a 403 or
   * any other failure means it is not.
   */
  @Override
  public boolean isAvailable() {
    if (client == null) {
      return false;
    }
    try {
      client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key(PROBE_KEY)).build());
      return true;
    } catch (S3Exception e) {
      if (isNotFound(e)) {
        return true;
      }
      log.warn("S3 availability check failed: status={}, {}", e.statusCode(), e.getMessage());
      return false;
    } catch (SdkException e) {
      log.warn("S3 availability check failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public WriteResult write(String relativePath, byte[] data, String mimeType) {
    if (client == null) {
      return WriteResult.failed(relativePath, "S3 storage not configured");
    }
    String key = key(relativePath);
    String contentType = mimeType != null ? mimeType : ContentHashing.mimeTypeFor(relativePath);
    try {
      client.putObject(PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) data.length)
              .build(),
          RequestBody.fromBytes(data));
    } catch (SdkException e) {
      throw new StorageIOException(type(), relativePath, "Failed to upload", e);
    }
    String sha256 = ContentHashing.sha256Hex(data);
    log.debug("Uploaded {} bytes to s3://{}/{}", data.length, bucket, key);
    return WriteResult.written(relativePath, "s3://" + bucket + "/" + key, data.length, sha256);
  }

  @Override
  public Optional<StoredObject> read(String relativePath) {
    if (client == null) {
      return Optional.empty();
    }
    try {
      ResponseBytes<GetObjectResponse> bytes = client.getObjectAsBytes(
          GetObjectRequest.builder().bucket(bucket).key(key(relativePath)).build());
      String contentType = bytes.response().contentType();
      return Optional.of(new StoredObject(bytes.asByteArray(),
          contentType != null ? contentType : ContentHashing.mimeTypeFor(relativePath)));
    } catch (S3Exception e) {
      if (isNotFound(e)) {
        return Optional.empty();
      }
      throw new StorageIOException(type(), relativePath, "Failed to download", e);
    } catch (SdkException e) {
      throw new StorageIOException(type(), relativePath, "Failed to download", e);
    }
  }

  @Override
  public boolean exists(String relativePath) {
    return head(relativePath).isPresent();
  }

  @Override
  public boolean delete(String relativePath) {
    if (client == null) {
      return false;
    }
    try {
      // S3 deletes are idempotent; a missing key still answers 204
      client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key(relativePath)).build());
      log.debug("Deleted s3://{}/{}", bucket, key(relativePath));
      return true;
    } catch (SdkException e) {
      throw new StorageIOException(type(), relativePath, "Failed to delete", e);
    }
  }

  /**
   * Presigned GET valid for the configured TTL. Signing happens locally and needs no round trip.
   */
  @Override
  public String serveUrl(String relativePath) {
    if (presigner == null) {
      return "";
    }
    GetObjectPresignRequest request = GetObjectPresignRequest.builder()
        .signatureDuration(settings.getSignedUrlTtl())
        .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key(relativePath)).build())
        .build();
    return presigner.presignGetObject(request).url().toString();
  }

  @Override
  public Optional<FileStats> stats(String relativePath) {
    Optional<HeadObjectResponse> head = head(relativePath);
    if (head.isEmpty()) {
      return Optional.empty();
    }
    // ETag is not a content hash for multipart uploads; re-hash the bytes
    Optional<StoredObject> stored = read(relativePath);
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    HeadObjectResponse response = head.get();
    String contentType = response.contentType() != null
        ? response.contentType()
        : ContentHashing.mimeTypeFor(relativePath);
    Instant modified = response.lastModified() != null ? response.lastModified() : Instant.EPOCH;
    return Optional.of(new FileStats(stored.get().size(),
        ContentHashing.sha256Hex(stored.get().data()), contentType, modified));
  }

  /** Full object key for a relative path. */
  public String key(String relativePath) {
    return prefix + relativePath;
  }

  public String bucket() {
    return bucket;
  }

  private Optional<HeadObjectResponse> head(String relativePath) {
    if (client == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(client.headObject(
          HeadObjectRequest.builder().bucket(bucket).key(key(relativePath)).build()));
    } catch (S3Exception e) {
      if (isNotFound(e)) {
        return Optional.empty();
      }
      throw new StorageIOException(type(), relativePath, "Failed to stat", e);
    } catch (SdkException e) {
      throw new StorageIOException(type(), relativePath, "Failed to stat", e);
    }
  }

  private static boolean isNotFound(S3Exception e) {
    return e instanceof NoSuchKeyException || e.statusCode() == 404;
  }

  @Override
  public String toString() {
    return "S3StorageProvider{s3://" + bucket + "/" + prefix + '}';
  }
}
