package com.streamfirst.media.tiering.adapters.storage.s3;

import com.streamfirst.media.tiering.domain.StorageSettings;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * Builds SDK clients from {@link StorageSettings}. An endpoint override switches to path-style
 * addressing so MinIO and other S3-compatible stores work.
 */
public final class S3ClientFactory {

  private S3ClientFactory() {}

  public static S3Client createClient(StorageSettings settings) {
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(settings.getRemoteRegion()))
        .credentialsProvider(credentials(settings));
    settings.remoteEndpoint().ifPresent(endpoint -> builder
        .endpointOverride(URI.create(endpoint))
        .serviceConfiguration(pathStyle()));
    return builder.build();
  }

  public static S3Presigner createPresigner(StorageSettings settings) {
    S3Presigner.Builder builder = S3Presigner.builder()
        .region(Region.of(settings.getRemoteRegion()))
        .credentialsProvider(credentials(settings));
    settings.remoteEndpoint().ifPresent(endpoint -> builder
        .endpointOverride(URI.create(endpoint))
        .serviceConfiguration(pathStyle()));
    return builder.build();
  }

  private static S3Configuration pathStyle() {
    return S3Configuration.builder().pathStyleAccessEnabled(true).build();
  }

  private static AwsCredentialsProvider credentials(StorageSettings settings) {
    if (settings.hasStaticCredentials()) {
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(
          settings.getRemoteAccessKeyId(), settings.getRemoteSecretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }
}
