package com.streamfirst.media.tiering.boot;

import com.streamfirst.media.tiering.domain.StorageMode;
import com.streamfirst.media.tiering.domain.StorageSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * {@code media.storage.*} configuration, converted into the immutable {@link StorageSettings}
 * the core consumes.
 */
@Data
@ConfigurationProperties(prefix = "media.storage")
public class StorageProperties {

    private StorageMode mode = StorageMode.FAVOR_REMOTE;
    private Local local = new Local();
    private Cache cache = new Cache();
    private Remote remote = new Remote();

    /** Threads running asynchronous transfers */
    private int transferThreads = 4;

    @Data
    public static class Local {
        private boolean enabled = true;
        private Path root = Path.of("/app/data/images");
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Path root = Path.of("/mnt/ssd/mhc-images");
    }

    @Data
    public static class Remote {
        private boolean enabled = false;
        private String bucket = "";
        private String region = "us-east-1";
        private String prefix = "mhc/media/";
        private String endpoint;
        private String accessKeyId;
        private String secretAccessKey;
        private Duration signedUrlTtl = Duration.ofHours(1);
    }

    public StorageSettings toSettings() {
        return StorageSettings.builder()
                .mode(mode)
                .localEnabled(local.isEnabled())
                .localRoot(local.getRoot())
                .cacheEnabled(cache.isEnabled())
                .cacheRoot(cache.getRoot())
                .remoteEnabled(remote.isEnabled())
                .remoteBucket(remote.getBucket() != null ? remote.getBucket() : "")
                .remoteRegion(remote.getRegion())
                .remotePrefix(remote.getPrefix() != null ? remote.getPrefix() : "")
                .remoteEndpoint(remote.getEndpoint())
                .remoteAccessKeyId(remote.getAccessKeyId())
                .remoteSecretAccessKey(remote.getSecretAccessKey())
                .signedUrlTtl(remote.getSignedUrlTtl())
                .build();
    }
}
