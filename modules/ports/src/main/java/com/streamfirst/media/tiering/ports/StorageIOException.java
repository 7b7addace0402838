package com.streamfirst.media.tiering.ports;

import com.streamfirst.media.tiering.domain.StorageProviderType;
import lombok.Getter;

/**
 * Unexpected I/O failure on a storage tier: permissions, connectivity, a broken mount.
 * Scoped to the single path being operated on.
 */
@Getter
public class StorageIOException extends RuntimeException {

    private final StorageProviderType provider;
    private final String relativePath;

    public StorageIOException(StorageProviderType provider, String relativePath, String message, Throwable cause) {
        super("[" + provider + "] " + message + ": " + relativePath, cause);
        this.provider = provider;
        this.relativePath = relativePath;
    }
}
