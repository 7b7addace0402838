package com.streamfirst.media.tiering.ports;

import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;

import java.util.Optional;

/**
 * Port for one storage tier addressed by provider-agnostic relative paths.
 * Every backend implements the same observable behaviour so assets can move between tiers
 * without the callers knowing which backend they talk to.
 *
 * <p>Expected failure modes (missing object, disabled or unmounted tier) are reported as values.
 * Unexpected I/O failures (permissions, connectivity) raise {@link StorageIOException}; the caller
 * decides whether to retry.
 *
 * <p>Backends that can also expose a username-keyed view implement {@link SymlinkCapability}.
 */
public interface StorageProviderPort {

    /**
     * The tier served by this provider.
     */
    StorageProviderType type();

    /**
     * Cheap availability probe used only for routing decisions.
     * Never throws.
     */
    boolean isAvailable();

    /**
     * Writes exactly the supplied bytes, creating intermediate directories where needed.
     *
     * @param relativePath path relative to the provider root
     * @param data bytes to store
     * @param mimeType content type, derived from the extension when null
     * @return the written size and the hash recomputed from {@code data}, or a failure value
     * @throws StorageIOException on unexpected I/O failure
     */
    WriteResult write(String relativePath, byte[] data, String mimeType);

    default WriteResult write(String relativePath, byte[] data) {
        return write(relativePath, data, null);
    }

    /**
     * Reads the whole object into memory.
     *
     * @param relativePath path relative to the provider root
     * @return the stored bytes, or empty when nothing is stored at that path
     * @throws StorageIOException on unexpected I/O failure
     */
    Optional<StoredObject> read(String relativePath);

    /**
     * Checks whether an object is stored at the path.
     *
     * @throws StorageIOException when existence cannot be determined
     */
    boolean exists(String relativePath);

    /**
     * Deletes the object. Idempotent: deleting a path that does not exist succeeds.
     *
     * @return true if the object is gone afterwards, false if the provider cannot act (disabled)
     * @throws StorageIOException on unexpected I/O failure
     */
    boolean delete(String relativePath);

    /**
     * Locator handed to clients: a static relative URL for local tiers, a signed expiring URL for
     * the private object store.
     */
    String serveUrl(String relativePath);

    /**
     * Stats the stored object. The hash is recomputed from the bytes currently stored, never taken
     * from a previous write, so it exposes corruption.
     *
     * @return the stats, or empty when nothing is stored at that path
     * @throws StorageIOException on unexpected I/O failure
     */
    Optional<FileStats> stats(String relativePath);
}
