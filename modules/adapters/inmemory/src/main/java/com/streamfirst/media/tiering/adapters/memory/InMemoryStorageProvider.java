package com.streamfirst.media.tiering.adapters.memory;

import com.streamfirst.media.tiering.domain.FileStats;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.StoredObject;
import com.streamfirst.media.tiering.domain.WriteResult;
import com.streamfirst.media.tiering.ports.ContentHashing;
import com.streamfirst.media.tiering.ports.StorageIOException;
import com.streamfirst.media.tiering.ports.StorageProviderPort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of StorageProviderPort for testing and development.
 * Simulates a storage tier with byte arrays keyed by relative path.
 * Data is lost when the application stops - not suitable for production use.
 *
 * <p>Fault switches let tests model an unavailable tier, a tier that flips bits on write and a
 * tier whose I/O fails outright.
 */
@Slf4j
public class InMemoryStorageProvider implements StorageProviderPort {

    private final StorageProviderType type;
    private final Map<String, Entry> contents = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private final AtomicInteger deletes = new AtomicInteger();

    private volatile boolean available = true;
    private volatile boolean corruptWrites = false;
    private volatile boolean failIo = false;

    public InMemoryStorageProvider(@NonNull StorageProviderType type) {
        this.type = type;
    }

    @Override
    public StorageProviderType type() {
        return type;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public WriteResult write(String relativePath, byte[] data, String mimeType) {
        checkIo(relativePath, "write");
        if (!available) {
            return WriteResult.failed(relativePath, type + " storage is not available");
        }
        log.debug("Writing {} to {} ({} bytes)", relativePath, type, data.length);

        byte[] stored = Arrays.copyOf(data, data.length);
        if (corruptWrites && stored.length > 0) {
            stored[0] = (byte) (stored[0] ^ 0xFF);
        }
        String contentType = mimeType != null ? mimeType : ContentHashing.mimeTypeFor(relativePath);
        contents.put(relativePath, new Entry(stored, contentType, Instant.now()));
        writes.incrementAndGet();

        return WriteResult.written(relativePath, "mem://" + type + "/" + relativePath,
            data.length, ContentHashing.sha256Hex(data));
    }

    @Override
    public Optional<StoredObject> read(String relativePath) {
        checkIo(relativePath, "read");
        Entry entry = contents.get(relativePath);
        if (entry == null) {
            log.debug("File {} not found in {}", relativePath, type);
            return Optional.empty();
        }
        return Optional.of(new StoredObject(Arrays.copyOf(entry.data, entry.data.length), entry.mimeType));
    }

    @Override
    public boolean exists(String relativePath) {
        checkIo(relativePath, "exists");
        return contents.containsKey(relativePath);
    }

    @Override
    public boolean delete(String relativePath) {
        checkIo(relativePath, "delete");
        if (contents.remove(relativePath) != null) {
            deletes.incrementAndGet();
            log.debug("Deleted {} from {}", relativePath, type);
        }
        return true;
    }

    @Override
    public String serveUrl(String relativePath) {
        return "/memory/" + type.wireName() + "/" + relativePath;
    }

    @Override
    public Optional<FileStats> stats(String relativePath) {
        checkIo(relativePath, "stats");
        Entry entry = contents.get(relativePath);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new FileStats(entry.data.length, ContentHashing.sha256Hex(entry.data),
            entry.mimeType, entry.modifiedAt));
    }

    /**
     * Places bytes directly, bypassing write accounting. Used for test setup.
     */
    public void put(String relativePath, byte[] data) {
        contents.put(relativePath, new Entry(Arrays.copyOf(data, data.length),
            ContentHashing.mimeTypeFor(relativePath), Instant.now()));
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * When set, stored bytes differ from the written buffer while write still reports the hash of
     * the buffer.
     */
    public void setCorruptWrites(boolean corruptWrites) {
        this.corruptWrites = corruptWrites;
    }

    /**
     * When set, every data operation raises {@link StorageIOException}.
     */
    public void setFailIo(boolean failIo) {
        this.failIo = failIo;
    }

    public Set<String> paths() {
        return Set.copyOf(contents.keySet());
    }

    public int writeCount() {
        return writes.get();
    }

    public int deleteCount() {
        return deletes.get();
    }

    /**
     * Clears all stored data and counters.
     */
    public void clear() {
        log.info("Clearing all data in {}", type);
        contents.clear();
        writes.set(0);
        deletes.set(0);
    }

    private void checkIo(String relativePath, String operation) {
        if (failIo) {
            throw new StorageIOException(type, relativePath, "Simulated " + operation + " failure", null);
        }
    }

    @Override
    public String toString() {
        return "InMemoryStorageProvider{" + type + ", files=" + contents.size() + '}';
    }

    private record Entry(byte[] data, String mimeType, Instant modifiedAt) {}
}
