package com.streamfirst.media.tiering.ports;

import java.util.Optional;

/**
 * Optional provider capability: a human-browsable, username-keyed view over canonically sharded
 * files. Probed at runtime with {@link #of(StorageProviderPort)}; object stores do not offer it.
 */
public interface SymlinkCapability {

    /**
     * Creates or refreshes the link for {@code username} pointing at {@code relativePath}.
     *
     * @return true if the link exists afterwards
     */
    boolean createSymlink(String relativePath, String username);

    /**
     * Removes the link for {@code username}. A missing link counts as removed.
     */
    boolean removeSymlink(String relativePath, String username);

    static Optional<SymlinkCapability> of(StorageProviderPort provider) {
        return provider instanceof SymlinkCapability capability
                ? Optional.of(capability)
                : Optional.empty();
    }
}
