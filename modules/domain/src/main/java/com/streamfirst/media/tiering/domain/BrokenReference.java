package com.streamfirst.media.tiering.domain;

/**
 * A catalog row whose claimed provider does not hold its bytes.
 */
public record BrokenReference(String assetId, String relativePath, StorageProviderType storageProvider) {

    public static BrokenReference of(MediaAsset asset) {
        return new BrokenReference(asset.getId(), asset.getRelativePath(), asset.getStorageProvider());
    }
}
