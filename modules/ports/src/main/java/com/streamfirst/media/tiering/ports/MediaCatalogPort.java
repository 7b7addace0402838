package com.streamfirst.media.tiering.ports;

import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.StorageProviderType;
import com.streamfirst.media.tiering.domain.VerificationStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port for the catalog table holding one row per stored asset.
 * The catalog is owned outside this system; this is the narrow contract the tiering core needs.
 *
 * <p>Every mutating method must be durably committed when it returns. Transfers rely on that to
 * delete source bytes only after the new location is recorded.
 */
public interface MediaCatalogPort {

    /**
     * Looks up a row by id.
     */
    Optional<MediaAsset> findById(String assetId);

    /**
     * Rows currently on a tier, oldest upload first.
     *
     * @param limit maximum number of rows returned
     */
    List<MediaAsset> findByProvider(StorageProviderType provider, int limit);

    /**
     * All rows on any of the given tiers, newest upload first.
     */
    List<MediaAsset> findByProviders(Set<StorageProviderType> providers);

    /**
     * Every row. Large catalogs should implement this with a streaming cursor.
     */
    List<MediaAsset> findAll();

    /**
     * Rows whose hash was never computed.
     */
    List<MediaAsset> findMissingSha256(int limit);

    /**
     * Active rows to audit against the remote store, oldest upload first.
     *
     * @param onlyUncheckedOrMissing restrict to rows never verified or last seen missing
     * @param limit maximum rows, null for no limit
     */
    List<MediaAsset> findForVerification(boolean onlyUncheckedOrMissing, Integer limit);

    /**
     * Row count per tier.
     */
    Map<StorageProviderType, Long> countByProvider();

    /**
     * Records that an asset's bytes now live on {@code provider} with hash {@code sha256}.
     *
     * @throws IllegalArgumentException if the row does not exist
     */
    void updateLocation(String assetId, StorageProviderType provider, String sha256);

    /**
     * Records a move that also changed the path.
     *
     * @throws IllegalArgumentException if the row does not exist
     */
    void relocate(String assetId, StorageProviderType provider, String relativePath, String sha256);

    void updateSha256(String assetId, String sha256);

    /**
     * Sets the audit flag on several rows at once.
     */
    void markVerified(Collection<String> assetIds, VerificationStatus status, Instant verifiedAt);

    /**
     * Deletes rows. Never touches backing bytes.
     *
     * @return number of rows removed
     */
    int deleteByIds(Collection<String> assetIds);

    /**
     * Total number of rows.
     */
    default long count() {
        return countByProvider().values().stream().mapToLong(Long::longValue).sum();
    }
}
