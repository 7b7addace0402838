package com.streamfirst.media.tiering.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Catalog rows that reference the same origin content for the same subject. Members are ordered
 * oldest first; the first member is the keeper.
 *
 * @param sourceUrl shared origin URL
 * @param personId shared subject
 * @param members all rows of the group, at least two
 */
public record DuplicateGroup(String sourceUrl, String personId, List<MediaAsset> members) {

    /** Oldest upload wins; id breaks ties so the choice is deterministic. */
    public static final Comparator<MediaAsset> KEEPER_ORDER =
            Comparator.comparing(MediaAsset::getUploadedAt).thenComparing(MediaAsset::getId);

    public DuplicateGroup {
        Objects.requireNonNull(sourceUrl, "sourceUrl cannot be null");
        Objects.requireNonNull(personId, "personId cannot be null");
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two members");
        }
        members = members.stream().sorted(KEEPER_ORDER).toList();
    }

    public MediaAsset keeper() {
        return members.get(0);
    }

    public List<MediaAsset> removals() {
        return members.subList(1, members.size());
    }

    public List<String> removalIds() {
        return removals().stream().map(MediaAsset::getId).toList();
    }
}
