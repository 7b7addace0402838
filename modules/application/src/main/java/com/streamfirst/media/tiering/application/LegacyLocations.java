package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.CanonicalPath;
import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.ports.ContentHashing;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Path layouts older deployments used on the local tiers, and the object store layout legacy
 * rows are migrated into.
 */
final class LegacyLocations {

  static final String PEOPLE_ROOT = "people";
  static final String MIGRATED_FOLDER = "migrated";

  private LegacyLocations() {}

  /**
   * Candidate paths in lookup order: the recorded path, the same path nested under
   * {@code profiles/}, then the per-user flat layout when a username is known.
   */
  static List<String> candidates(MediaAsset asset, String username) {
    String path = asset.getRelativePath();
    Set<String> paths = new LinkedHashSet<>();
    paths.add(path);
    paths.add(CanonicalPath.ROOT + "/" + path);
    if (username != null && !username.isBlank()) {
      paths.add(PEOPLE_ROOT + "/" + username + "/" + ContentHashing.fileName(path));
    }
    return new ArrayList<>(paths);
  }

  /** {@code people/{owner}/migrated/{fileName}} */
  static String migratedPath(String owner, String locatedPath) {
    return PEOPLE_ROOT + "/" + owner + "/" + MIGRATED_FOLDER + "/" + ContentHashing.fileName(locatedPath);
  }
}
