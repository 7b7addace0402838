package com.streamfirst.media.tiering.domain;

/**
 * Global preference used when a destination tier is picked automatically.
 */
public enum StorageMode {
    FAVOR_LOCAL,
    FAVOR_REMOTE
}
