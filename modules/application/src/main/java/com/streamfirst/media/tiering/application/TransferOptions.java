package com.streamfirst.media.tiering.application;

import lombok.Builder;
import lombok.Value;

/**
 * Switches for the post-commit steps of a transfer.
 */
@Value
@Builder
public class TransferOptions {

  private static final TransferOptions DEFAULTS = TransferOptions.builder().build();

  /** Refresh the username symlink on a symlink-capable destination */
  @Builder.Default
  boolean createSymlinks = true;

  /** Remove the source copy once the catalog points at the destination */
  @Builder.Default
  boolean deleteSource = true;

  public static TransferOptions defaults() {
    return DEFAULTS;
  }
}
