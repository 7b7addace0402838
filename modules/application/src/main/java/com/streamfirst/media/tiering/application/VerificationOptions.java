package com.streamfirst.media.tiering.application;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one remote verification pass.
 */
@Value
@Builder
public class VerificationOptions {

  /** Check existence without writing any flag */
  boolean dryRun;

  /** Re-check only rows never verified or last seen missing */
  boolean onlyUnverified;

  /** Flag updates buffered before each catalog write */
  @Builder.Default
  int batchSize = 1000;

  /** Maximum rows checked, null for all */
  Integer limit;
}
