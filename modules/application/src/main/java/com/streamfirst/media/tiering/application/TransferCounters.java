package com.streamfirst.media.tiering.application;

import com.streamfirst.media.tiering.domain.TransferResult;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Running totals for transfers, owned by the caller and passed into {@link TransferService}.
 * Thread-safe, so concurrent transfers may share one instance.
 */
public class TransferCounters {

  private final AtomicInteger transferred = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger skipped = new AtomicInteger();
  private final AtomicInteger current = new AtomicInteger();
  private final AtomicInteger total = new AtomicInteger();
  private volatile Instant lastRunAt;
  private volatile String lastError;

  void record(TransferResult result) {
    switch (result.getOutcome()) {
      case TRANSFERRED -> transferred.incrementAndGet();
      case SKIPPED -> skipped.incrementAndGet();
      default -> recordFailure(result.getAssetId() + ": " + result.errorMessage().orElse(result.getOutcome().name()));
    }
  }

  void recordFailure(String error) {
    failed.incrementAndGet();
    lastError = error;
  }

  void startBatch(int size) {
    current.set(0);
    total.set(size);
  }

  void advance() {
    current.incrementAndGet();
  }

  void finishRun(Instant at) {
    lastRunAt = at;
  }

  public int transferred() {
    return transferred.get();
  }

  public int failed() {
    return failed.get();
  }

  public int skipped() {
    return skipped.get();
  }

  /** Position within the batch in progress */
  public int current() {
    return current.get();
  }

  /** Size of the batch in progress */
  public int total() {
    return total.get();
  }

  public Optional<Instant> lastRunAt() {
    return Optional.ofNullable(lastRunAt);
  }

  public Optional<String> lastError() {
    return Optional.ofNullable(lastError);
  }

  @Override
  public String toString() {
    return "TransferCounters{transferred=" + transferred + ", failed=" + failed
        + ", skipped=" + skipped + ", progress=" + current + "/" + total + '}';
  }
}
