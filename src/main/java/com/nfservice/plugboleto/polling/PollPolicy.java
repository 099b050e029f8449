package com.nfservice.plugboleto.polling;

import java.time.Duration;
import java.util.Objects;

/**
 * Wait schedule for one polling site: an optional wait before the first query, the wait
 * between queries, and the maximum number of queries.
 */
public final class PollPolicy {

  /** Issuance confirmation: wait 4s, query once. */
  public static final PollPolicy ISSUANCE_CONFIRMATION =
      new PollPolicy(Duration.ofSeconds(4), Duration.ofSeconds(4), 1);

  /** Print materialization: up to 10 queries, 1s before each. */
  public static final PollPolicy PRINT_JOB =
      new PollPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 10);

  /** First status read of a submitted return file. */
  public static final PollPolicy RETURN_FILE_STATUS =
      new PollPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 1);

  /** Return file still processing: up to 70 queries, 2s before each. */
  public static final PollPolicy RETURN_FILE_PROCESSING =
      new PollPolicy(Duration.ofSeconds(2), Duration.ofSeconds(2), 70);

  private final Duration initialDelay;
  private final Duration interval;
  private final int maxAttempts;

  public PollPolicy(Duration initialDelay, Duration interval, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.maxAttempts = maxAttempts;
  }

  /** No wait before the first query. */
  public static PollPolicy immediate(Duration interval, int maxAttempts) {
    return new PollPolicy(Duration.ZERO, interval, maxAttempts);
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getInterval() {
    return interval;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  @Override
  public String toString() {
    return "PollPolicy{initialDelay=" + initialDelay + ", interval=" + interval
        + ", maxAttempts=" + maxAttempts + "}";
  }
}
