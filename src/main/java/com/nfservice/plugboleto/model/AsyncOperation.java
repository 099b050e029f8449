package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nfservice.plugboleto.polling.PollOutcome;
import com.nfservice.plugboleto.polling.PollPolicy;
import java.time.Duration;

/**
 * Snapshot of one submitted batch operation after polling. Local to a single call chain.
 *
 * <p>{@code timedOut} marks the soft timeout: attempts ran out while the service still
 * reported processing, and the flow went on with what it had.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class AsyncOperation {

  private final String protocol;
  private final OperationStatus status;
  private final Duration pollInterval;
  private final int maxAttempts;
  private final int attemptsConsumed;
  private final boolean timedOut;

  public AsyncOperation(String protocol, OperationStatus status, Duration pollInterval,
      int maxAttempts, int attemptsConsumed, boolean timedOut) {
    this.protocol = protocol;
    this.status = status;
    this.pollInterval = pollInterval;
    this.maxAttempts = maxAttempts;
    this.attemptsConsumed = attemptsConsumed;
    this.timedOut = timedOut;
  }

  public static AsyncOperation submitted(String protocol, PollPolicy policy) {
    return new AsyncOperation(protocol, OperationStatus.PROCESSING, policy.getInterval(),
        policy.getMaxAttempts(), 0, false);
  }

  /** Next snapshot after a polling round driven by {@code policy}. */
  public AsyncOperation after(PollOutcome<?> outcome, OperationStatus observed,
      PollPolicy policy) {
    boolean exhausted = outcome.isExhausted() && observed == OperationStatus.PROCESSING;
    return new AsyncOperation(protocol, observed, policy.getInterval(), policy.getMaxAttempts(),
        attemptsConsumed + outcome.getAttempts(), exhausted);
  }

  public String getProtocol() {
    return protocol;
  }

  public OperationStatus getStatus() {
    return status;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public int getAttemptsConsumed() {
    return attemptsConsumed;
  }

  public boolean isTimedOut() {
    return timedOut;
  }

  @Override
  public String toString() {
    return "AsyncOperation{protocol=" + protocol + ", status=" + status
        + ", attemptsConsumed=" + attemptsConsumed + ", timedOut=" + timedOut + "}";
  }
}
