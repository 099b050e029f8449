package com.nfservice.plugboleto.polling;

/**
 * Last result of a polling loop. {@code ready} is false when the attempts ran out first;
 * the result is still the last one observed.
 */
public final class PollOutcome<T> {

  private final T result;
  private final int attempts;
  private final boolean ready;

  PollOutcome(T result, int attempts, boolean ready) {
    this.result = result;
    this.attempts = attempts;
    this.ready = ready;
  }

  public T getResult() {
    return result;
  }

  public int getAttempts() {
    return attempts;
  }

  public boolean isReady() {
    return ready;
  }

  public boolean isExhausted() {
    return !ready;
  }
}
