package com.nfservice.plugboleto.polling;

import com.nfservice.plugboleto.exception.PollingInterruptedException;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded poll-until-ready loop shared by the issuance, print and return-file flows.
 *
 * <p>Runs on the calling thread. The query is invoked at least once; the loop stops as soon
 * as {@code isDone} holds or the attempt budget is spent. Running out of attempts is not an
 * error here: the last result is returned and the caller decides. Exceptions thrown by the
 * query propagate unchanged and are never retried.
 */
@Component
public class Poller {

  private static final Logger LOG = LoggerFactory.getLogger(Poller.class);

  private final Sleeper sleeper;

  public Poller(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  public <T> PollOutcome<T> pollUntilReady(Supplier<T> query, Predicate<T> isDone,
      PollPolicy policy) {
    pause(policy.getInitialDelay());
    T result = query.get();
    int attempts = 1;
    while (!isDone.test(result)) {
      if (attempts >= policy.getMaxAttempts()) {
        LOG.info("event=poll.exhausted attempts={} interval={}", attempts, policy.getInterval());
        return new PollOutcome<>(result, attempts, false);
      }
      pause(policy.getInterval());
      result = query.get();
      attempts++;
    }
    return new PollOutcome<>(result, attempts, true);
  }

  /** Variant with no initial wait, matching the plain {@code interval, maxAttempts} form. */
  public <T> PollOutcome<T> pollUntilReady(Supplier<T> query, Predicate<T> isDone,
      Duration interval, int maxAttempts) {
    return pollUntilReady(query, isDone, PollPolicy.immediate(interval, maxAttempts));
  }

  private void pause(Duration duration) {
    if (duration.isZero()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PollingInterruptedException("Interrupted while waiting to poll", e);
    }
  }
}
