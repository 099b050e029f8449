package com.nfservice.plugboleto.polling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.nfservice.plugboleto.exception.PollingInterruptedException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Poller")
class PollerTest {

  private RecordingSleeper sleeper;
  private Poller poller;

  @BeforeEach
  void setUp() {
    sleeper = new RecordingSleeper();
    poller = new Poller(sleeper);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Nested
  @DisplayName("Ready Results")
  class Ready {

    @Test
    @DisplayName("Should query once and never sleep when the first result is done")
    void shouldQueryOnce_whenFirstResultDone() {
      // given
      AtomicInteger calls = new AtomicInteger();

      // when
      PollOutcome<String> outcome = poller.pollUntilReady(() -> {
        calls.incrementAndGet();
        return "PROCESSADO";
      }, "PROCESSADO"::equals, Duration.ofSeconds(2), 70);

      // then
      assertEquals(1, calls.get());
      assertTrue(sleeper.getPauses().isEmpty());
      assertTrue(outcome.isReady());
      assertEquals(1, outcome.getAttempts());
      assertEquals("PROCESSADO", outcome.getResult());
    }

    @Test
    @DisplayName("Should stop as soon as the predicate holds")
    void shouldStop_whenPredicateHolds() {
      // given
      AtomicInteger calls = new AtomicInteger();

      // when
      PollOutcome<Integer> outcome = poller.pollUntilReady(calls::incrementAndGet,
          n -> n == 3, Duration.ofSeconds(1), 10);

      // then
      assertTrue(outcome.isReady());
      assertEquals(3, outcome.getAttempts());
      assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeper.getPauses());
    }

    @Test
    @DisplayName("Should wait the initial delay before the first query")
    void shouldHonourInitialDelay() {
      // when
      PollOutcome<String> outcome = poller.pollUntilReady(() -> "ok", r -> true,
          PollPolicy.ISSUANCE_CONFIRMATION);

      // then
      assertTrue(outcome.isReady());
      assertEquals(List.of(Duration.ofSeconds(4)), sleeper.getPauses());
    }
  }

  @Nested
  @DisplayName("Exhaustion")
  class Exhaustion {

    @Test
    @DisplayName("Should return the last result after exactly maxAttempts queries")
    void shouldReturnLastResult_whenAttemptsRunOut() {
      // given
      AtomicInteger calls = new AtomicInteger();

      // when
      PollOutcome<String> outcome = poller.pollUntilReady(() -> {
        calls.incrementAndGet();
        return "PROCESSANDO";
      }, "PROCESSADO"::equals, Duration.ofSeconds(2), 70);

      // then
      assertEquals(70, calls.get());
      assertFalse(outcome.isReady());
      assertTrue(outcome.isExhausted());
      assertEquals(70, outcome.getAttempts());
      assertEquals("PROCESSANDO", outcome.getResult());
      assertEquals(69, sleeper.getPauses().size());
      assertEquals(Duration.ofSeconds(138), sleeper.total());
    }

    @Test
    @DisplayName("Should pause before every query of the print policy")
    void shouldPauseBeforeEachQuery_forPrintPolicy() {
      // given
      AtomicInteger calls = new AtomicInteger();

      // when
      PollOutcome<Integer> outcome = poller.pollUntilReady(calls::incrementAndGet, n -> false,
          PollPolicy.PRINT_JOB);

      // then
      assertEquals(10, calls.get());
      assertEquals(10, sleeper.getPauses().size());
      assertEquals(10, outcome.getResult());
    }

    @Test
    @DisplayName("Should reject a policy without attempts")
    void shouldReject_zeroAttempts() {
      assertThrows(IllegalArgumentException.class,
          () -> new PollPolicy(Duration.ZERO, Duration.ofSeconds(1), 0));
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should propagate query exceptions without retrying")
    void shouldPropagateQueryException() {
      // given
      AtomicInteger calls = new AtomicInteger();
      IllegalStateException failure = new IllegalStateException("boom");

      // when
      IllegalStateException thrown = assertThrows(IllegalStateException.class,
          () -> poller.pollUntilReady(() -> {
            calls.incrementAndGet();
            throw failure;
          }, r -> true, Duration.ofSeconds(1), 5));

      // then
      assertSame(failure, thrown);
      assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should restore the interrupt flag when interrupted while waiting")
    void shouldRestoreInterruptFlag_whenInterrupted() {
      // given
      Poller interrupted = new Poller(duration -> {
        throw new InterruptedException();
      });

      // when
      PollingInterruptedException thrown = assertThrows(PollingInterruptedException.class,
          () -> interrupted.pollUntilReady(() -> "x", r -> false, Duration.ofSeconds(1), 3));

      // then
      assertTrue(Thread.currentThread().isInterrupted());
      assertTrue(thrown.getCause() instanceof InterruptedException);
    }
  }
}
