package com.acme.relay.retry;

import static org.assertj.core.api.Assertions.*;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.PermanentException;
import com.acme.relay.core.RetryExhaustedException;
import com.acme.relay.core.TransientException;
import com.acme.relay.test.ManualScheduler;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private ManualScheduler scheduler;
  private RetryPolicy policy;

  @BeforeEach
  void setUp() {
    scheduler = new ManualScheduler();
    policy = new RetryPolicy(new RelayConfig(), new FailureClassifier(), scheduler);
  }

  @Nested
  @DisplayName("calculateBackoff")
  class Backoff {

    @Test
    @DisplayName("doubles from the initial delay and caps at the maximum")
    void testBackoffSequence() {
      assertThat(policy.calculateBackoff(0)).isEqualTo(1000);
      assertThat(policy.calculateBackoff(1)).isEqualTo(2000);
      assertThat(policy.calculateBackoff(2)).isEqualTo(4000);
      assertThat(policy.calculateBackoff(3)).isEqualTo(8000);
      assertThat(policy.calculateBackoff(4)).isEqualTo(16000);
      assertThat(policy.calculateBackoff(5)).isEqualTo(30000);
      assertThat(policy.calculateBackoff(6)).isEqualTo(30000);
    }

    @Test
    @DisplayName("honours a custom multiplier")
    void testCustomMultiplier() {
      RetryPolicy tripling =
          new RetryPolicy(
              2,
              Duration.ofMillis(100),
              Duration.ofSeconds(10),
              3.0,
              new FailureClassifier(),
              scheduler);

      assertThat(tripling.calculateBackoff(2)).isEqualTo(900);
    }

    @Test
    @DisplayName("rejects a negative retry budget or a shrinking multiplier")
    void testInvalidParameters() {
      FailureClassifier classifier = new FailureClassifier();
      Duration d = Duration.ofSeconds(1);

      assertThatThrownBy(() -> new RetryPolicy(-1, d, d, 2.0, classifier, scheduler))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> new RetryPolicy(1, d, d, 0.5, classifier, scheduler))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("retryWithBackoff")
  class RetryLoop {

    @Test
    @DisplayName("returns the first successful result without sleeping")
    void testImmediateSuccess() {
      String result = policy.retryWithBackoff(() -> "ok", "op");

      assertThat(result).isEqualTo("ok");
      assertThat(scheduler.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("succeeds after transient failures with growing delays")
    void testSucceedsAfterRetries() {
      AtomicInteger calls = new AtomicInteger();

      String result =
          policy.retryWithBackoff(
              () -> {
                if (calls.incrementAndGet() < 3) {
                  throw new RuntimeException("network timeout");
                }
                return "sent";
              },
              "relayText");

      assertThat(result).isEqualTo("sent");
      assertThat(calls).hasValue(3);
      assertThat(scheduler.sleepMillis()).containsExactly(1000L, 2000L);
    }

    @Test
    @DisplayName("makes retries + 1 attempts before giving up")
    void testExhaustion() {
      AtomicInteger calls = new AtomicInteger();

      assertThatThrownBy(
              () ->
                  policy.retryWithBackoff(
                      () -> {
                        calls.incrementAndGet();
                        throw new RuntimeException("Request timeout");
                      },
                      "relayText"))
          .isInstanceOfSatisfying(
              RetryExhaustedException.class,
              e -> {
                assertThat(e.getOperation()).isEqualTo("relayText");
                assertThat(e.getAttempts()).isEqualTo(4);
                assertThat(e.getCause()).hasMessage("Request timeout");
              });
      assertThat(calls).hasValue(4);
      assertThat(scheduler.sleepMillis()).containsExactly(1000L, 2000L, 4000L);
    }

    @Test
    @DisplayName("aborts at once on a non-retryable message")
    void testPermanentMessageAborts() {
      AtomicInteger calls = new AtomicInteger();

      assertThatThrownBy(
              () ->
                  policy.retryWithBackoff(
                      () -> {
                        calls.incrementAndGet();
                        throw new IllegalStateException("Account banned");
                      },
                      "relayText"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("Account banned");
      assertThat(calls).hasValue(1);
      assertThat(scheduler.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("wraps a permanent checked exception")
    void testPermanentCheckedWrapped() {
      assertThatThrownBy(
              () ->
                  policy.retryWithBackoff(
                      () -> {
                        throw new IOException("unauthorized");
                      },
                      "downloadMedia"))
          .isInstanceOf(PermanentException.class)
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("retries unclassified errors like transient ones")
    void testUnclassifiedRetried() {
      AtomicInteger calls = new AtomicInteger();

      assertThatThrownBy(
              () ->
                  policy.retryWithBackoff(
                      () -> {
                        calls.incrementAndGet();
                        throw new RuntimeException("boom");
                      },
                      "op",
                      1))
          .isInstanceOf(RetryExhaustedException.class);
      assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("zero retries means exactly one attempt")
    void testZeroRetries() {
      AtomicInteger calls = new AtomicInteger();

      assertThatThrownBy(
              () ->
                  policy.retryWithBackoff(
                      () -> {
                        calls.incrementAndGet();
                        throw new TransientException("temporary");
                      },
                      "op",
                      0))
          .isInstanceOf(RetryExhaustedException.class);
      assertThat(calls).hasValue(1);
      assertThat(scheduler.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("rejects a negative per-call retry count")
    void testNegativeRetries() {
      assertThatThrownBy(() -> policy.retryWithBackoff(() -> "x", "op", -1))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("gives up and keeps the interrupt flag when the wait is interrupted")
    void testInterruptedWait() {
      scheduler.interruptSleeps(true);
      try {
        assertThatThrownBy(
                () ->
                    policy.retryWithBackoff(
                        () -> {
                          throw new RuntimeException("timeout");
                        },
                        "op"))
            .isInstanceOfSatisfying(
                RetryExhaustedException.class, e -> assertThat(e.getAttempts()).isEqualTo(1));
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
      } finally {
        Thread.interrupted();
      }
    }
  }

  @Nested
  @DisplayName("decide")
  class Decide {

    @Test
    @DisplayName("returns the backoff while budget remains")
    void testRetryDecision() {
      RetryDecision decision = policy.decide(new RuntimeException("network"), 1, 3);

      assertThat(decision).isEqualTo(new RetryDecision.Retry(2000));
    }

    @Test
    @DisplayName("aborts when the budget is spent")
    void testAbortWhenExhausted() {
      RetryDecision decision = policy.decide(new RuntimeException("network"), 3, 3);

      assertThat(decision).isInstanceOf(RetryDecision.Abort.class);
    }

    @Test
    @DisplayName("aborts on a permanent error regardless of budget")
    void testAbortOnPermanent() {
      RetryDecision decision = policy.decide(new PermanentException("invalid recipient"), 0, 3);

      assertThat(decision).isInstanceOf(RetryDecision.Abort.class);
      assertThat(((RetryDecision.Abort) decision).reason()).contains("invalid recipient");
    }
  }
}
