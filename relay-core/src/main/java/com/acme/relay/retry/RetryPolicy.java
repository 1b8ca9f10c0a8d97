package com.acme.relay.retry;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.PermanentException;
import com.acme.relay.core.RetryExhaustedException;
import com.acme.relay.scheduler.Scheduler;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry loop with exponential backoff around a delivery attempt.
 *
 * <p>An operation runs at most {@code maxRetries + 1} times. Between attempts the calling thread
 * is suspended through the {@link Scheduler} for {@code min(initialDelay * multiplier^n,
 * maxDelay)} where {@code n} is the zero-based index of the failed attempt. A failure classified
 * {@link FailureClass#PERMANENT} is re-raised at once without consuming the remaining budget.
 */
public class RetryPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

  private final int maxRetries;
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double multiplier;
  private final FailureClassifier classifier;
  private final Scheduler scheduler;

  public RetryPolicy(RelayConfig config, FailureClassifier classifier, Scheduler scheduler) {
    this(
        config.getRetryAttempts(),
        config.getRetryDelay(),
        config.getMaxDelay(),
        config.getBackoffMultiplier(),
        classifier,
        scheduler);
  }

  public RetryPolicy(
      int maxRetries,
      Duration initialDelay,
      Duration maxDelay,
      double multiplier,
      FailureClassifier classifier,
      Scheduler scheduler) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    this.maxRetries = maxRetries;
    this.initialDelayMs = initialDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
    this.multiplier = multiplier;
    this.classifier = classifier;
    this.scheduler = scheduler;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long calculateBackoff(int attempt) {
    double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt));
    return (long) Math.min(delay, maxDelayMs);
  }

  /**
   * Decide what follows the failure of attempt {@code attempt} (zero-based) when the budget is
   * {@code retries} retries.
   */
  public RetryDecision decide(Throwable error, int attempt, int retries) {
    FailureClass failureClass = classifier.classify(error);
    if (!failureClass.isRetryable()) {
      return new RetryDecision.Abort("non-retryable error: " + messageOf(error));
    }
    if (attempt >= retries) {
      return new RetryDecision.Abort("retries exhausted after " + (attempt + 1) + " attempt(s)");
    }
    return new RetryDecision.Retry(calculateBackoff(attempt));
  }

  public <T> T retryWithBackoff(RetryableOperation<T> operation, String label) {
    return retryWithBackoff(operation, label, maxRetries);
  }

  /**
   * Run {@code operation} under the policy.
   *
   * @throws RetryExhaustedException when every attempt failed with a retryable error, or the wait
   *     between attempts was interrupted
   * @throws RuntimeException the original failure (checked ones wrapped in {@link
   *     PermanentException}) when it is classified non-retryable
   */
  public <T> T retryWithBackoff(RetryableOperation<T> operation, String label, int retries) {
    if (retries < 0) {
      throw new IllegalArgumentException("retries must be >= 0");
    }
    Throwable lastError = null;
    for (int attempt = 0; attempt <= retries; attempt++) {
      try {
        return operation.execute();
      } catch (Exception e) {
        lastError = e;
        RetryDecision decision = decide(e, attempt, retries);
        if (decision instanceof RetryDecision.Abort abort) {
          if (classifier.classify(e) == FailureClass.PERMANENT) {
            LOG.error("Operation \"{}\" failed with non-retryable error", label, e);
            throw asUnchecked(e);
          }
          LOG.error("Operation \"{}\" failed after {} retries: {}", label, retries, abort.reason(), e);
          throw new RetryExhaustedException(label, attempt + 1, e);
        }
        long delay = ((RetryDecision.Retry) decision).delayMs();
        LOG.warn(
            "Retry attempt {}/{} for \"{}\" after {}ms: {}",
            attempt + 1,
            retries,
            label,
            delay,
            e.getMessage());
        try {
          scheduler.sleep(Duration.ofMillis(delay));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          LOG.warn("Retry wait for \"{}\" interrupted, giving up", label);
          throw new RetryExhaustedException(label, attempt + 1, e);
        }
      }
    }
    throw new RetryExhaustedException(label, 0, lastError);
  }

  private static RuntimeException asUnchecked(Exception e) {
    if (e instanceof RuntimeException re) {
      return re;
    }
    return new PermanentException(messageOf(e), e);
  }

  private static String messageOf(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
