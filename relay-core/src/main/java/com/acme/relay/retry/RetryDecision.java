package com.acme.relay.retry;

/** What to do after a failed attempt. */
public sealed interface RetryDecision {

  /** Wait {@code delayMs} and try again. */
  record Retry(long delayMs) implements RetryDecision {}

  /** Stop and surface the failure. */
  record Abort(String reason) implements RetryDecision {}
}
