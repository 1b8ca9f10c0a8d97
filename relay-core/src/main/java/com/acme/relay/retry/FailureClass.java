package com.acme.relay.retry;

/**
 * Outcome of classifying a delivery failure.
 *
 * <ul>
 *   <li>PERMANENT: abort immediately (auth failure, invalid recipient, banned, ...)
 *   <li>TRANSIENT: retry under backoff (timeout, network, rate limit, ...)
 *   <li>UNCLASSIFIED: nothing matched; retried like a transient failure
 * </ul>
 */
public enum FailureClass {
  PERMANENT,
  TRANSIENT,
  UNCLASSIFIED;

  public boolean isRetryable() {
    return this != PERMANENT;
  }
}
