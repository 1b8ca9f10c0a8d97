package com.acme.relay.core;

/** Terminal failure of a labelled operation after its retry budget was spent. */
public class RetryExhaustedException extends RuntimeException {
  private final String operation;
  private final int attempts;

  public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
    super(
        "Operation \"" + operation + "\" failed after " + attempts + " attempt(s): "
            + (lastError == null ? "unknown error" : lastError.getMessage()),
        lastError);
    this.operation = operation;
    this.attempts = attempts;
  }

  public String getOperation() {
    return operation;
  }

  public int getAttempts() {
    return attempts;
  }
}
