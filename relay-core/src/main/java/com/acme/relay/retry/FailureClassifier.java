package com.acme.relay.retry;

import com.acme.relay.core.PermanentException;
import com.acme.relay.core.TransientException;
import java.util.List;
import java.util.Locale;

/**
 * Classifies failures by exception type and by case-insensitive substring match on the messages
 * of the cause chain. Non-retryable patterns are checked first.
 */
public class FailureClassifier {

  static final List<String> NON_RETRYABLE_PATTERNS =
      List.of(
          "invalid configuration",
          "authentication failed",
          "invalid recipient",
          "invalid phone number",
          "banned",
          "unauthorized");

  static final String RATE_LIMIT_PATTERN = "rate limit";

  static final List<String> RETRYABLE_PATTERNS =
      List.of(
          "timeout",
          "network",
          "econnrefused",
          "enotfound",
          RATE_LIMIT_PATTERN,
          "temporary",
          "unavailable");

  public FailureClass classify(Throwable error) {
    if (error == null) {
      return FailureClass.UNCLASSIFIED;
    }
    String text = describe(error);
    if (error instanceof PermanentException || containsAny(text, NON_RETRYABLE_PATTERNS)) {
      return FailureClass.PERMANENT;
    }
    if (error instanceof TransientException || containsAny(text, RETRYABLE_PATTERNS)) {
      return FailureClass.TRANSIENT;
    }
    return FailureClass.UNCLASSIFIED;
  }

  /** True when a message in the cause chain reports that the provider is throttling us. */
  public boolean isRateLimited(Throwable error) {
    return error != null && describe(error).contains(RATE_LIMIT_PATTERN);
  }

  private static String describe(Throwable error) {
    StringBuilder sb = new StringBuilder();
    Throwable t = error;
    int depth = 0;
    while (t != null && depth++ < 8) {
      if (t.getMessage() != null) {
        sb.append(t.getMessage()).append('\n');
      }
      t = t.getCause() == t ? null : t.getCause();
    }
    return sb.toString().toLowerCase(Locale.ROOT);
  }

  private static boolean containsAny(String text, List<String> patterns) {
    for (String p : patterns) {
      if (text.contains(p)) {
        return true;
      }
    }
    return false;
  }
}
