package com.acme.relay.core;

/**
 * Invalid relay configuration. Messages always start with "Invalid configuration" so the text
 * based classifier treats them as non-retryable too.
 */
public class ConfigurationException extends PermanentException {
  public ConfigurationException(String detail) {
    super("Invalid configuration: " + detail);
  }
}
