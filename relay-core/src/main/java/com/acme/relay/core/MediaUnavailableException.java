package com.acme.relay.core;

public class MediaUnavailableException extends PermanentException {
  public MediaUnavailableException(String message) {
    super(message);
  }

  public MediaUnavailableException(String message, Throwable e) {
    super(message, e);
  }
}
