package com.acme.relay.core;

import com.acme.relay.connection.ConnectionState;

/** Raised when a send is attempted while the messaging session is not {@code READY}. */
public class SessionNotReadyException extends TransientException {
  private final ConnectionState state;

  public SessionNotReadyException(ConnectionState state) {
    super("Session not ready (state=" + state + ")");
    this.state = state;
  }

  public ConnectionState getState() {
    return state;
  }
}
