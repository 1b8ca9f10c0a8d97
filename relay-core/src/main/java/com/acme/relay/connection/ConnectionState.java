package com.acme.relay.connection;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of the messaging session. {@link #FAILED} is terminal. */
public enum ConnectionState {
  UNINITIALIZED,
  INITIALIZING,
  AWAITING_CREDENTIAL,
  READY,
  DISCONNECTED,
  RECONNECT_SCHEDULED,
  FAILED;

  /**
   * Allowed successors. Besides the core edges, a session that drops while still initializing
   * goes to DISCONNECTED, and a reconnect whose {@code initialize()} throws goes straight back to
   * RECONNECT_SCHEDULED.
   */
  public Set<ConnectionState> successors() {
    return switch (this) {
      case UNINITIALIZED -> EnumSet.of(INITIALIZING);
      case INITIALIZING -> EnumSet.of(AWAITING_CREDENTIAL, READY, FAILED, DISCONNECTED, RECONNECT_SCHEDULED);
      case AWAITING_CREDENTIAL -> EnumSet.of(READY, FAILED, DISCONNECTED);
      case READY -> EnumSet.of(DISCONNECTED);
      case DISCONNECTED -> EnumSet.of(INITIALIZING, RECONNECT_SCHEDULED);
      case RECONNECT_SCHEDULED -> EnumSet.of(INITIALIZING, FAILED);
      case FAILED -> EnumSet.noneOf(ConnectionState.class);
    };
  }

  public boolean canTransitionTo(ConnectionState next) {
    return successors().contains(next);
  }

  public boolean isTerminal() {
    return this == FAILED;
  }
}
