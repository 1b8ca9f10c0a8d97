package com.acme.relay.connection;

/**
 * Observer of supervisor transitions. Called after the supervisor released its lock, in
 * transition order, on the thread that delivered the triggering event.
 */
@FunctionalInterface
public interface ConnectionStateListener {
  void onStateChange(ConnectionState from, ConnectionState to, String reason);
}
