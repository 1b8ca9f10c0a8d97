package com.acme.relay.spi;

/**
 * Callbacks emitted by a {@link MessagingTransport}. All methods default to no-ops so consumers
 * only override the events they care about.
 */
public interface TransportListener {

  default void onCredentialRequested(String payload) {}

  default void onReady() {}

  default void onAuthenticated() {}

  default void onAuthFailed(String reason) {}

  default void onDisconnected(String reason) {}

  default void onMessage(InboundMessage message) {}
}
