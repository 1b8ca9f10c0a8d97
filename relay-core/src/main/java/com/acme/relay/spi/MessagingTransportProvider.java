package com.acme.relay.spi;

import com.acme.relay.config.RelayConfig;

/**
 * Factory discovered through {@link java.util.ServiceLoader}. Implementations are selected by
 * {@link #name()}.
 */
public interface MessagingTransportProvider {
  String name();

  MessagingTransport create(RelayConfig config);
}
