package com.acme.relay.spi;

import java.util.Optional;

/**
 * Connect/send/receive primitives of the messaging session. Lifecycle outcomes are reported
 * asynchronously through {@link TransportListener} callbacks, not through return values.
 */
public interface MessagingTransport {
  void initialize();

  void destroy();

  void send(String destination, MessageContent content, SendOptions options);

  Optional<MediaPayload> downloadMedia(InboundMessage message);

  void addListener(TransportListener listener);
}
