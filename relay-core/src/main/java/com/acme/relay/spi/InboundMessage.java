package com.acme.relay.spi;

import java.time.Instant;

public record InboundMessage(String id, String from, String body, boolean hasMedia, Instant receivedAt) {

  public static InboundMessage text(String id, String from, String body) {
    return new InboundMessage(id, from, body, false, Instant.now());
  }

  public static InboundMessage media(String id, String from, String caption) {
    return new InboundMessage(id, from, caption, true, Instant.now());
  }
}
