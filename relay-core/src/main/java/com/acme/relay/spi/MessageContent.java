package com.acme.relay.spi;

/** Outbound payload handed to {@link MessagingTransport#send}. */
public sealed interface MessageContent {

  record Text(String body) implements MessageContent {}

  record Media(MediaPayload payload) implements MessageContent {}

  static MessageContent text(String body) {
    return new Text(body);
  }

  static MessageContent media(MediaPayload payload) {
    return new Media(payload);
  }
}
