package com.acme.relay.spi;

import java.util.Optional;

/** Resolves the counterpart endpoint and the provenance prefix for a sender. */
public interface EndpointDirectory {
  Optional<String> lookup(String senderId);

  String prefixFor(String senderId);
}
