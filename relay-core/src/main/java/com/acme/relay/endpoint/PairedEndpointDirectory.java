package com.acme.relay.endpoint;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.spi.EndpointDirectory;
import java.util.Map;
import java.util.Optional;

/** Bidirectional mapping between the two configured endpoints. */
public class PairedEndpointDirectory implements EndpointDirectory {

  static final String UNKNOWN_PREFIX = "[Unknown]";

  private final Map<String, String> counterparts;
  private final Map<String, String> prefixes;

  public PairedEndpointDirectory(String endpointA, String prefixA, String endpointB, String prefixB) {
    if (endpointA == null || endpointB == null) {
      throw new IllegalArgumentException("Both endpoints are required");
    }
    if (endpointA.equals(endpointB)) {
      throw new IllegalArgumentException("Endpoints must differ: " + endpointA);
    }
    this.counterparts = Map.of(endpointA, endpointB, endpointB, endpointA);
    this.prefixes = Map.of(endpointA, nullToEmpty(prefixA), endpointB, nullToEmpty(prefixB));
  }

  public static PairedEndpointDirectory from(RelayConfig config) {
    return new PairedEndpointDirectory(
        config.getEndpointA(), config.getPrefixA(), config.getEndpointB(), config.getPrefixB());
  }

  @Override
  public Optional<String> lookup(String senderId) {
    return senderId == null ? Optional.empty() : Optional.ofNullable(counterparts.get(senderId));
  }

  @Override
  public String prefixFor(String senderId) {
    return senderId == null ? UNKNOWN_PREFIX : prefixes.getOrDefault(senderId, UNKNOWN_PREFIX);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
