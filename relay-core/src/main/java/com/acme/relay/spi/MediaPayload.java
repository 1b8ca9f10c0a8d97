package com.acme.relay.spi;

/** Downloaded media; {@code data} is the base64 encoded body as handed out by the transport. */
public record MediaPayload(String mimeType, String data, String filename) {}
