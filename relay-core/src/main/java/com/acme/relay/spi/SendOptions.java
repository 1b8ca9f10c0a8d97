package com.acme.relay.spi;

import java.util.Optional;

public record SendOptions(String caption) {
  private static final SendOptions NONE = new SendOptions(null);

  public static SendOptions none() {
    return NONE;
  }

  public static SendOptions withCaption(String caption) {
    return caption == null || caption.isEmpty() ? NONE : new SendOptions(caption);
  }

  public Optional<String> captionValue() {
    return Optional.ofNullable(caption);
  }
}
