package com.acme.relay.queue;

import com.acme.relay.spi.MediaPayload;
import com.acme.relay.spi.MessageContent;
import com.acme.relay.spi.SendOptions;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;

/**
 * One outbound message awaiting delivery. Owned by {@link DeliveryQueue} until dequeued; only the
 * attempt counter changes afterwards.
 */
@Getter
public class RelayJob {

  private final String id;
  private final String sourceEndpoint;
  private final String destinationEndpoint;
  private final PayloadKind payloadKind;
  private final String content;
  private final MediaPayload media;
  private final String prefix;
  private final Instant enqueuedAt;
  private volatile int attemptCount;

  private RelayJob(
      String sourceEndpoint,
      String destinationEndpoint,
      PayloadKind payloadKind,
      String content,
      MediaPayload media,
      String prefix) {
    this.id = UUID.randomUUID().toString();
    this.sourceEndpoint = sourceEndpoint;
    this.destinationEndpoint = destinationEndpoint;
    this.payloadKind = payloadKind;
    this.content = content;
    this.media = media;
    this.prefix = prefix == null ? "" : prefix;
    this.enqueuedAt = Instant.now();
  }

  public static RelayJob text(String from, String to, String text, String prefix) {
    return new RelayJob(from, to, PayloadKind.TEXT, text, null, prefix);
  }

  public static RelayJob media(String from, String to, MediaPayload media, String caption, String prefix) {
    return new RelayJob(from, to, PayloadKind.MEDIA, caption, media, prefix);
  }

  /** Text with the provenance prefix; the separating space only appears when a prefix is set. */
  public static String prefixed(String prefix, String text) {
    boolean hasPrefix = prefix != null && !prefix.isEmpty();
    boolean hasText = text != null && !text.isEmpty();
    if (hasPrefix && hasText) {
      return prefix + " " + text;
    }
    return hasPrefix ? prefix : (hasText ? text : "");
  }

  public MessageContent outboundContent() {
    return payloadKind == PayloadKind.TEXT
        ? MessageContent.text(prefixed(prefix, content))
        : MessageContent.media(media);
  }

  public SendOptions sendOptions() {
    return payloadKind == PayloadKind.TEXT
        ? SendOptions.none()
        : SendOptions.withCaption(prefixed(prefix, content));
  }

  public int recordAttempt() {
    return ++attemptCount;
  }

  @Override
  public String toString() {
    return "RelayJob{id=" + id + ", kind=" + payloadKind + ", to=" + destinationEndpoint
        + ", attempts=" + attemptCount + "}";
  }
}
