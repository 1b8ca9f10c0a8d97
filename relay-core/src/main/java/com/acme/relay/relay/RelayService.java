package com.acme.relay.relay;

import com.acme.relay.connection.ConnectionSupervisor;
import com.acme.relay.core.MediaUnavailableException;
import com.acme.relay.counters.PersistentCounters;
import com.acme.relay.queue.DeliveryQueue;
import com.acme.relay.queue.PayloadKind;
import com.acme.relay.queue.RelayJob;
import com.acme.relay.retry.FailureClassifier;
import com.acme.relay.retry.RetryPolicy;
import com.acme.relay.spi.EndpointDirectory;
import com.acme.relay.spi.InboundMessage;
import com.acme.relay.spi.MediaPayload;
import com.acme.relay.spi.MessageContent;
import com.acme.relay.spi.SendOptions;
import com.acme.relay.spi.TransportListener;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards every message from one registered endpoint to its counterpart with a provenance
 * prefix.
 *
 * <p>Messages are relayed inline under the retry policy. While the delivery queue is rate limited
 * or still has a backlog (pending, in flight, or pacing after the last job) they go through the
 * queue instead so they cannot overtake older jobs. An inline send that the provider throttles
 * turns the rate-limit gate on and is queued; the next successful queued delivery turns it off. A
 * text that fails terminally is only logged. Media failures (download or send) answer the original
 * sender with an apology.
 */
@Slf4j
public class RelayService implements TransportListener {

  static final String RELAY_TEXT = "relayText";
  static final String RELAY_MEDIA = "relayMedia";
  static final String DOWNLOAD_MEDIA = "downloadMedia";

  private final ConnectionSupervisor supervisor;
  private final EndpointDirectory directory;
  private final RetryPolicy retryPolicy;
  private final FailureClassifier classifier;
  private final DeliveryQueue queue;
  private final PersistentCounters counters;
  private final String apologyText;

  public RelayService(
      ConnectionSupervisor supervisor,
      EndpointDirectory directory,
      RetryPolicy retryPolicy,
      FailureClassifier classifier,
      DeliveryQueue queue,
      PersistentCounters counters,
      String apologyText) {
    this.supervisor = supervisor;
    this.directory = directory;
    this.retryPolicy = retryPolicy;
    this.classifier = classifier;
    this.queue = queue;
    this.counters = counters;
    this.apologyText = apologyText;
    queue.bind(this::deliverQueued);
  }

  /** Subscribes to inbound messages of the transport. */
  public void start() {
    supervisor.addTransportListener(this);
    log.info("Message relay service started listening");
  }

  @Override
  public void onMessage(InboundMessage message) {
    handleIncoming(message);
  }

  public void handleIncoming(InboundMessage message) {
    try {
      log.info("Incoming message received from={} hasMedia={}", message.from(), message.hasMedia());
      Optional<String> destination = directory.lookup(message.from());
      if (destination.isEmpty()) {
        log.warn("Message from unknown sender, ignoring from={}", message.from());
        return;
      }
      String prefix = directory.prefixFor(message.from());
      if (message.hasMedia()) {
        relayMedia(message, destination.get(), prefix);
      } else {
        relayText(message, destination.get(), prefix);
      }
    } catch (RuntimeException e) {
      log.error("Error in handleIncoming from={}", message.from(), e);
      counters.incrementErrors();
    }
  }

  private boolean mustQueue() {
    return queue.isRateLimited() || queue.hasBacklog();
  }

  private void relayText(InboundMessage message, String to, String prefix) {
    RelayJob job = RelayJob.text(message.from(), to, message.body(), prefix);
    if (mustQueue()) {
      queue.enqueue(job);
      return;
    }
    try {
      send(job, RELAY_TEXT);
      counters.incrementMessagesRelayed();
      log.info("Text message relayed successfully from={} to={} messageLength={}",
          message.from(), to, message.body() == null ? 0 : message.body().length());
    } catch (RuntimeException e) {
      if (deferOnRateLimit(job, e)) {
        return;
      }
      counters.incrementErrors();
      log.error("Failed to relay text message from={} to={}: {}", message.from(), to, e.getMessage());
    }
  }

  private void relayMedia(InboundMessage message, String to, String prefix) {
    RelayJob job;
    try {
      MediaPayload media = downloadMedia(message);
      job = RelayJob.media(message.from(), to, media, message.body(), prefix);
    } catch (RuntimeException e) {
      counters.incrementErrors();
      log.error("Failed to download media from={}: {}", message.from(), e.getMessage());
      sendApology(message.from());
      return;
    }
    if (mustQueue()) {
      queue.enqueue(job);
      return;
    }
    try {
      send(job, RELAY_MEDIA);
      counters.incrementMessagesRelayed();
      log.info("Media message relayed successfully from={} to={} mediaType={}",
          message.from(), to, job.getMedia().mimeType());
    } catch (RuntimeException e) {
      if (deferOnRateLimit(job, e)) {
        return;
      }
      counters.incrementErrors();
      log.error("Failed to relay media message from={} to={}: {}", message.from(), to, e.getMessage());
      sendApology(message.from());
    }
  }

  private void send(RelayJob job, String label) {
    retryPolicy.retryWithBackoff(
        () -> {
          job.recordAttempt();
          supervisor.getSession()
              .send(job.getDestinationEndpoint(), job.outboundContent(), job.sendOptions());
          return null;
        },
        label);
  }

  /** Throttled inline sends close the gate and go through the queue instead of failing. */
  private boolean deferOnRateLimit(RelayJob job, RuntimeException e) {
    if (!classifier.isRateLimited(e)) {
      return false;
    }
    log.warn("Provider is rate limiting, queuing message id={} to={}", job.getId(), job.getDestinationEndpoint());
    queue.setRateLimited(true);
    queue.enqueue(job);
    return true;
  }

  private MediaPayload downloadMedia(InboundMessage message) {
    log.info("Downloading media id={}", message.id());
    Optional<MediaPayload> media =
        retryPolicy.retryWithBackoff(
            () -> supervisor.getSession().downloadMedia(message), DOWNLOAD_MEDIA);
    if (media == null || media.isEmpty()) {
      throw new MediaUnavailableException("Media download returned nothing for id=" + message.id());
    }
    log.info("Media downloaded successfully mimeType={} size={}",
        media.get().mimeType(), media.get().data() == null ? 0 : media.get().data().length());
    return media.get();
  }

  /** Delivery function of the queue; throws once the job has failed terminally. */
  void deliverQueued(RelayJob job) {
    String label = job.getPayloadKind() == PayloadKind.TEXT ? RELAY_TEXT : RELAY_MEDIA;
    try {
      send(job, label);
      counters.incrementMessagesRelayed();
      log.info("Queued message relayed successfully id={} to={}", job.getId(), job.getDestinationEndpoint());
      if (queue.isRateLimited()) {
        queue.setRateLimited(false);
      }
    } catch (RuntimeException e) {
      counters.incrementErrors();
      if (job.getPayloadKind() == PayloadKind.MEDIA) {
        sendApology(job.getSourceEndpoint());
      }
      throw e;
    }
  }

  private void sendApology(String to) {
    try {
      supervisor.getSession().send(to, MessageContent.text(apologyText), SendOptions.none());
      log.info("Apology sent to sender to={}", to);
    } catch (RuntimeException e) {
      counters.incrementErrors();
      log.error("Failed to send apology to={}", to, e);
    }
  }
}
