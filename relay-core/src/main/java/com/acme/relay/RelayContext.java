package com.acme.relay;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.connection.ConnectionSupervisor;
import com.acme.relay.counters.PersistentCounters;
import com.acme.relay.monitor.MemoryMonitor;
import com.acme.relay.queue.DeliveryQueue;
import com.acme.relay.relay.RelayService;
import com.acme.relay.retry.FailureClassifier;
import com.acme.relay.retry.RetryPolicy;
import com.acme.relay.scheduler.Scheduler;
import com.acme.relay.shutdown.ProcessTerminator;
import com.acme.relay.shutdown.ShutdownHandler;
import com.acme.relay.spi.EndpointDirectory;
import com.acme.relay.spi.MessagingTransport;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.Getter;

/**
 * Wiring of the relay components, built once at startup. Every component receives its
 * collaborators through its constructor; nothing is looked up globally.
 */
@Getter
public final class RelayContext {

  private final RelayConfig config;
  private final Scheduler scheduler;
  private final PersistentCounters counters;
  private final RetryPolicy retryPolicy;
  private final ConnectionSupervisor supervisor;
  private final DeliveryQueue queue;
  private final RelayService relayService;
  private final MemoryMonitor memoryMonitor;
  private final ShutdownHandler shutdownHandler;

  private RelayContext(
      RelayConfig config,
      MessagingTransport transport,
      EndpointDirectory directory,
      Scheduler scheduler,
      Executor queueExecutor,
      ProcessTerminator terminator) {
    this.config = config;
    this.scheduler = scheduler;
    this.counters = new PersistentCounters(config.getStateFile(), scheduler);
    FailureClassifier classifier = new FailureClassifier();
    this.retryPolicy = new RetryPolicy(config, classifier, scheduler);
    this.supervisor = new ConnectionSupervisor(transport, scheduler, config);
    this.queue = new DeliveryQueue(queueExecutor, scheduler, config.getRateLimitDelay());
    this.relayService =
        new RelayService(
            supervisor,
            directory,
            retryPolicy,
            classifier,
            queue,
            counters,
            config.getMediaApologyText());
    this.memoryMonitor =
        new MemoryMonitor(scheduler, config.getMemoryThresholdMb(), config.getMemoryCheckInterval());
    this.shutdownHandler =
        new ShutdownHandler(
            memoryMonitor,
            counters,
            supervisor,
            scheduler,
            config.getShutdownGracePeriod(),
            terminator);
    supervisor.addStateListener(shutdownHandler);
  }

  public static RelayContext create(
      RelayConfig config,
      MessagingTransport transport,
      EndpointDirectory directory,
      Scheduler scheduler,
      ProcessTerminator terminator) {
    return create(config, transport, directory, scheduler, newQueueExecutor(), terminator);
  }

  public static RelayContext create(
      RelayConfig config,
      MessagingTransport transport,
      EndpointDirectory directory,
      Scheduler scheduler,
      Executor queueExecutor,
      ProcessTerminator terminator) {
    return new RelayContext(config, transport, directory, scheduler, queueExecutor, terminator);
  }

  private static ExecutorService newQueueExecutor() {
    return Executors.newSingleThreadExecutor(
        r -> {
          Thread t = new Thread(r, "relay-queue");
          t.setDaemon(true);
          return t;
        });
  }
}
