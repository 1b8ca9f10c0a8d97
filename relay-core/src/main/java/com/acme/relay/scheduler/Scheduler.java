package com.acme.relay.scheduler;

import java.time.Duration;

/**
 * Timer capability behind every suspension point of the relay: queue pacing, retry backoff,
 * reconnect delays and periodic housekeeping. Tests substitute a deterministic implementation.
 */
public interface Scheduler {

  /** Suspends the calling worker for {@code duration}. */
  void sleep(Duration duration) throws InterruptedException;

  Cancellable schedule(Runnable task, Duration delay);

  Cancellable scheduleAtFixedRate(Runnable task, Duration period);

  void shutdown();

  @FunctionalInterface
  interface Cancellable {
    void cancel();
  }
}
