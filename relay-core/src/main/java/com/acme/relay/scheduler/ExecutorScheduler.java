package com.acme.relay.scheduler;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Scheduler} backed by a single daemon {@link ScheduledExecutorService} thread. */
public class ExecutorScheduler implements Scheduler {
  private static final Logger LOG = LoggerFactory.getLogger(ExecutorScheduler.class);

  private final ScheduledExecutorService timer;

  public ExecutorScheduler() {
    this.timer =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "relay-scheduler");
              t.setDaemon(true);
              return t;
            });
  }

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (!duration.isNegative() && !duration.isZero()) {
      TimeUnit.MILLISECONDS.sleep(duration.toMillis());
    }
  }

  @Override
  public Cancellable schedule(Runnable task, Duration delay) {
    ScheduledFuture<?> f = timer.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    return () -> f.cancel(false);
  }

  @Override
  public Cancellable scheduleAtFixedRate(Runnable task, Duration period) {
    long ms = period.toMillis();
    ScheduledFuture<?> f =
        timer.scheduleAtFixedRate(guard(task), ms, ms, TimeUnit.MILLISECONDS);
    return () -> f.cancel(false);
  }

  @Override
  public void shutdown() {
    timer.shutdownNow();
  }

  // A periodic task that throws is silently descheduled by the executor, so log and carry on.
  private static Runnable guard(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOG.error("Scheduled task failed: {}", e.getMessage(), e);
      }
    };
  }
}
