package com.acme.relay.queue;

import com.acme.relay.scheduler.Scheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single FIFO buffer of outbound relay jobs with a cooperative drain loop.
 *
 * <p>At most one drain runs at a time. The drain pops jobs strictly in enqueue order, hands each
 * to the bound {@link JobDelivery} and then waits the inter-message delay before the next one,
 * whatever the outcome. While the rate-limit gate is active an extra wait precedes every pop. A
 * job that fails terminally is logged and dropped, never re-enqueued.
 */
public class DeliveryQueue {
  private static final Logger LOG = LoggerFactory.getLogger(DeliveryQueue.class);

  private final LinkedBlockingQueue<RelayJob> buffer = new LinkedBlockingQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean(false);
  private final Executor drainExecutor;
  private final Scheduler scheduler;
  private final Duration interMessageDelay;

  private volatile JobDelivery delivery;
  private volatile boolean rateLimited;
  private volatile Duration rateLimitDelay;
  private volatile RelayJob inFlight;

  public DeliveryQueue(Executor drainExecutor, Scheduler scheduler, Duration interMessageDelay) {
    this.drainExecutor = drainExecutor;
    this.scheduler = scheduler;
    this.interMessageDelay = interMessageDelay;
    this.rateLimitDelay = interMessageDelay;
  }

  /** Binds the delivery function. Must happen before the first {@link #enqueue}. */
  public void bind(JobDelivery delivery) {
    this.delivery = delivery;
  }

  public void enqueue(RelayJob job) {
    if (delivery == null) {
      throw new IllegalStateException("DeliveryQueue has no delivery function bound");
    }
    buffer.add(job);
    LOG.info("Message added to queue id={} queueSize={}", job.getId(), buffer.size());
    startDrainIfIdle();
  }

  public int size() {
    return buffer.size();
  }

  public boolean isEmpty() {
    return buffer.isEmpty();
  }

  /**
   * True while a job is pending or being delivered, or the drain is still waiting out the
   * inter-message delay after the last one. New work must not bypass the queue while this holds.
   */
  public boolean hasBacklog() {
    return draining.get() || !buffer.isEmpty();
  }

  public boolean isDraining() {
    return draining.get();
  }

  public RelayJob getInFlight() {
    return inFlight;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public Duration getRateLimitDelay() {
    return rateLimitDelay;
  }

  public void setRateLimited(boolean active) {
    setRateLimited(active, null);
  }

  /**
   * Toggle the rate-limit gate consulted before every dequeue.
   *
   * @param delayOverride replaces the gate delay when non-null; it stays in effect afterwards
   */
  public void setRateLimited(boolean active, Duration delayOverride) {
    if (delayOverride != null) {
      this.rateLimitDelay = delayOverride;
    }
    this.rateLimited = active;
    if (active) {
      LOG.warn("Rate limit detected, queuing messages delay={}ms queueSize={}",
          rateLimitDelay.toMillis(), buffer.size());
    } else {
      LOG.info("Rate limit cleared, resuming message processing");
    }
  }

  /** Removes every pending job; the one in flight, if any, is not affected. */
  public int clear() {
    List<RelayJob> removed = new ArrayList<>();
    buffer.drainTo(removed);
    LOG.info("Queue cleared, {} messages removed", removed.size());
    return removed.size();
  }

  /** Pending jobs in delivery order. */
  public List<RelayJob> snapshot() {
    return List.copyOf(buffer);
  }

  private void startDrainIfIdle() {
    if (draining.compareAndSet(false, true)) {
      try {
        drainExecutor.execute(this::drain);
      } catch (RuntimeException e) {
        draining.set(false);
        LOG.error("Could not start queue drain, {} job(s) left pending", buffer.size(), e);
      }
    }
  }

  private void drain() {
    boolean interrupted = false;
    try {
      while (!buffer.isEmpty()) {
        if (rateLimited) {
          LOG.info("Waiting for rate limit to clear...");
          scheduler.sleep(rateLimitDelay);
        }
        RelayJob job = buffer.poll();
        if (job == null) {
          break;
        }
        LOG.info("Processing queued message id={} remainingInQueue={}", job.getId(), buffer.size());
        deliverOne(job);
        scheduler.sleep(interMessageDelay);
      }
    } catch (InterruptedException e) {
      interrupted = true;
      Thread.currentThread().interrupt();
      LOG.warn("Queue drain interrupted, {} job(s) left pending", buffer.size());
    } finally {
      draining.set(false);
    }
    // An enqueue that raced with the guard reset would otherwise be stranded
    if (!interrupted && !buffer.isEmpty()) {
      startDrainIfIdle();
    }
  }

  private void deliverOne(RelayJob job) {
    inFlight = job;
    try {
      delivery.deliver(job);
    } catch (RuntimeException e) {
      LOG.error("Dropping queued message id={} after {} attempt(s): {}",
          job.getId(), job.getAttemptCount(), e.getMessage(), e);
    } finally {
      inFlight = null;
    }
  }
}
