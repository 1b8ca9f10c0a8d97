package com.acme.relay.monitor;

import com.acme.relay.scheduler.Scheduler;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodically logs heap usage and requests a collection when it crosses the threshold. */
public class MemoryMonitor {
  private static final Logger LOG = LoggerFactory.getLogger(MemoryMonitor.class);
  private static final long MB = 1024L * 1024L;

  private final MemoryMXBean memory;
  private final Scheduler scheduler;
  private final long thresholdMb;
  private final Duration interval;

  private Scheduler.Cancellable task;

  public MemoryMonitor(Scheduler scheduler, long thresholdMb, Duration interval) {
    this(ManagementFactory.getMemoryMXBean(), scheduler, thresholdMb, interval);
  }

  MemoryMonitor(MemoryMXBean memory, Scheduler scheduler, long thresholdMb, Duration interval) {
    this.memory = memory;
    this.scheduler = scheduler;
    this.thresholdMb = thresholdMb;
    this.interval = interval;
  }

  public synchronized void start() {
    if (task != null) {
      return;
    }
    LOG.info("Starting memory monitoring threshold={}MB interval={}ms", thresholdMb, interval.toMillis());
    task = scheduler.scheduleAtFixedRate(this::check, interval);
  }

  public synchronized void stop() {
    if (task != null) {
      task.cancel();
      task = null;
      LOG.info("Memory monitoring stopped");
    }
  }

  public synchronized boolean isRunning() {
    return task != null;
  }

  public long heapUsedMb() {
    return memory.getHeapMemoryUsage().getUsed() / MB;
  }

  public boolean isThresholdExceeded() {
    return heapUsedMb() > thresholdMb;
  }

  void check() {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    long usedMb = heap.getUsed() / MB;
    LOG.info("Memory usage heapUsed={}MB heapCommitted={}MB", usedMb, heap.getCommitted() / MB);
    if (usedMb > thresholdMb) {
      LOG.warn("Memory threshold exceeded, requesting GC threshold={}MB current={}MB", thresholdMb, usedMb);
      memory.gc();
      LOG.info("Memory cleanup completed heapUsed={}MB", heapUsedMb());
    }
  }
}
