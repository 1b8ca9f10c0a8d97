package com.acme.relay.shutdown;

import com.acme.relay.connection.ConnectionState;
import com.acme.relay.connection.ConnectionStateListener;
import com.acme.relay.connection.ConnectionSupervisor;
import com.acme.relay.counters.PersistentCounters;
import com.acme.relay.monitor.MemoryMonitor;
import com.acme.relay.scheduler.Scheduler;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent graceful shutdown: stop memory monitoring, stop counters auto-save, persist the
 * counters once, close the session, wait the grace period, then terminate with the exit code.
 * Any error along the way turns the exit code into 1. A supervisor entering {@code FAILED} is a
 * fatal condition and triggers {@code shutdown(1)}.
 */
public class ShutdownHandler implements ConnectionStateListener {
  private static final Logger LOG = LoggerFactory.getLogger(ShutdownHandler.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FATAL = 1;

  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final MemoryMonitor memoryMonitor;
  private final PersistentCounters counters;
  private final ConnectionSupervisor supervisor;
  private final Scheduler scheduler;
  private final Duration gracePeriod;
  private final ProcessTerminator terminator;

  public ShutdownHandler(
      MemoryMonitor memoryMonitor,
      PersistentCounters counters,
      ConnectionSupervisor supervisor,
      Scheduler scheduler,
      Duration gracePeriod,
      ProcessTerminator terminator) {
    this.memoryMonitor = memoryMonitor;
    this.counters = counters;
    this.supervisor = supervisor;
    this.scheduler = scheduler;
    this.gracePeriod = gracePeriod;
    this.terminator = terminator;
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  @Override
  public void onStateChange(ConnectionState from, ConnectionState to, String reason) {
    if (to == ConnectionState.FAILED) {
      LOG.error("Fatal session failure: {}", reason);
      shutdown(EXIT_FATAL);
    }
  }

  /**
   * @return false when a shutdown was already in progress and this call was discarded
   */
  public boolean shutdown(int exitCode) {
    if (!shuttingDown.compareAndSet(false, true)) {
      LOG.warn("Shutdown already in progress");
      return false;
    }
    LOG.info("Starting graceful shutdown (exitCode={})...", exitCode);
    int code = exitCode;
    try {
      LOG.info("Stopping memory monitoring...");
      memoryMonitor.stop();
      LOG.info("Stopping counters auto-save...");
      counters.stopAutoSave();
      LOG.info("Saving counters...");
      if (!counters.save()) {
        code = EXIT_FATAL;
      }
      supervisor.close();
      LOG.info("Graceful shutdown completed");
    } catch (RuntimeException e) {
      LOG.error("Error during graceful shutdown", e);
      code = EXIT_FATAL;
    } finally {
      awaitGracePeriod();
      terminator.terminate(code);
    }
    return true;
  }

  private void awaitGracePeriod() {
    try {
      scheduler.sleep(gracePeriod);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Shutdown grace period interrupted");
    }
  }
}
