package com.acme.relay.counters;

import com.acme.relay.core.Jsons;
import com.acme.relay.scheduler.Scheduler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable activity counters. Increments are in-memory and never fail; the snapshot reaches disk
 * on {@link #save()}, periodically once {@link #startAutoSave(Duration)} runs, and at shutdown.
 * A missing or unreadable file yields fresh counters.
 */
public class PersistentCounters {
  private static final Logger LOG = LoggerFactory.getLogger(PersistentCounters.class);

  private final Path file;
  private final Scheduler scheduler;
  private final Clock clock;

  private ActivityCounters counters;
  private Scheduler.Cancellable autoSave;

  public PersistentCounters(Path file, Scheduler scheduler) {
    this(file, scheduler, Clock.systemUTC());
  }

  public PersistentCounters(Path file, Scheduler scheduler, Clock clock) {
    this.file = file;
    this.scheduler = scheduler;
    this.clock = clock;
    this.counters = ActivityCounters.fresh(clock.instant());
  }

  public Path getFile() {
    return file;
  }

  public synchronized ActivityCounters load() {
    try {
      String json = Files.readString(file, StandardCharsets.UTF_8);
      ActivityCounters loaded = Jsons.fromJson(json, ActivityCounters.class);
      if (loaded == null) {
        throw new IOException("Counters file is empty");
      }
      if (loaded.getStartedAt() == null) {
        loaded.setStartedAt(clock.instant());
      }
      counters = loaded;
      LOG.info("Counters loaded messagesRelayed={} errorsEncountered={}",
          counters.getMessagesRelayed(), counters.getErrorsEncountered());
    } catch (NoSuchFileException e) {
      LOG.info("No existing counters file at {}, starting fresh", file);
      counters = ActivityCounters.fresh(clock.instant());
    } catch (IOException | RuntimeException e) {
      LOG.error("Failed to load counters from {}, using defaults", file, e);
      counters = ActivityCounters.fresh(clock.instant());
    }
    return counters.copy();
  }

  /**
   * Writes the current snapshot, stamping {@code lastSavedAt}.
   *
   * @return false when the write failed; the failure is logged, not thrown
   */
  public synchronized boolean save() {
    counters.setLastPersistedAt(clock.instant());
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      Files.writeString(tmp, Jsons.toPrettyJson(counters), StandardCharsets.UTF_8);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      LOG.debug("Counters saved to {}", file);
      return true;
    } catch (IOException | RuntimeException e) {
      LOG.error("Failed to save counters to {}", file, e);
      return false;
    }
  }

  public synchronized void startAutoSave(Duration interval) {
    if (autoSave != null) {
      LOG.debug("Counters auto-save already running");
      return;
    }
    LOG.info("Starting counters auto-save with interval: {}ms", interval.toMillis());
    autoSave = scheduler.scheduleAtFixedRate(this::save, interval);
  }

  public synchronized void stopAutoSave() {
    if (autoSave != null) {
      autoSave.cancel();
      autoSave = null;
      LOG.info("Counters auto-save stopped");
    }
  }

  public synchronized boolean isAutoSaving() {
    return autoSave != null;
  }

  public synchronized void reset() {
    counters = ActivityCounters.fresh(clock.instant());
    LOG.info("Counters reset to defaults");
  }

  public synchronized void incrementMessagesRelayed() {
    counters.setMessagesRelayed(counters.getMessagesRelayed() + 1);
    counters.setLastMessageAt(clock.instant());
  }

  public synchronized void incrementErrors() {
    counters.setErrorsEncountered(counters.getErrorsEncountered() + 1);
  }

  public synchronized ActivityCounters snapshot() {
    return counters.copy();
  }
}
