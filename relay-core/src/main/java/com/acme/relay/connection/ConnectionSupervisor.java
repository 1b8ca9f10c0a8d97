package com.acme.relay.connection;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.PermanentException;
import com.acme.relay.core.SessionNotReadyException;
import com.acme.relay.scheduler.Scheduler;
import com.acme.relay.spi.MessagingTransport;
import com.acme.relay.spi.TransportListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the messaging session and drives its lifecycle from transport events.
 *
 * <p>Transport callbacks are handled one at a time under the supervisor lock; the lock is never
 * held while the transport starts, and at most one start runs at a time. When the session
 * drops, a reconnect is scheduled after {@code min(base * 2^attempts, max)}; the attempt counter
 * resets whenever the session becomes ready, and once it reaches the configured maximum the
 * supervisor moves to {@link ConnectionState#FAILED} for good. Listeners observe transitions after
 * the lock has been released, so a listener may call back into the supervisor.
 */
public class ConnectionSupervisor implements TransportListener {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectionSupervisor.class);

  private final Object lock = new Object();
  private final MessagingTransport transport;
  private final Scheduler scheduler;
  private final int maxReconnectAttempts;
  private final long reconnectBaseDelayMs;
  private final long reconnectMaxDelayMs;
  private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

  // guarded by lock
  private final List<Transition> unpublished = new ArrayList<>();
  private volatile ConnectionState state = ConnectionState.UNINITIALIZED;
  private int reconnectAttempts;
  private Scheduler.Cancellable pendingReconnect;
  private Throwable failureCause;
  private boolean registered;
  private boolean initializeInFlight;
  private boolean closed;

  public ConnectionSupervisor(MessagingTransport transport, Scheduler scheduler, RelayConfig config) {
    this.transport = transport;
    this.scheduler = scheduler;
    this.maxReconnectAttempts = config.getMaxReconnectAttempts();
    this.reconnectBaseDelayMs = config.getReconnectBaseDelay().toMillis();
    this.reconnectMaxDelayMs = config.getReconnectMaxDelay().toMillis();
  }

  public void addStateListener(ConnectionStateListener listener) {
    listeners.add(listener);
  }

  /** Registers an additional consumer of transport events, e.g. for inbound messages. */
  public void addTransportListener(TransportListener listener) {
    transport.addListener(listener);
  }

  public ConnectionState getState() {
    return state;
  }

  public int getReconnectAttempts() {
    synchronized (lock) {
      return reconnectAttempts;
    }
  }

  public Optional<Throwable> getFailureCause() {
    synchronized (lock) {
      return Optional.ofNullable(failureCause);
    }
  }

  public boolean isReady() {
    return state == ConnectionState.READY;
  }

  /**
   * The live session.
   *
   * @throws SessionNotReadyException unless the state is {@code READY}
   */
  public MessagingTransport getSession() {
    ConnectionState current = state;
    if (current != ConnectionState.READY) {
      throw new SessionNotReadyException(current);
    }
    return transport;
  }

  long reconnectDelay(int attempts) {
    double delay = reconnectBaseDelayMs * Math.pow(2, attempts);
    return (long) Math.min(delay, reconnectMaxDelayMs);
  }

  /**
   * Starts the session from {@code UNINITIALIZED} or {@code DISCONNECTED}. A transport that throws
   * here fails the supervisor and the exception is re-raised. The transport is started without
   * holding the supervisor lock, so it may report events from any thread while it starts.
   */
  public void initialize() {
    synchronized (lock) {
      if (!registered) {
        transport.addListener(this);
        registered = true;
      }
      if (initializeInFlight
          || (state != ConnectionState.UNINITIALIZED && state != ConnectionState.DISCONNECTED)) {
        throw new IllegalStateException("Cannot initialize session from state " + state);
      }
      LOG.info("Initializing messaging session...");
      transition(ConnectionState.INITIALIZING, "initialize");
      initializeInFlight = true;
    }
    publishTransitions();
    try {
      transport.initialize();
    } catch (RuntimeException e) {
      synchronized (lock) {
        initializeInFlight = false;
        if (isStarting()) {
          fail("Initialization failed: " + e.getMessage(), e);
        } else {
          LOG.warn("Initialization failed after session moved to {}: {}", state, e.getMessage());
        }
      }
      publishTransitions();
      throw e;
    }
    synchronized (lock) {
      initializeInFlight = false;
    }
  }

  /**
   * Blocks until the session is ready.
   *
   * @return false on timeout, or when the supervisor failed or was closed while waiting
   */
  public boolean awaitReady(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (lock) {
      while (state != ConnectionState.READY) {
        if (state.isTerminal() || closed) {
          return false;
        }
        long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
        if (remainingMs <= 0) {
          return false;
        }
        lock.wait(remainingMs);
      }
      return true;
    }
  }

  @Override
  public void onCredentialRequested(String payload) {
    synchronized (lock) {
      if (state == ConnectionState.INITIALIZING) {
        transition(ConnectionState.AWAITING_CREDENTIAL, "credential requested");
        LOG.info("Credential requested, waiting for it to be provided (payloadLength={})",
            payload == null ? 0 : payload.length());
      } else if (state == ConnectionState.AWAITING_CREDENTIAL) {
        LOG.info("Credential refreshed while waiting");
      } else {
        LOG.debug("Ignoring credential request in state {}", state);
      }
    }
    publishTransitions();
  }

  @Override
  public void onReady() {
    synchronized (lock) {
      if (state == ConnectionState.INITIALIZING || state == ConnectionState.AWAITING_CREDENTIAL) {
        reconnectAttempts = 0;
        transition(ConnectionState.READY, "session ready");
        LOG.info("Messaging session is ready");
      } else {
        LOG.debug("Ignoring ready event in state {}", state);
      }
    }
    publishTransitions();
  }

  @Override
  public void onAuthenticated() {
    LOG.info("Messaging session authenticated");
  }

  @Override
  public void onAuthFailed(String reason) {
    synchronized (lock) {
      if (state == ConnectionState.INITIALIZING || state == ConnectionState.AWAITING_CREDENTIAL) {
        fail("Authentication failed: " + reason, new PermanentException("Authentication failed: " + reason));
      } else {
        LOG.warn("Ignoring authentication failure in state {}: {}", state, reason);
      }
    }
    publishTransitions();
  }

  @Override
  public void onDisconnected(String reason) {
    synchronized (lock) {
      if (closed) {
        LOG.debug("Session closed, ignoring disconnect: {}", reason);
      } else if (state == ConnectionState.READY
          || state == ConnectionState.INITIALIZING
          || state == ConnectionState.AWAITING_CREDENTIAL) {
        LOG.warn("Messaging session disconnected reason={}", reason);
        transition(ConnectionState.DISCONNECTED, reason);
        scheduleReconnect(reason);
      } else {
        LOG.debug("Ignoring disconnect in state {}: {}", state, reason);
      }
    }
    publishTransitions();
  }

  /** Stops reconnecting and tears the session down. Later transport events are ignored. */
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      cancelPendingReconnect();
      lock.notifyAll();
    }
    LOG.info("Disconnecting messaging session...");
    transport.destroy();
    LOG.info("Messaging session disconnected");
  }

  private void reconnect() {
    synchronized (lock) {
      pendingReconnect = null;
      if (closed || state != ConnectionState.RECONNECT_SCHEDULED) {
        return;
      }
      if (initializeInFlight) {
        long delay = reconnectDelay(reconnectAttempts);
        LOG.info("Previous session start still running, retrying reconnect in {}ms", delay);
        pendingReconnect = scheduler.schedule(this::reconnect, Duration.ofMillis(delay));
        return;
      }
      transition(ConnectionState.INITIALIZING, "reconnect attempt " + reconnectAttempts);
      initializeInFlight = true;
    }
    publishTransitions();
    try {
      transport.initialize();
      synchronized (lock) {
        initializeInFlight = false;
      }
    } catch (RuntimeException e) {
      LOG.error("Reconnection failed: {}", e.getMessage(), e);
      synchronized (lock) {
        initializeInFlight = false;
        if (closed) {
          return;
        }
        if (state == ConnectionState.AWAITING_CREDENTIAL) {
          transition(ConnectionState.DISCONNECTED, "reconnect failed");
        }
        if (state == ConnectionState.INITIALIZING || state == ConnectionState.DISCONNECTED) {
          scheduleReconnect("reconnect failed: " + e.getMessage());
        }
      }
    }
    publishTransitions();
  }

  // caller holds lock
  private boolean isStarting() {
    return state == ConnectionState.INITIALIZING || state == ConnectionState.AWAITING_CREDENTIAL;
  }

  // caller holds lock
  private void scheduleReconnect(String reason) {
    transition(ConnectionState.RECONNECT_SCHEDULED, reason);
    reconnectAttempts++;
    if (reconnectAttempts >= maxReconnectAttempts) {
      LOG.error("Max reconnection attempts reached ({}/{})", reconnectAttempts, maxReconnectAttempts);
      fail("Failed to reconnect after " + reconnectAttempts + " attempts",
          new IllegalStateException("Failed to reconnect: " + reason));
      return;
    }
    long delay = reconnectDelay(reconnectAttempts);
    LOG.info("Attempting to reconnect ({}/{}) in {}ms...", reconnectAttempts, maxReconnectAttempts, delay);
    pendingReconnect = scheduler.schedule(this::reconnect, Duration.ofMillis(delay));
  }

  // caller holds lock
  private void fail(String reason, Throwable cause) {
    cancelPendingReconnect();
    failureCause = cause;
    LOG.error("Messaging session failed: {}", reason);
    transition(ConnectionState.FAILED, reason);
  }

  private void cancelPendingReconnect() {
    if (pendingReconnect != null) {
      pendingReconnect.cancel();
      pendingReconnect = null;
    }
  }

  // caller holds lock
  private void transition(ConnectionState next, String reason) {
    ConnectionState current = state;
    if (!current.canTransitionTo(next)) {
      throw new IllegalStateException("Invalid session transition " + current + " -> " + next);
    }
    state = next;
    unpublished.add(new Transition(current, next, reason));
    LOG.debug("Session state {} -> {} ({})", current, next, reason);
    lock.notifyAll();
  }

  private void publishTransitions() {
    // Callbacks nested in a locked section publish on the way out
    if (Thread.holdsLock(lock)) {
      return;
    }
    List<Transition> batch;
    synchronized (lock) {
      if (unpublished.isEmpty()) {
        return;
      }
      batch = new ArrayList<>(unpublished);
      unpublished.clear();
    }
    for (Transition t : batch) {
      for (ConnectionStateListener listener : listeners) {
        try {
          listener.onStateChange(t.from(), t.to(), t.reason());
        } catch (RuntimeException e) {
          LOG.error("State listener failed on {} -> {}", t.from(), t.to(), e);
        }
      }
    }
  }

  private record Transition(ConnectionState from, ConnectionState to, String reason) {}
}
