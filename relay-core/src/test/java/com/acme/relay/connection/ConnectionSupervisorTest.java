package com.acme.relay.connection;

import static org.assertj.core.api.Assertions.*;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.PermanentException;
import com.acme.relay.core.SessionNotReadyException;
import com.acme.relay.test.FakeTransport;
import com.acme.relay.test.ManualScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConnectionSupervisorTest {

  private FakeTransport transport;
  private ManualScheduler scheduler;
  private ConnectionSupervisor supervisor;
  private List<String> transitions;

  @BeforeEach
  void setUp() {
    transport = new FakeTransport();
    scheduler = new ManualScheduler();
    supervisor = new ConnectionSupervisor(transport, scheduler, new RelayConfig());
    transitions = new ArrayList<>();
    supervisor.addStateListener((from, to, reason) -> transitions.add(from + "->" + to));
  }

  private void becomeReady() {
    supervisor.initialize();
    transport.fireReady();
  }

  @Nested
  @DisplayName("Startup")
  class Startup {

    @Test
    @DisplayName("moves through INITIALIZING to READY")
    void testInitializeToReady() {
      supervisor.initialize();
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.INITIALIZING);

      transport.fireReady();

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.READY);
      assertThat(supervisor.isReady()).isTrue();
      assertThat(transitions).containsExactly("UNINITIALIZED->INITIALIZING", "INITIALIZING->READY");
    }

    @Test
    @DisplayName("waits for a credential before becoming ready")
    void testCredentialRequested() {
      supervisor.initialize();
      transport.fireCredentialRequested("qr-payload");

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.AWAITING_CREDENTIAL);

      transport.fireReady();

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.READY);
    }

    @Test
    @DisplayName("publishes events fired from inside initialize in order")
    void testSynchronousReady() {
      transport.onInitialize(transport::fireReady);

      supervisor.initialize();

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.READY);
      assertThat(transitions).containsExactly("UNINITIALIZED->INITIALIZING", "INITIALIZING->READY");
    }

    @Test
    @DisplayName("handles events from another thread while the transport is starting")
    void testEventFromOtherThreadDuringInitialize() {
      CompletableFuture<Boolean> handled = new CompletableFuture<>();
      transport.onInitialize(() -> {
        Thread browser = new Thread(() -> transport.fireCredentialRequested("qr-payload"));
        browser.start();
        try {
          browser.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        handled.complete(!browser.isAlive());
      });

      supervisor.initialize();

      assertThat(handled).isCompletedWithValue(true);
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.AWAITING_CREDENTIAL);
    }

    @Test
    @DisplayName("fails and rethrows when the transport cannot start")
    void testInitializeFailure() {
      transport.failInitialize(new IllegalStateException("browser crashed"));

      assertThatThrownBy(() -> supervisor.initialize()).hasMessage("browser crashed");
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.FAILED);
      assertThat(supervisor.getFailureCause()).get().extracting(Throwable::getMessage).isEqualTo("browser crashed");
    }

    @Test
    @DisplayName("fails permanently on authentication failure")
    void testAuthFailure() {
      supervisor.initialize();
      transport.fireAuthFailed("bad credential");

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.FAILED);
      assertThat(supervisor.getFailureCause()).get().isInstanceOf(PermanentException.class);
      assertThat(transitions).last().isEqualTo("INITIALIZING->FAILED");
    }

    @Test
    @DisplayName("refuses to initialize a ready session")
    void testDoubleInitialize() {
      becomeReady();

      assertThatThrownBy(() -> supervisor.initialize()).isInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("Session access")
  class SessionAccess {

    @Test
    @DisplayName("exposes the session only when ready")
    void testGetSession() {
      assertThatThrownBy(() -> supervisor.getSession())
          .isInstanceOfSatisfying(
              SessionNotReadyException.class,
              e -> assertThat(e.getState()).isEqualTo(ConnectionState.UNINITIALIZED));

      becomeReady();

      assertThat(supervisor.getSession()).isSameAs(transport);
    }

    @Test
    @DisplayName("awaitReady returns at once when ready")
    void testAwaitReadyImmediate() throws Exception {
      becomeReady();

      assertThat(supervisor.awaitReady(Duration.ofMillis(10))).isTrue();
    }

    @Test
    @DisplayName("awaitReady times out while still initializing")
    void testAwaitReadyTimeout() throws Exception {
      supervisor.initialize();

      assertThat(supervisor.awaitReady(Duration.ofMillis(50))).isFalse();
    }

    @Test
    @DisplayName("awaitReady wakes up when another thread reports ready")
    void testAwaitReadyWakesUp() throws Exception {
      supervisor.initialize();
      CompletableFuture<Boolean> waiter =
          CompletableFuture.supplyAsync(
              () -> {
                try {
                  return supervisor.awaitReady(Duration.ofSeconds(10));
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                  return false;
                }
              });

      transport.fireReady();

      assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("awaitReady returns false once failed")
    void testAwaitReadyFailed() throws Exception {
      supervisor.initialize();
      transport.fireAuthFailed("nope");

      assertThat(supervisor.awaitReady(Duration.ofSeconds(10))).isFalse();
    }
  }

  @Nested
  @DisplayName("Reconnection")
  class Reconnection {

    @Test
    @DisplayName("schedules a reconnect with exponential delay on disconnect")
    void testScheduleReconnect() {
      becomeReady();

      transport.fireDisconnected("NAVIGATION");

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.RECONNECT_SCHEDULED);
      assertThat(supervisor.getReconnectAttempts()).isEqualTo(1);
      assertThat(scheduler.pendingDelays()).containsExactly(2000L);
      assertThat(transitions)
          .endsWith("READY->DISCONNECTED", "DISCONNECTED->RECONNECT_SCHEDULED");

      scheduler.runNext();

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.INITIALIZING);
      assertThat(transport.initializeCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("fails after five consecutive disconnects")
    void testMaxAttempts() {
      becomeReady();
      List<Long> delays = new ArrayList<>();

      for (int i = 0; i < 4; i++) {
        transport.fireDisconnected("LOGOUT");
        delays.addAll(scheduler.pendingDelays());
        scheduler.runNext();
      }
      transport.fireDisconnected("LOGOUT");

      assertThat(delays).containsExactly(2000L, 4000L, 8000L, 16000L);
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.FAILED);
      assertThat(supervisor.getReconnectAttempts()).isEqualTo(5);
      assertThat(scheduler.pendingDelays()).isEmpty();
      assertThat(transitions).last().isEqualTo("RECONNECT_SCHEDULED->FAILED");
    }

    @Test
    @DisplayName("resets the attempt counter once ready again")
    void testReadyResetsAttempts() {
      becomeReady();
      transport.fireDisconnected("x");
      scheduler.runNext();
      transport.fireDisconnected("x");
      scheduler.runNext();
      assertThat(supervisor.getReconnectAttempts()).isEqualTo(2);

      transport.fireReady();

      assertThat(supervisor.getReconnectAttempts()).isZero();
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.READY);
    }

    @Test
    @DisplayName("schedules another attempt when reconnecting throws")
    void testReconnectThrows() {
      becomeReady();
      transport.fireDisconnected("x");
      transport.failInitialize(new IllegalStateException("still down"));

      scheduler.runNext();

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.RECONNECT_SCHEDULED);
      assertThat(supervisor.getReconnectAttempts()).isEqualTo(2);
      assertThat(scheduler.pendingDelays()).containsExactly(4000L);
    }

    @Test
    @DisplayName("defers a reconnect while the previous start is still running")
    void testReconnectWaitsForRunningStart() {
      transport.onInitialize(() -> {
        transport.fireDisconnected("x");
        scheduler.runNext();
      });

      supervisor.initialize();

      assertThat(transport.initializeCalls()).isEqualTo(1);
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.RECONNECT_SCHEDULED);
      assertThat(supervisor.getReconnectAttempts()).isEqualTo(1);
      assertThat(scheduler.pendingDelays()).containsExactly(2000L);

      transport.onInitialize(() -> {});
      scheduler.runNext();

      assertThat(transport.initializeCalls()).isEqualTo(2);
      assertThat(supervisor.getState()).isEqualTo(ConnectionState.INITIALIZING);
    }

    @Test
    @DisplayName("caps the reconnect delay")
    void testDelayCap() {
      assertThat(supervisor.reconnectDelay(0)).isEqualTo(1000);
      assertThat(supervisor.reconnectDelay(4)).isEqualTo(16000);
      assertThat(supervisor.reconnectDelay(10)).isEqualTo(30000);
    }
  }

  @Nested
  @DisplayName("Close")
  class Close {

    @Test
    @DisplayName("cancels a pending reconnect and destroys the transport")
    void testClose() {
      becomeReady();
      transport.fireDisconnected("x");

      supervisor.close();

      assertThat(transport.isDestroyed()).isTrue();
      assertThat(scheduler.pendingDelays()).isEmpty();
    }

    @Test
    @DisplayName("ignores disconnects after close")
    void testDisconnectAfterClose() {
      becomeReady();
      supervisor.close();

      transport.fireDisconnected("x");

      assertThat(supervisor.getState()).isEqualTo(ConnectionState.READY);
      assertThat(scheduler.pendingDelays()).isEmpty();
    }
  }

  @Nested
  @DisplayName("ConnectionState")
  class States {

    @Test
    @DisplayName("FAILED is terminal")
    void testTerminal() {
      assertThat(ConnectionState.FAILED.isTerminal()).isTrue();
      assertThat(ConnectionState.FAILED.successors()).isEmpty();
      assertThat(ConnectionState.READY.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("only allows the documented edges")
    void testEdges() {
      assertThat(ConnectionState.UNINITIALIZED.canTransitionTo(ConnectionState.INITIALIZING)).isTrue();
      assertThat(ConnectionState.READY.canTransitionTo(ConnectionState.DISCONNECTED)).isTrue();
      assertThat(ConnectionState.READY.canTransitionTo(ConnectionState.FAILED)).isFalse();
      assertThat(ConnectionState.RECONNECT_SCHEDULED.canTransitionTo(ConnectionState.FAILED)).isTrue();
      assertThat(ConnectionState.UNINITIALIZED.canTransitionTo(ConnectionState.READY)).isFalse();
    }
  }
}
