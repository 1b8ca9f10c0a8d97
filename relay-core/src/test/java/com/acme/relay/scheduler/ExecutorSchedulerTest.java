package com.acme.relay.scheduler;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExecutorSchedulerTest {

  private final ExecutorScheduler scheduler = new ExecutorScheduler();

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
  }

  @Test
  @DisplayName("runs a delayed task once")
  void testSchedule() throws Exception {
    CountDownLatch ran = new CountDownLatch(1);

    scheduler.schedule(ran::countDown, Duration.ofMillis(10));

    assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @DisplayName("a periodic task keeps running after it throws")
  void testPeriodicSurvivesFailure() throws Exception {
    AtomicInteger runs = new AtomicInteger();
    CountDownLatch thirdRun = new CountDownLatch(3);

    scheduler.scheduleAtFixedRate(
        () -> {
          runs.incrementAndGet();
          thirdRun.countDown();
          throw new IllegalStateException("task failure");
        },
        Duration.ofMillis(10));

    assertThat(thirdRun.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(runs.get()).isGreaterThanOrEqualTo(3);
  }

  @Test
  @DisplayName("a cancelled task does not run")
  void testCancel() throws Exception {
    AtomicInteger runs = new AtomicInteger();

    scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200)).cancel();
    scheduler.sleep(Duration.ofMillis(300));

    assertThat(runs).hasValue(0);
  }
}
