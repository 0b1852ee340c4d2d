package ca.gc.cra.xlog.application.clock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import ca.gc.cra.xlog.testutil.ManualClock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ClockStateTest {

  @Test
  void refreshReadsTheClockAndPublishesTheSnapshot() {
    ManualClock clock = new ManualClock(1_704_067_200.125);
    ClockState state = new ClockState(clock, ZoneOffset.UTC);

    ClockSnapshot first = state.refresh();
    clock.advance(2);

    assertSame(first, state.current());
    assertEquals(1_704_067_202L, state.refresh().utcSecond());
  }

  @Test
  void explicitEpochOverridesTheClock() {
    ClockState state = new ClockState(new ManualClock(1.0), ZoneOffset.UTC);

    ClockSnapshot snapshot = state.refresh(OptionalDouble.of(1_704_067_200d));

    assertEquals("240101", snapshot.utcYmd());
  }

  @Test
  void currentRefreshesLazily() {
    ClockState state = new ClockState(new ManualClock(1_704_067_200d), ZoneOffset.UTC);

    assertEquals("1704067200.0000", state.current().utcTimestamp());
  }

  @Test
  void concurrentRefreshNeverPublishesTornSnapshots() throws Exception {
    ZoneId zone = ZoneOffset.ofHours(-5);
    ManualClock clock = new ManualClock(1_704_153_599d);
    ClockState state = new ClockState(clock, zone);
    // instants on both sides of UTC and local midnight so every field differs between them
    List<Double> epochs = List.of(1_704_153_599.9999d, 1_704_153_600.0001d, 1_704_171_599.5d, 1_704_171_600.5d);
    ConcurrentLinkedQueue<String> torn = new ConcurrentLinkedQueue<>();
    CountDownLatch startGate = new CountDownLatch(1);
    int iterations = 5_000;

    ExecutorService executor = Executors.newFixedThreadPool(8);
    for (int t = 0; t < 4; t++) {
      int offset = t;
      executor.execute(() -> {
        awaitQuietly(startGate);
        for (int i = 0; i < iterations; i++) {
          double epoch = epochs.get((i + offset) % epochs.size());
          if (i % 2 == 0) {
            check(state.refresh(OptionalDouble.of(epoch)), zone, torn);
          } else {
            clock.set(epoch);
            check(state.refresh(), zone, torn);
          }
        }
      });
    }
    for (int t = 0; t < 4; t++) {
      executor.execute(() -> {
        awaitQuietly(startGate);
        for (int i = 0; i < iterations; i++) {
          check(state.current(), zone, torn);
        }
      });
    }
    startGate.countDown();
    executor.shutdown();
    assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS), "executor not drained");

    assertTrue(torn.isEmpty(), () -> "torn snapshots: " + torn);
  }

  private static void check(ClockSnapshot snapshot, ZoneId zone, ConcurrentLinkedQueue<String> torn) {
    if (!ClockSnapshot.of(snapshot.utcEpoch(), zone).equals(snapshot)) {
      torn.add(snapshot.toString());
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
