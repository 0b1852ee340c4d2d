package ca.gc.cra.xlog.application.clock;

import ca.gc.cra.xlog.application.port.ClockPort;
import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import java.time.ZoneId;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Process-wide "current time" shared by connection threads and the writer.
 * <p><strong>Why:</strong> Every derived string (receipt timestamp, UTC and local calendar fields) must come from
 * one instant so rotation paths and record prefixes agree.</p>
 * <p><strong>Thread-safety:</strong> Refreshes are serialized by a lock; readers see the last published immutable
 * {@link ClockSnapshot} through a volatile reference and never a mix of two refreshes.</p>
 *
 * @since 0.1.0
 */
public final class ClockState {
  private final ClockPort clock;
  private final ZoneId localZone;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile ClockSnapshot current;

  /**
   * Creates clock state bound to the system zone.
   *
   * @param clock wall-clock source
   */
  public ClockState(ClockPort clock) {
    this(clock, ZoneId.systemDefault());
  }

  /**
   * Creates clock state with an explicit local zone.
   *
   * @param clock wall-clock source
   * @param localZone zone used for the local calendar strings
   */
  public ClockState(ClockPort clock, ZoneId localZone) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.localZone = Objects.requireNonNull(localZone, "localZone");
  }

  /**
   * Samples the wall clock and publishes a new snapshot.
   *
   * @return published snapshot
   */
  public ClockSnapshot refresh() {
    return refresh(OptionalDouble.empty());
  }

  /**
   * Publishes a snapshot for {@code explicitEpoch} when present, otherwise for the current wall-clock time.
   *
   * @param explicitEpoch optional epoch seconds seeding the snapshot
   * @return published snapshot
   */
  public ClockSnapshot refresh(OptionalDouble explicitEpoch) {
    lock.lock();
    try {
      double epoch = explicitEpoch.isPresent() ? explicitEpoch.getAsDouble() : clock.nowEpochSeconds();
      ClockSnapshot snapshot = ClockSnapshot.of(epoch, localZone);
      current = snapshot;
      return snapshot;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the last published snapshot, refreshing first when none exists yet.
   *
   * @return current snapshot
   */
  public ClockSnapshot current() {
    ClockSnapshot snapshot = current;
    return snapshot != null ? snapshot : refresh();
  }

  /**
   * Returns the zone used for local calendar strings.
   *
   * @return local zone
   */
  public ZoneId localZone() {
    return localZone;
  }
}
