package ca.gc.cra.xlog.infrastructure.time;

import ca.gc.cra.xlog.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, keeping sub-millisecond precision for fractional
 * epoch seconds.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates an adapter over the UTC system clock.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over the supplied clock.
   *
   * @param clock time source
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }

  /**
   * Returns the current epoch seconds including the sub-second fraction reported by the clock.
   *
   * @return epoch seconds
   */
  @Override
  public double nowEpochSeconds() {
    Instant now = clock.instant();
    return now.getEpochSecond() + now.getNano() / 1_000_000_000.0d;
  }
}
