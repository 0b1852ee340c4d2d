package ca.gc.cra.xlog.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock timestamps to the ingestion pipeline.
 * <p><strong>Why:</strong> Receipt timestamps and rotation decisions must be testable with a fake clock.</p>
 * <p><strong>Role:</strong> Domain port consumed by {@code ClockState}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; connection threads and the writer
 * read the clock concurrently.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.xlog.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z, subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current epoch time as fractional seconds.
   *
   * @return seconds since the epoch
   */
  default double nowEpochSeconds() {
    return nowMillis() / 1000.0d;
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
