package ca.gc.cra.xlog.domain.time;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable view of "now" used for record timestamps and file rotation.
 * <p><strong>Why:</strong> Every field is derived from one sampled instant, so readers never see a
 * UTC epoch from one refresh paired with a calendar string from another.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across connection and writer threads.</p>
 *
 * @param utcEpoch UTC epoch seconds including the fractional part
 * @param utcSecond {@code utcEpoch} truncated to whole seconds
 * @param utcTimestamp fixed-width {@code %15.4f} rendering of {@code utcEpoch}
 * @param utcYmd UTC calendar date as {@code YYMMDD}
 * @param utcHms UTC time of day as {@code HHMMSS}
 * @param localYmd local calendar date as {@code YYMMDD}
 * @param localHms local time of day as {@code HHMMSS}
 * @since 0.1.0
 */
public record ClockSnapshot(
    double utcEpoch,
    long utcSecond,
    String utcTimestamp,
    String utcYmd,
    String utcHms,
    String localYmd,
    String localHms) {

  private static final DateTimeFormatter YMD = DateTimeFormatter.ofPattern("uuMMdd", Locale.ROOT);
  private static final DateTimeFormatter HMS = DateTimeFormatter.ofPattern("HHmmss", Locale.ROOT);

  /**
   * Validates the snapshot fields.
   */
  public ClockSnapshot {
    Objects.requireNonNull(utcTimestamp, "utcTimestamp");
    Objects.requireNonNull(utcYmd, "utcYmd");
    Objects.requireNonNull(utcHms, "utcHms");
    Objects.requireNonNull(localYmd, "localYmd");
    Objects.requireNonNull(localHms, "localHms");
  }

  /**
   * Derives every snapshot field from a single epoch value.
   *
   * @param utcEpoch UTC epoch seconds with fraction
   * @param localZone zone used for the local calendar strings
   * @return snapshot whose fields all describe {@code utcEpoch}
   */
  public static ClockSnapshot of(double utcEpoch, ZoneId localZone) {
    Objects.requireNonNull(localZone, "localZone");
    long second = (long) utcEpoch;
    Instant instant = Instant.ofEpochSecond(second);
    ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
    ZonedDateTime local = instant.atZone(localZone);
    return new ClockSnapshot(
        utcEpoch,
        second,
        formatTimestamp(utcEpoch),
        YMD.format(utc),
        HMS.format(utc),
        YMD.format(local),
        HMS.format(local));
  }

  /**
   * Renders an epoch value the way record prefixes carry it: 15 characters, 4 fraction digits.
   *
   * @param epochSeconds epoch seconds
   * @return right-aligned fixed-width decimal string
   */
  public static String formatTimestamp(double epochSeconds) {
    return String.format(Locale.ROOT, "%15.4f", epochSeconds);
  }
}
