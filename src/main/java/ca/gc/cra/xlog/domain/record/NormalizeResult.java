package ca.gc.cra.xlog.domain.record;

import java.util.Objects;

/**
 * Outcome of normalizing one inbound line: either a record or a rejection.
 *
 * @param record formatted record when accepted, otherwise {@code null}
 * @param rejection rejection when refused, otherwise {@code null}
 * @since 0.1.0
 */
public record NormalizeResult(FormattedRecord record, Rejection rejection) {
  /**
   * Enforces that exactly one side is present.
   */
  public NormalizeResult {
    if ((record == null) == (rejection == null)) {
      throw new IllegalArgumentException("exactly one of record or rejection is required");
    }
  }

  /**
   * Creates an accepted result.
   *
   * @param record formatted record
   * @return accepted result
   */
  public static NormalizeResult accepted(FormattedRecord record) {
    return new NormalizeResult(Objects.requireNonNull(record, "record"), null);
  }

  /**
   * Creates a rejected result.
   *
   * @param reason rejection category
   * @param detail explanation
   * @param rawLine offending line
   * @return rejected result
   */
  public static NormalizeResult rejected(RejectReason reason, String detail, String rawLine) {
    return new NormalizeResult(null, new Rejection(reason, detail, rawLine));
  }

  /**
   * Indicates whether the line was accepted.
   *
   * @return {@code true} when {@link #record()} is present
   */
  public boolean accepted() {
    return record != null;
  }
}
