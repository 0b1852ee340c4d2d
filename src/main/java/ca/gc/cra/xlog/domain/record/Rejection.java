package ca.gc.cra.xlog.domain.record;

import java.util.Objects;

/**
 * Describes why a line was refused, together with the offending input.
 *
 * @param reason rejection category
 * @param detail human-readable explanation
 * @param rawLine line as handed to the normalizer (source address included)
 * @since 0.1.0
 */
public record Rejection(RejectReason reason, String detail, String rawLine) {
  /**
   * Validates fields.
   */
  public Rejection {
    Objects.requireNonNull(reason, "reason");
    detail = detail == null ? "" : detail;
    rawLine = rawLine == null ? "" : rawLine;
  }

  /**
   * Returns the message sent to the client after {@code "E: "}.
   *
   * @return {@code "<label>: <detail>"} on a single line
   */
  public String message() {
    String text = detail.isEmpty() ? reason.label() : reason.label() + ": " + detail;
    return text.replace('\n', ' ').replace('\r', ' ');
  }
}
