package ca.gc.cra.xlog.domain.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted record decoded for console rendering: the prefix fields plus the full event mapping.
 *
 * @param record decoded prefix fields
 * @param event parsed canonical JSON payload
 * @since 0.1.0
 */
public record ViewedRecord(FormattedRecord record, Map<String, Object> event) {
  /**
   * Validates fields and freezes the event map. JSON {@code null} values are kept.
   */
  public ViewedRecord {
    Objects.requireNonNull(record, "record");
    event = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(event, "event")));
  }

  /**
   * Returns the event's {@code _msg} value rendered as text.
   *
   * @return message text, {@code "None"} when absent
   */
  public String message() {
    Object value = event.get(RecordFormat.KEY_MESSAGE);
    return value == null ? "None" : String.valueOf(value);
  }
}
