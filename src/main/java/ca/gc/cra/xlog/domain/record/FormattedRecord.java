package ca.gc.cra.xlog.domain.record;

import java.util.Objects;

/**
 * <strong>What:</strong> A normalized, fingerprinted log record ready to be appended to the flat file.
 * <p><strong>Role:</strong> Unit of hand-off between connection threads and the persistence writer.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param version format tag, see {@link RecordFormat#VERSION}
 * @param receivedTimestamp server receipt timestamp, 15 characters
 * @param eventTimestamp sender timestamp or the receipt timestamp when none was sent
 * @param id major client identifier
 * @param subId minor client identifier
 * @param errorLevel error level column
 * @param subLevel sub-level flag column
 * @param sha1 lowercase hex SHA-1 of {@code json}
 * @param json canonical JSON serialization of the event
 * @since 0.1.0
 */
public record FormattedRecord(
    String version,
    String receivedTimestamp,
    String eventTimestamp,
    String id,
    String subId,
    String errorLevel,
    String subLevel,
    String sha1,
    String json) {

  /**
   * Validates that no field is missing or contains the delimiter (the JSON field excepted).
   */
  public FormattedRecord {
    requireField("version", version);
    requireField("receivedTimestamp", receivedTimestamp);
    requireField("eventTimestamp", eventTimestamp);
    requireField("id", id);
    requireField("subId", subId);
    requireField("errorLevel", errorLevel);
    requireField("subLevel", subLevel);
    requireField("sha1", sha1);
    Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a persisted line back into its fields.
   *
   * @param line flat-file line, with or without the trailing newline
   * @return decoded record
   * @throws IllegalArgumentException if the line does not carry {@link RecordFormat#FIELD_COUNT} fields
   */
  public static FormattedRecord decode(String line) {
    Objects.requireNonNull(line, "line");
    String trimmed = line.endsWith("\n") ? line.substring(0, line.length() - 1) : line;
    String[] parts = trimmed.split(String.valueOf(RecordFormat.DELIMITER), RecordFormat.FIELD_COUNT);
    if (parts.length != RecordFormat.FIELD_COUNT) {
      throw new IllegalArgumentException(
          "record must have " + RecordFormat.FIELD_COUNT + " fields (was " + parts.length + ")");
    }
    return new FormattedRecord(
        parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6], parts[7], parts[8]);
  }

  /**
   * Joins the fields with the delimiter, without the trailing newline.
   *
   * @return record line
   */
  public String line() {
    char d = RecordFormat.DELIMITER;
    return new StringBuilder(json.length() + 128)
        .append(version).append(d)
        .append(receivedTimestamp).append(d)
        .append(eventTimestamp).append(d)
        .append(id).append(d)
        .append(subId).append(d)
        .append(errorLevel).append(d)
        .append(subLevel).append(d)
        .append(sha1).append(d)
        .append(json)
        .toString();
  }

  /**
   * Returns the line as appended to the flat file.
   *
   * @return {@link #line()} followed by {@code '\n'}
   */
  public String toFileLine() {
    return line() + '\n';
  }

  /**
   * Recomputes the digest of the JSON field and compares it with {@link #sha1()}.
   *
   * @return {@code true} when the payload is untouched
   */
  public boolean digestMatches() {
    return Digests.sha1Hex(json).equals(sha1);
  }

  private static void requireField(String name, String value) {
    Objects.requireNonNull(value, name);
    if (value.indexOf(RecordFormat.DELIMITER) >= 0 || value.indexOf('\n') >= 0) {
      throw new IllegalArgumentException(name + " must not contain delimiter or newline");
    }
  }
}
