package ca.gc.cra.xlog.application.normalize;

import ca.gc.cra.xlog.application.clock.ClockState;
import ca.gc.cra.xlog.application.json.JsonSupport;
import ca.gc.cra.xlog.domain.record.Digests;
import ca.gc.cra.xlog.domain.record.FormattedRecord;
import ca.gc.cra.xlog.domain.record.NormalizeResult;
import ca.gc.cra.xlog.domain.record.RecordFormat;
import ca.gc.cra.xlog.domain.record.RejectReason;
import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates a source-prefixed line and turns it into a fingerprinted {@link FormattedRecord}.
 * <p><strong>Why:</strong> Every persisted event carries the six control keys, a receipt timestamp and a SHA-1 over
 * its canonical JSON so stored lines can be checked for tampering.</p>
 * <p><strong>Role:</strong> Called by connection threads before enqueueing; also synthesizes lifecycle markers.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link ClockState}; safe for concurrent use.</p>
 * <p><strong>Failure model:</strong> Never throws for bad input; every failure becomes a rejected
 * {@link NormalizeResult}.</p>
 *
 * @since 0.1.0
 */
public final class RecordNormalizer {
  private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

  /** Source address attributed to records the server generates itself. */
  public static final String SELF_ADDRESS = "0.0.0.0";
  /** Identifier used by lifecycle markers. */
  public static final String MARKER_ID = "----";

  private final ClockState clock;
  private final JsonSupport json;

  /**
   * Creates a normalizer.
   *
   * @param clock shared clock state refreshed for every accepted record
   * @param json JSON helper
   */
  public RecordNormalizer(ClockState clock, JsonSupport json) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Normalizes one {@code <ip> TAB <json-object>} line.
   *
   * @param line source-prefixed line without trailing newline
   * @return accepted record or rejection
   */
  public NormalizeResult normalize(String line) {
    if (line == null) {
      return NormalizeResult.rejected(RejectReason.BAD_SPLIT, "null line", "");
    }
    int tab = line.indexOf(RecordFormat.DELIMITER);
    if (tab < 0) {
      return NormalizeResult.rejected(RejectReason.BAD_SPLIT, "missing delimiter", line);
    }
    String ip = line.substring(0, tab);
    String payload = line.substring(tab + 1);
    if (!looksLikeIpv4(ip)) {
      return NormalizeResult.rejected(RejectReason.BAD_IP, "'" + ip + "'", line);
    }
    if (payload.isEmpty() || payload.charAt(0) != '{' || payload.charAt(payload.length() - 1) != '}') {
      return NormalizeResult.rejected(RejectReason.BAD_BRACKETS, "payload must be a {...} object", line);
    }
    Map<String, Object> event;
    try {
      event = json.parseObject(payload);
    } catch (IllegalArgumentException ex) {
      return NormalizeResult.rejected(RejectReason.BAD_JSON, ex.getMessage(), line);
    }
    try {
      return NormalizeResult.accepted(format(ip, event));
    } catch (RuntimeException ex) {
      log.debug("Normalization failed for {}", ip, ex);
      return NormalizeResult.rejected(RejectReason.INTERNAL, String.valueOf(ex.getMessage()), line);
    }
  }

  /**
   * Builds a lifecycle marker record (server start or stop) through the regular normalization path.
   *
   * @param message marker text stored under {@code _msg}
   * @return formatted marker record
   * @throws IllegalStateException if the marker cannot be normalized
   */
  public FormattedRecord formatMarker(String message) {
    Map<String, Object> marker = new LinkedHashMap<>();
    marker.put(RecordFormat.KEY_ID, MARKER_ID);
    marker.put(RecordFormat.KEY_SUB_ID, MARKER_ID);
    marker.put(RecordFormat.KEY_ERROR_LEVEL, 0);
    marker.put(RecordFormat.KEY_SUB_LEVEL, RecordFormat.DEFAULT_LEVEL);
    marker.put(RecordFormat.KEY_MESSAGE, message == null ? "" : message);
    NormalizeResult result = normalize(SELF_ADDRESS + RecordFormat.DELIMITER + json.canonical(marker));
    if (!result.accepted()) {
      throw new IllegalStateException("Marker rejected: " + result.rejection().message());
    }
    return result.record();
  }

  /**
   * Shape check applied to the source address: non-empty, digit at both ends, exactly three dots.
   *
   * @param ip candidate address
   * @return {@code true} when the address passes
   */
  static boolean looksLikeIpv4(String ip) {
    if (ip == null || ip.isEmpty()) {
      return false;
    }
    if (!Character.isDigit(ip.charAt(0)) || !Character.isDigit(ip.charAt(ip.length() - 1))) {
      return false;
    }
    int dots = 0;
    for (int i = 0; i < ip.length(); i++) {
      if (ip.charAt(i) == '.') {
        dots++;
      }
    }
    return dots == 3;
  }

  private FormattedRecord format(String ip, Map<String, Object> event) {
    event.put(RecordFormat.KEY_IP, ip);
    ClockSnapshot now = clock.refresh();
    String received = now.utcTimestamp();

    String id = control(event, RecordFormat.KEY_ID, RecordFormat.DEFAULT_ID, "%04d");
    String subId = control(event, RecordFormat.KEY_SUB_ID, RecordFormat.DEFAULT_ID, "%04d");
    String errorLevel = control(event, RecordFormat.KEY_ERROR_LEVEL, RecordFormat.DEFAULT_LEVEL, "%d");
    String subLevel = control(event, RecordFormat.KEY_SUB_LEVEL, RecordFormat.DEFAULT_LEVEL, "%d");
    String eventTimestamp = eventTimestamp(event, received);

    String canonical = json.canonical(event);
    return new FormattedRecord(
        RecordFormat.VERSION,
        received,
        eventTimestamp,
        id,
        subId,
        errorLevel,
        subLevel,
        Digests.sha1Hex(canonical),
        canonical);
  }

  private String control(Map<String, Object> event, String key, String fallback, String integerFormat) {
    Object value = event.get(key);
    String text;
    if (value == null) {
      text = fallback;
    } else if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
      text = String.format(Locale.ROOT, integerFormat, value);
    } else if (value instanceof Boolean flag) {
      text = String.format(Locale.ROOT, integerFormat, flag ? 1 : 0);
    } else if (value instanceof String s) {
      text = s;
    } else {
      text = json.toJsonText(value);
    }
    event.put(key, text);
    return text;
  }

  private String eventTimestamp(Map<String, Object> event, String received) {
    Object value = event.get(RecordFormat.KEY_TIMESTAMP);
    if (isBlankTimestamp(value)) {
      event.put(RecordFormat.KEY_TIMESTAMP, received);
      return received;
    }
    if (value instanceof Number number) {
      return ClockSnapshot.formatTimestamp(number.doubleValue());
    }
    if (value instanceof String s) {
      return s;
    }
    return json.toJsonText(value);
  }

  // null, false, zero and empty values all fall back to the receipt time
  private static boolean isBlankTimestamp(Object value) {
    if (value == null || Boolean.FALSE.equals(value)) {
      return true;
    }
    if (value instanceof String s) {
      return s.isEmpty();
    }
    if (value instanceof Number number) {
      return number.doubleValue() == 0d;
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    if (value instanceof List<?> list) {
      return list.isEmpty();
    }
    return false;
  }
}
