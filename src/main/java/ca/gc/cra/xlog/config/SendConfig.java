package ca.gc.cra.xlog.config;

import ca.gc.cra.xlog.validation.Net;
import ca.gc.cra.xlog.validation.Numbers;
import ca.gc.cra.xlog.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code send} command, which pushes numbered test messages to a running server.
 *
 * @param target server endpoint
 * @param sourceId value sent as {@code _id}
 * @param subId value sent as {@code _si}
 * @param errorLevel value sent as {@code _el}; sent as a JSON number when it is an integer
 * @param subLevel value sent as {@code _sl}; sent as a JSON number when it is an integer
 * @param count number of messages
 * @param rate pause between messages
 * @param stop whether {@code !STOP!} is sent after the last message
 * @since 0.1.0
 */
public record SendConfig(
    Net.HostPort target,
    String sourceId,
    String subId,
    String errorLevel,
    String subLevel,
    int count,
    Duration rate,
    boolean stop) {

  static final String DEFAULT_TARGET = "localhost:12321";
  static final int DEFAULT_COUNT = 22;
  static final long DEFAULT_RATE_MILLIS = 150L;

  public SendConfig {
    Objects.requireNonNull(target, "target");
    sourceId = Strings.requirePrintableAscii("srcid", sourceId, 64);
    subId = Strings.requirePrintableAscii("subid", subId, 64);
    errorLevel = Strings.requirePrintableAscii("el", errorLevel, 16);
    subLevel = Strings.requirePrintableAscii("sl", subLevel, 16);
    Numbers.requireRange("count", count, 0, 1_000_000);
    Objects.requireNonNull(rate, "rate");
  }

  /**
   * Returns the defaults mirroring the classic load-test invocation.
   *
   * @return default send configuration
   */
  public static SendConfig defaults() {
    return new SendConfig(
        Net.parseHostPort(DEFAULT_TARGET),
        "0001",
        "___a",
        "0",
        "_",
        DEFAULT_COUNT,
        Duration.ofMillis(DEFAULT_RATE_MILLIS),
        false);
  }

  /**
   * Builds a configuration from flattened options.
   *
   * @param options merged CLI/YAML/default options
   * @return validated configuration
   * @throws IllegalArgumentException when any value is invalid
   */
  public static SendConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SendConfig defaults = defaults();
    String hp = options.get("hp");
    Net.HostPort target = hp == null || hp.isBlank() ? defaults.target() : Net.parseHostPort(hp);
    int count = defaults.count();
    if (options.get("count") != null && !options.get("count").isBlank()) {
      count = (int) Numbers.parseRange("count", options.get("count"), 0, 1_000_000);
    }
    long rate = DEFAULT_RATE_MILLIS;
    if (options.get("rateMillis") != null && !options.get("rateMillis").isBlank()) {
      rate = Numbers.parseRange("rateMillis", options.get("rateMillis"), 0, 60_000);
    }
    String stop = options.get("stop");
    return new SendConfig(
        target,
        valueOr(options, "srcid", defaults.sourceId()),
        valueOr(options, "subid", defaults.subId()),
        valueOr(options, "el", defaults.errorLevel()),
        valueOr(options, "sl", defaults.subLevel()),
        count,
        Duration.ofMillis(rate),
        stop != null && !stop.isBlank() && Strings.parseFlag("stop", stop));
  }

  private static String valueOr(Map<String, String> options, String key, String fallback) {
    String value = options.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
