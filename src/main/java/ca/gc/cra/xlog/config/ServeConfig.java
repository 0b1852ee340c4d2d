package ca.gc.cra.xlog.config;

import ca.gc.cra.xlog.validation.Net;
import ca.gc.cra.xlog.validation.Numbers;
import ca.gc.cra.xlog.validation.Paths;
import ca.gc.cra.xlog.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for the {@code serve} command.
 *
 * @param host bind address
 * @param port bind port; {@code 0} selects an ephemeral port
 * @param backlog accept backlog
 * @param ipPrefix address prefix elided from diagnostics; may be empty
 * @param logPath flat-file path template; empty disables persistence
 * @param render whether accepted records are rendered through the viewer
 * @param viewer viewer identifier ({@code logging} or a class name)
 * @param instanceName process identity used for {@code ~me~} and marker records
 * @param pollInterval writer queue poll and main-loop stop check interval
 * @param drainTimeout maximum wait for the queue to empty during shutdown
 * @param writerStopTimeout maximum wait for the writer to acknowledge stop
 * @since 0.1.0
 */
public record ServeConfig(
    String host,
    int port,
    int backlog,
    String ipPrefix,
    String logPath,
    boolean render,
    String viewer,
    String instanceName,
    Duration pollInterval,
    Duration drainTimeout,
    Duration writerStopTimeout) {

  static final String DEFAULT_HOST = "0.0.0.0";
  static final int DEFAULT_PORT = 12321;
  static final int DEFAULT_BACKLOG = 50;
  static final String DEFAULT_LOG_PATH = "logs/~ym~/~me~-~ymd~.log";
  static final String DEFAULT_VIEWER = "logging";
  static final String DEFAULT_INSTANCE = "xlog";
  static final long DEFAULT_POLL_MILLIS = 1_000L;
  static final long DEFAULT_DRAIN_MILLIS = 10_000L;
  static final long DEFAULT_WRITER_STOP_MILLIS = 10_000L;

  /** Value of {@code logPath} that turns persistence off from the command line. */
  public static final String NO_LOG_PATH = "none";

  /**
   * Validates and normalizes all components.
   *
   * @throws IllegalArgumentException when a value is out of range or persistence and rendering are both off
   */
  public ServeConfig {
    host = Net.validateHost(host);
    Numbers.requireRange("port", port, 0, 65_535);
    Numbers.requireRange("backlog", backlog, 1, 65_535);
    ipPrefix = Strings.optionalNoControl("ipPrefix", ipPrefix);
    logPath = Paths.validateLogPathTemplate(logPath);
    viewer = Strings.requireNonBlank("viewer", viewer);
    instanceName = Strings.requirePrintableAscii("instanceName", instanceName, 64);
    if (instanceName.indexOf('/') >= 0 || instanceName.indexOf('\\') >= 0) {
      throw new IllegalArgumentException("instanceName must not contain path separators");
    }
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    Objects.requireNonNull(writerStopTimeout, "writerStopTimeout");
    if (logPath.isEmpty() && !render) {
      throw new IllegalArgumentException("logPath may only be disabled when render=true");
    }
  }

  /**
   * Returns the defaults used when no overrides are supplied.
   *
   * @return default serve configuration
   */
  public static ServeConfig defaults() {
    return new ServeConfig(
        DEFAULT_HOST,
        DEFAULT_PORT,
        DEFAULT_BACKLOG,
        "",
        DEFAULT_LOG_PATH,
        false,
        DEFAULT_VIEWER,
        DEFAULT_INSTANCE,
        Duration.ofMillis(DEFAULT_POLL_MILLIS),
        Duration.ofMillis(DEFAULT_DRAIN_MILLIS),
        Duration.ofMillis(DEFAULT_WRITER_STOP_MILLIS));
  }

  /**
   * Builds a configuration from flattened key/value options, falling back to {@link #defaults()}.
   *
   * @param options merged CLI/YAML/default options
   * @return validated configuration
   * @throws IllegalArgumentException when any value is invalid
   */
  public static ServeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ServeConfig defaults = defaults();

    String host = valueOr(options, "host", defaults.host());
    int port = (int) parseOr(options, "port", defaults.port(), 0, 65_535);
    int backlog = (int) parseOr(options, "backlog", defaults.backlog(), 1, 65_535);
    String ipPrefix = options.getOrDefault("ipPrefix", defaults.ipPrefix());
    String logPath = options.containsKey("logPath") ? options.get("logPath") : defaults.logPath();
    if (logPath != null && NO_LOG_PATH.equals(logPath.trim().toLowerCase(Locale.ROOT))) {
      logPath = "";
    }
    boolean render = flagOr(options, "render", defaults.render());
    String viewer = valueOr(options, "viewer", defaults.viewer());
    String instanceName = valueOr(options, "instanceName", defaults.instanceName());
    long poll = parseOr(options, "pollMillis", DEFAULT_POLL_MILLIS, 10, 60_000);
    long drain = parseOr(options, "drainTimeoutMillis", DEFAULT_DRAIN_MILLIS, 0, 600_000);
    long writerStop = parseOr(options, "writerStopTimeoutMillis", DEFAULT_WRITER_STOP_MILLIS, 0, 600_000);

    return new ServeConfig(
        host,
        port,
        backlog,
        ipPrefix,
        logPath,
        render,
        viewer,
        instanceName,
        Duration.ofMillis(poll),
        Duration.ofMillis(drain),
        Duration.ofMillis(writerStop));
  }

  /**
   * Indicates whether records are written to flat files.
   *
   * @return {@code true} when a log path template is configured
   */
  public boolean persistenceEnabled() {
    return !logPath.isEmpty();
  }

  private static String valueOr(Map<String, String> options, String key, String fallback) {
    String value = options.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static long parseOr(Map<String, String> options, String key, long fallback, long min, long max) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Numbers.parseRange(key, value, min, max);
  }

  private static boolean flagOr(Map<String, String> options, String key, boolean fallback) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Strings.parseFlag(key, value);
  }
}
