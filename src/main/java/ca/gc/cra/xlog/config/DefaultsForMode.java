package ca.gc.cra.xlog.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each XLOG command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  /** Mode name of the ingestion daemon. */
  public static final String SERVE = "serve";
  /** Mode name of the test/load client. */
  public static final String SEND = "send";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command ({@code serve} or {@code send})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case SERVE -> buildServeDefaults();
      case SEND -> buildSendDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    ServeConfig defaults = ServeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", defaults.host());
    map.put("port", Integer.toString(defaults.port()));
    map.put("backlog", Integer.toString(defaults.backlog()));
    map.put("ipPrefix", defaults.ipPrefix());
    map.put("logPath", defaults.logPath());
    map.put("render", Boolean.toString(defaults.render()));
    map.put("viewer", defaults.viewer());
    map.put("instanceName", defaults.instanceName());
    map.put("pollMillis", Long.toString(defaults.pollInterval().toMillis()));
    map.put("drainTimeoutMillis", Long.toString(defaults.drainTimeout().toMillis()));
    map.put("writerStopTimeoutMillis", Long.toString(defaults.writerStopTimeout().toMillis()));
    return map;
  }

  private static Map<String, String> buildSendDefaults() {
    SendConfig defaults = SendConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("hp", defaults.target().toString());
    map.put("srcid", defaults.sourceId());
    map.put("subid", defaults.subId());
    map.put("el", defaults.errorLevel());
    map.put("sl", defaults.subLevel());
    map.put("count", Integer.toString(defaults.count()));
    map.put("rateMillis", Long.toString(defaults.rate().toMillis()));
    map.put("stop", Boolean.toString(defaults.stop()));
    return map;
  }
}
