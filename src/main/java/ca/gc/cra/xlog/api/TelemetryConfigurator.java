package ca.gc.cra.xlog.api;

import ca.gc.cra.xlog.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry settings out of a command's option map into the {@code otel.*} system properties read by the
 * metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code options}
   * and applies the non-blank ones.
   *
   * @param options mutable option map
   * @return effective exporter name ({@code otlp} unless overridden)
   * @throws IllegalArgumentException for an unknown exporter, a malformed endpoint or non-ASCII attributes
   */
  static String configureMetrics(Map<String, String> options) {
    String exporter = take(options, "metricsExporter").toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      System.setProperty("otel.metrics.exporter", exporter);
    }

    String endpoint = take(options, "otelEndpoint");
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String attributes = take(options, "otelResourceAttributes");
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    String effective = exporter.isEmpty() ? "otlp" : exporter;
    log.debug("Metrics exporter {} (endpoint {})", effective, endpoint.isEmpty() ? "<default>" : endpoint);
    return effective;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String take(Map<String, String> options, String key) {
    String value = options == null ? null : options.remove(key);
    return value == null ? "" : value.trim();
  }
}
