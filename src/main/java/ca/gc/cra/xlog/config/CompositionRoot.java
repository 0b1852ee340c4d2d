package ca.gc.cra.xlog.config;

import ca.gc.cra.xlog.application.clock.ClockState;
import ca.gc.cra.xlog.application.json.JsonSupport;
import ca.gc.cra.xlog.application.normalize.RecordNormalizer;
import ca.gc.cra.xlog.application.pipeline.IngestServer;
import ca.gc.cra.xlog.application.pipeline.LineProtocolHandler;
import ca.gc.cra.xlog.application.pipeline.PersistenceWriter;
import ca.gc.cra.xlog.application.pipeline.ShutdownCoordinator;
import ca.gc.cra.xlog.application.pipeline.XlogContext;
import ca.gc.cra.xlog.application.port.ClockPort;
import ca.gc.cra.xlog.application.port.ConsolePort;
import ca.gc.cra.xlog.application.port.LogFilePort;
import ca.gc.cra.xlog.application.port.MetricsPort;
import ca.gc.cra.xlog.application.port.RecordViewer;
import ca.gc.cra.xlog.domain.path.LogPathTemplate;
import ca.gc.cra.xlog.infrastructure.console.StreamConsoleAdapter;
import ca.gc.cra.xlog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.xlog.infrastructure.net.TcpIngestionListener;
import ca.gc.cra.xlog.infrastructure.persistence.FlatFileLogSink;
import ca.gc.cra.xlog.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.xlog.infrastructure.viewer.ViewerFactory;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that wires the ingestion daemon to its concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link ServeConfig} to a runnable object graph in one place.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; {@link #ingestServer()} builds a fresh graph on each
 * call and is not synchronized.</p>
 *
 * @since 0.1.0
 * @see IngestServer
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration DRAIN_POLL = Duration.ofMillis(100);

  private final ServeConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ConsolePort console;
  private final ZoneId localZone;
  private final boolean ownsMetrics;

  /**
   * Creates a root using the production adapters (OpenTelemetry metrics, system clock, process console).
   *
   * @param config validated serve configuration
   */
  public CompositionRoot(ServeConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter(), new StreamConsoleAdapter(),
        ZoneId.systemDefault(), true);
  }

  /**
   * Creates a root with caller-supplied adapters; the caller keeps ownership of {@code metrics}.
   *
   * @param config validated serve configuration
   * @param metrics metrics sink
   * @param clock wall clock
   * @param console raw console for progress dots and viewer failures
   * @param localZone zone used for local-time path placeholders and marker stamps
   */
  public CompositionRoot(
      ServeConfig config, MetricsPort metrics, ClockPort clock, ConsolePort console, ZoneId localZone) {
    this(config, metrics, clock, console, localZone, false);
  }

  private CompositionRoot(
      ServeConfig config,
      MetricsPort metrics,
      ClockPort clock,
      ConsolePort console,
      ZoneId localZone,
      boolean ownsMetrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.console = Objects.requireNonNull(console, "console");
    this.localZone = Objects.requireNonNull(localZone, "localZone");
    this.ownsMetrics = ownsMetrics;
  }

  /**
   * Builds a new, unstarted ingestion server.
   *
   * @return server ready for {@link IngestServer#run()}
   * @throws IllegalArgumentException if the configured viewer cannot be created
   */
  public IngestServer ingestServer() {
    XlogContext context = new XlogContext();
    ClockState clockState = new ClockState(clock, localZone);
    JsonSupport json = new JsonSupport();
    RecordNormalizer normalizer = new RecordNormalizer(clockState, json);
    LogPathTemplate template = config.persistenceEnabled()
        ? LogPathTemplate.of(config.logPath(), config.instanceName())
        : LogPathTemplate.disabled();
    RecordViewer viewer = config.render() ? ViewerFactory.create(config.viewer()) : null;
    LogFilePort sink = new FlatFileLogSink();

    PersistenceWriter writer = new PersistenceWriter(
        context, clockState, template, sink, viewer, json, metrics, console, config.pollInterval());
    LineProtocolHandler handler = new LineProtocolHandler(context, normalizer, metrics, config.ipPrefix());
    TcpIngestionListener listener = new TcpIngestionListener(
        config.host(), config.port(), config.backlog(), handler, context, metrics, config.ipPrefix());
    ShutdownCoordinator coordinator = new ShutdownCoordinator(
        context,
        listener,
        normalizer,
        writer,
        sink,
        metrics,
        config.drainTimeout(),
        DRAIN_POLL,
        config.writerStopTimeout());

    log.debug(
        "Wired ingest server: bind={}:{}, logPath={}, render={}, viewer={}",
        config.host(),
        config.port(),
        template,
        config.render(),
        config.viewer());
    return new IngestServer(
        context, clockState, normalizer, writer, listener, coordinator, config.instanceName(), config.pollInterval());
  }

  /**
   * Returns the metrics sink shared by all components.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Closes the metrics adapter when this root created it. */
  @Override
  public void close() {
    if (ownsMetrics && metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
