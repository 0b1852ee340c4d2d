package ca.gc.cra.xlog.api;

import ca.gc.cra.xlog.application.pipeline.IngestServer;
import ca.gc.cra.xlog.application.pipeline.ShutdownReport;
import ca.gc.cra.xlog.config.CompositionRoot;
import ca.gc.cra.xlog.config.DefaultsForMode;
import ca.gc.cra.xlog.config.ServeConfig;
import ca.gc.cra.xlog.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the ingestion daemon until {@code !STOP!}, SIGINT/SIGTERM or a fatal failure.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: xlog serve [config=PATH] [host=ADDR] [port=0-65535] [logPath=TEMPLATE|none] "
          + "[render=true|false] [viewer=logging|CLASS] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      XLOG ingestion server

      Usage:
        serve [options]

      Options (key=value or --key=value):
        config=PATH               YAML file with 'common' and 'serve' sections
        host=ADDR                 Bind address (default 0.0.0.0)
        port=0-65535              Listen port (default 12321; 0 picks a free port)
        backlog=N                 Accept backlog (default 50)
        ipPrefix=PREFIX           Address prefix shortened to '~' in diagnostics
        logPath=TEMPLATE          Flat-file template (default logs/~ym~/~me~-~ymd~.log);
                                  placeholders ~me~ ~y~ ~ym~ ~ymd~ ~h~ ~hm~ ~hms~; 'none' disables files
        render=true|false         Render each record through the viewer (default false)
        viewer=logging|CLASS      Viewer id or RecordViewer class name (default logging)
        instanceName=NAME         Identity used for ~me~ and begin/end markers (default xlog)
        pollMillis=N              Writer poll interval (default 1000)
        drainTimeoutMillis=N      Shutdown wait for the queue to empty (default 10000)
        writerStopTimeoutMillis=N Shutdown wait for the writer to stop (default 10000)
        metricsExporter=otlp|none Metrics exporter (default otlp)
        otelEndpoint=URL          OTLP metrics endpoint
        otelResourceAttributes=K=V,...
        --dry-run                 Validate and print the effective settings, then exit
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run");
  private static final Duration HOOK_GRACE = Duration.ofSeconds(5);

  private ServeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve");
    }
    if (!input.unknownFlags(KNOWN_FLAGS).isEmpty()) {
      log.error("Unknown option(s): {}", input.unknownFlags(KNOWN_FLAGS));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ServeConfig config;
    String exporter;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.SERVE, input, SUMMARY_USAGE);
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = ServeConfig.fromMap(effective);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printPlan(config, exporter);
      return ExitCode.SUCCESS;
    }
    return serve(config);
  }

  private static ExitCode serve(ServeConfig config) {
    MDC.put("pipeline", "serve");
    try (CompositionRoot root = new CompositionRoot(config)) {
      IngestServer server = root.ingestServer();
      Duration hookWait = config.drainTimeout().plus(config.writerStopTimeout()).plus(HOOK_GRACE);
      Thread hook = new Thread(() -> stopFromHook(server, hookWait), "xlog-shutdown-hook");
      Runtime.getRuntime().addShutdownHook(hook);
      try {
        log.info("Starting XLOG server {} on {}:{}", config.instanceName(), config.host(), config.port());
        ShutdownReport report = server.run();
        if (!report.clean()) {
          log.warn("Server stopped without a clean drain ({})", report);
          return ExitCode.RUNTIME_FAILURE;
        }
        return ExitCode.SUCCESS;
      } finally {
        removeHook(hook);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Server interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (Exception ex) {
      ExitCode code = ExitCode.forFailure(ex);
      log.error("Server failed ({})", code, ex);
      return code;
    } finally {
      MDC.remove("pipeline");
    }
  }

  private static void stopFromHook(IngestServer server, Duration wait) {
    server.requestStop("shutdown signal");
    try {
      if (!server.awaitTermination(wait)) {
        log.error("Server did not finish within {} of the shutdown signal", wait);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for server shutdown");
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; hook stays registered");
    }
  }

  private static void printPlan(ServeConfig config, String exporter) {
    CliPrinter.println(
        "Serve dry-run: no socket will be opened.",
        " Bind             : " + config.host() + ":" + config.port() + " (backlog " + config.backlog() + ")",
        " Log path         : " + (config.persistenceEnabled() ? config.logPath() : "<disabled>"),
        " Render           : " + config.render() + " (viewer " + config.viewer() + ")",
        " Instance         : " + config.instanceName(),
        " IP prefix        : " + (config.ipPrefix().isEmpty() ? "<none>" : config.ipPrefix()),
        " Poll / drain     : " + config.pollInterval().toMillis() + " ms / " + config.drainTimeout().toMillis() + " ms",
        " Metrics exporter : " + exporter,
        " Re-run without --dry-run to start serving.");
  }
}
