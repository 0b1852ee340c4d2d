package ca.gc.cra.xlog.api;

import ca.gc.cra.xlog.application.json.JsonSupport;
import ca.gc.cra.xlog.application.pipeline.LineProtocolHandler;
import ca.gc.cra.xlog.config.DefaultsForMode;
import ca.gc.cra.xlog.config.SendConfig;
import ca.gc.cra.xlog.infrastructure.net.XlogClient;
import ca.gc.cra.xlog.logging.LoggingConfigurator;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Sends numbered test messages ({@code n001}, {@code n002}, ...) to a running server and logs each reply.
 *
 * @since 0.1.0
 */
public final class SendCli {
  private static final Logger log = LoggerFactory.getLogger(SendCli.class);
  private static final String SUMMARY_USAGE =
      "usage: xlog send [config=PATH] [hp=HOST:PORT] [srcid=ID] [subid=ID] [el=N] [sl=N] "
          + "[count=N] [rateMillis=N] [--stop] [--verbose]";
  private static final String HELP_TEXT = """
      XLOG test client

      Usage:
        send [options]

      Options (key=value or --key=value):
        config=PATH        YAML file with 'common' and 'send' sections
        hp=HOST:PORT       Server address (default localhost:12321)
        srcid=ID           Source id sent as _id (default 0001)
        subid=ID           Sub-id sent as _si (default ___a)
        el=N               Error level sent as _el (default 0)
        sl=N               Sub-level sent as _sl (default _)
        count=N            Number of messages (default 22)
        rateMillis=N       Pause between messages (default 150)
        --stop             Send !STOP! after the last message
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;
  private static final Set<String> KNOWN_FLAGS = Set.of("--stop");
  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

  private SendCli() {}

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
    }
    if (!input.unknownFlags(KNOWN_FLAGS).isEmpty()) {
      log.error("Unknown option(s): {}", input.unknownFlags(KNOWN_FLAGS));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    SendConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.SEND, input, SUMMARY_USAGE);
      if (input.hasFlag("--stop")) {
        effective.put("stop", "true");
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = SendConfig.fromMap(effective);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid send configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MDC.put("pipeline", "send");
    try {
      return send(config);
    } catch (IOException ex) {
      log.error("Connection to {} failed: {}", config.target(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Send interrupted");
      return ExitCode.INTERRUPTED;
    } finally {
      MDC.remove("pipeline");
    }
  }

  private static ExitCode send(SendConfig config) throws IOException, InterruptedException {
    JsonSupport json = new JsonSupport();
    int rejected = 0;
    log.info("Sending {} message(s) to {}", config.count(), config.target());
    try (XlogClient client = XlogClient.connect(config.target().toSocketAddress(), CONNECT_TIMEOUT)) {
      for (int n = 1; n <= config.count(); n++) {
        String line = json.canonical(message(config, n));
        String reply = client.send(line);
        if (reply.startsWith(LineProtocolHandler.ERROR_PREFIX)) {
          rejected++;
          log.warn("{} -> {}", line, reply);
        } else {
          log.info("{} -> {}", line, reply);
        }
        if (n < config.count() && !config.rate().isZero()) {
          Thread.sleep(config.rate().toMillis());
        }
      }
      if (config.stop()) {
        log.info("{} -> {}", LineProtocolHandler.STOP_COMMAND, client.send(LineProtocolHandler.STOP_COMMAND));
      }
    }
    if (rejected > 0) {
      log.error("{} of {} message(s) rejected", rejected, config.count());
      return ExitCode.RUNTIME_FAILURE;
    }
    return ExitCode.SUCCESS;
  }

  static Map<String, Object> message(SendConfig config, int n) {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("_id", config.sourceId());
    event.put("_si", config.subId());
    event.put("_el", scalar(config.errorLevel()));
    event.put("_sl", scalar(config.subLevel()));
    event.put("_msg", String.format(Locale.ROOT, "n%03d", n));
    event.put("n", n);
    return event;
  }

  private static Object scalar(String value) {
    return INTEGER.matcher(value).matches() ? (Object) Long.valueOf(value) : value;
  }
}
