package ca.gc.cra.xlog.api;

import ca.gc.cra.xlog.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * XLOG command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: xlog <serve|send> [options]";
  private static final String HELP_TEXT = """
      XLOG log ingestion daemon

      Usage:
        xlog <command> [options]

      Commands:
        serve   Accept JSON log lines over TCP and append them to rotated flat files (serve --help)
        send    Send numbered test messages to a running server (send --help)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first positional word names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      String arg = safeArgs[i] == null ? "" : safeArgs[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && arg.indexOf('=') < 0) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> delegate = new ArrayList<>();
    for (int i = 0; i < safeArgs.length; i++) {
      if (i != commandIndex) {
        delegate.add(safeArgs[i]);
      }
    }
    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    if (command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (CliInput.parse(delegate.toArray(String[]::new)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      case "send" -> SendCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
