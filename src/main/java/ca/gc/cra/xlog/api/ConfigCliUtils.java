package ca.gc.cra.xlog.api;

import ca.gc.cra.xlog.config.ConfigMerger;
import ca.gc.cra.xlog.config.DefaultsForMode;
import ca.gc.cra.xlog.config.YamlConfigLoader;
import ca.gc.cra.xlog.logging.LoggingConfigurator;
import ca.gc.cra.xlog.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared steps of the {@code serve} and {@code send} commands: CLI parsing, YAML loading and precedence merging.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Produces the effective configuration map for {@code mode}.
   *
   * @param mode command name
   * @param input parsed command line
   * @param usage one-line usage printed on argument errors
   * @return merged map (defaults &lt; YAML &lt; CLI), mutable
   * @throws CliAbort when arguments, the config file or the merged values are invalid
   */
  static Map<String, String> effectiveConfig(String mode, CliInput input, String usage) throws CliAbort {
    if (!input.positionals().isEmpty()) {
      log.error("Unexpected argument: {}", input.positionals().get(0));
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    Optional<Map<String, String>> yaml = loadYaml(extractConfigPath(cli), mode, usage);
    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
      if (!input.verbose() && parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled by configuration");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    return new LinkedHashMap<>(effective);
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Strings.parseFlag(key, value);
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }
}
