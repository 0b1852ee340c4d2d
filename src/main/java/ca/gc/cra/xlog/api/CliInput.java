package ca.gc.cra.xlog.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments sorted into positional words, switches and {@code key=value} settings.
 *
 * <p>{@code --key=value} is accepted as a synonym of {@code key=value}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> positionals;
  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> positionals, List<String> keyValueArgs, Set<String> flags) {
    this.positionals = positionals;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Sorts raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    List<String> positionals = new ArrayList<>();
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.indexOf('=') > 0) {
          kv.add(arg.startsWith("--") ? arg.substring(2) : arg);
        } else if (arg.startsWith("-")) {
          flags.add(lower);
        } else {
          positionals.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(positionals), List.copyOf(kv), Set.copyOf(flags));
  }

  /**
   * Returns the {@code key=value} arguments with any leading {@code --} removed.
   *
   * @return arguments for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Returns words that are neither switches nor settings, in order.
   *
   * @return positional arguments
   */
  public List<String> positionals() {
    return positionals;
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a switch such as {@code --stop} was supplied.
   *
   * @param flag switch to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns switches other than the ones listed as known, so commands can reject typos.
   *
   * @param known switches the command understands
   * @return unknown switches, possibly empty
   */
  public Set<String> unknownFlags(Set<String> known) {
    Set<String> unknown = new LinkedHashSet<>(flags);
    unknown.remove("--help");
    unknown.remove("--verbose");
    unknown.removeAll(known);
    return unknown;
  }
}
