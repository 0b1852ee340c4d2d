package ca.gc.cra.xlog.domain.path;

import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a flat-file path template against the local calendar of a {@link ClockSnapshot}.
 *
 * <p>Supported placeholders: {@code ~me~} (process identity), {@code ~y~}, {@code ~ym~},
 * {@code ~ymd~}, {@code ~h~}, {@code ~hm~}, {@code ~hms~}. Pure function; performs no I/O.</p>
 *
 * @since 0.1.0
 */
public final class LogPathTemplate {
  private final String template;
  private final String identity;

  private LogPathTemplate(String template, String identity) {
    this.template = template;
    this.identity = identity;
  }

  /**
   * Creates a resolver for the supplied template.
   *
   * @param template path template; {@code null} or blank disables persistence
   * @param identity process identity substituted for {@code ~me~}
   * @return template resolver
   */
  public static LogPathTemplate of(String template, String identity) {
    Objects.requireNonNull(identity, "identity");
    if (template == null || template.isBlank()) {
      return new LogPathTemplate(null, identity);
    }
    return new LogPathTemplate(template.trim(), identity);
  }

  /**
   * Returns a resolver that never yields a path.
   *
   * @return disabled template
   */
  public static LogPathTemplate disabled() {
    return new LogPathTemplate(null, "xlog");
  }

  /**
   * Indicates whether a template was configured.
   *
   * @return {@code true} when {@link #resolve(ClockSnapshot)} yields paths
   */
  public boolean enabled() {
    return template != null;
  }

  /**
   * Returns the raw template text.
   *
   * @return template or {@code null} when disabled
   */
  public String template() {
    return template;
  }

  /**
   * Substitutes the placeholders using the snapshot's local date and time.
   *
   * @param now snapshot supplying {@code localYmd}/{@code localHms}
   * @return resolved path, or empty when no template is configured
   */
  public Optional<Path> resolve(ClockSnapshot now) {
    if (template == null) {
      return Optional.empty();
    }
    Objects.requireNonNull(now, "now");
    String ymd = now.localYmd();
    String hms = now.localHms();
    String resolved = template
        .replace("~me~", identity)
        .replace("~y~", ymd.substring(0, 2))
        .replace("~ym~", ymd.substring(0, 4))
        .replace("~ymd~", ymd)
        .replace("~h~", hms.substring(0, 2))
        .replace("~hm~", hms.substring(0, 4))
        .replace("~hms~", hms);
    return Optional.of(Path.of(resolved));
  }

  @Override
  public String toString() {
    return template == null ? "<disabled>" : template;
  }
}
