package ca.gc.cra.xlog.validation;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation for log path templates.
 * <p><strong>Why:</strong> A typo in a placeholder would otherwise silently become part of every file name.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private static final Pattern PLACEHOLDER = Pattern.compile("~([A-Za-z]+)~");
  private static final Set<String> KNOWN_PLACEHOLDERS = Set.of("me", "y", "ym", "ymd", "h", "hm", "hms");

  private Paths() {
    // Utility
  }

  /**
   * Validates a log path template. A blank template is allowed and disables persistence.
   *
   * @param template candidate template, e.g. {@code logs/~ym~/~me~-~ymd~.log}
   * @return trimmed template, or an empty string when blank
   * @throws IllegalArgumentException on control characters, unknown placeholders, or an unparseable path
   */
  public static String validateLogPathTemplate(String template) {
    String trimmed = Strings.optionalNoControl("logPath", template);
    if (trimmed.isEmpty()) {
      return trimmed;
    }
    Matcher matcher = PLACEHOLDER.matcher(trimmed);
    while (matcher.find()) {
      if (!KNOWN_PLACEHOLDERS.contains(matcher.group(1))) {
        throw new IllegalArgumentException("logPath has unknown placeholder " + matcher.group());
      }
    }
    try {
      Path path = Path.of(trimmed);
      if (path.getFileName() == null) {
        throw new IllegalArgumentException("logPath must name a file (was " + trimmed + ")");
      }
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("logPath is not a valid path: " + ex.getMessage(), ex);
    }
    return trimmed;
  }
}
