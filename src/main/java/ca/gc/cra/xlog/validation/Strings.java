package ca.gc.cra.xlog.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by XLOG configuration and CLI layers.
 * <p><strong>Why:</strong> Identifiers end up in tab-delimited record prefixes and file names, so control
 * characters (the delimiter included) must be rejected up front.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Ensures a possibly empty value carries no control characters; used for optional settings.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; {@code null} is treated as empty
   * @return trimmed value, possibly empty
   * @throws IllegalArgumentException if the value contains control characters
   */
  public static String optionalNoControl(String name, String value) {
    if (value == null) {
      return "";
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return value.trim();
  }

  /**
   * Parses a boolean flag accepting {@code true/false}, {@code yes/no} and {@code 1/0}.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @return parsed flag
   * @throws IllegalArgumentException if the value is not a recognized flag
   */
  public static boolean parseFlag(String name, String value) {
    String text = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "yes", "1", "on" -> true;
      case "false", "no", "0", "off" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + value + ")"));
    };
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
