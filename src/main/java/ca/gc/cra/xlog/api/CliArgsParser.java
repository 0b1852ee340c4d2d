package ca.gc.cra.xlog.api;

import ca.gc.cra.xlog.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable map, splitting on the first {@code '='}.
 * <p>Stateless and thread-safe.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses the arguments; later duplicates override earlier ones.
   *
   * @param args {@code key=value} arguments; {@code null} returns an empty map
   * @return mutable insertion-ordered map
   * @throws IllegalArgumentException for malformed names, missing values or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = Strings.optionalNoControl(key, arg.substring(idx + 1));
      if (value.isEmpty()) {
        throw new IllegalArgumentException("argument " + key + " must not be blank");
      }
      map.put(key, value);
    }
    return map;
  }
}
