package ca.gc.cra.geotag.api;

import ca.gc.cra.geotag.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts {@code key=value} arguments into an ordered map.
 *
 * <p>Keys are limited to letters, digits, {@code . _ -}; {@code countryFields.<Country>} keys may also contain
 * spaces so that {@code "countryFields.United States=name,adminCode1"} works when quoted. Values may be empty
 * but must not contain control characters. A repeated key keeps its last value.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Pattern COUNTRY_KEY_PATTERN = Pattern.compile("^countryFields\\.[A-Za-z][A-Za-z .'()-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments.
   *
   * @param args {@code key=value} tokens
   * @return ordered map of keys to trimmed values
   * @throws IllegalArgumentException if a token is not {@code key=value} or contains illegal characters
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
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches() && !COUNTRY_KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
