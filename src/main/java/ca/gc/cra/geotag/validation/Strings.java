package ca.gc.cra.geotag.validation;

import java.util.Objects;

/**
 * String sanitation helpers for configuration and CLI input.
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {}

  /**
   * Trims a value and rejects blank text or embedded control characters.
   *
   * @param name label used in the error message
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    return trimmed;
  }

  /**
   * Requires printable ASCII of bounded length, e.g. for values forwarded as HTTP query parameters.
   *
   * @param name label used in the error message
   * @param value raw value
   * @param maxLength maximum length after trimming
   * @return trimmed value
   * @throws IllegalArgumentException if blank, too long, or outside {@code 0x20..0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return sanitized;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
