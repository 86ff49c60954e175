package ca.gc.cra.geotag.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep remote payloads and account names out of GEOTAG log lines.
 * <p><strong>Role:</strong> Used by the GeoNames adapter when logging response excerpts and by {@code plan}
 * output when echoing the configured account.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {}

  /**
   * Shortens a string to at most {@code maxBytes} UTF-8 bytes, noting the original size.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the original text when it fits, otherwise a prefix followed by {@code "... (truncated, N of M bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    // back off to a code point boundary
    while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
      end--;
    }
    String prefix = new String(bytes, 0, end, StandardCharsets.UTF_8);
    return prefix + "... (truncated, " + end + " of " + bytes.length + " bytes)";
  }

  /**
   * Masks a sensitive value, keeping only whether it was set.
   *
   * @param value original value
   * @return {@code "<unset>"} for blank input, otherwise {@code "[REDACTED]"}
   */
  public static String redact(String value) {
    return value == null || value.isBlank() ? "<unset>" : REDACTED_PLACEHOLDER;
  }
}
