package ca.gc.cra.geotag.domain.correlate;

import java.util.Locale;

/**
 * How the distance and time thresholds combine when validating a correlation.
 *
 * @since 0.1.0
 */
public enum SatisfyMode {
  /** Both thresholds must hold. */
  ALL,
  /** Either threshold suffices. */
  ANY;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw mode text; {@code null} or blank yields {@link #ANY}
   * @return parsed mode
   * @throws IllegalArgumentException if the value is neither {@code all} nor {@code any}
   */
  public static SatisfyMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return ANY;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "all" -> ALL;
      case "any" -> ANY;
      default -> throw new IllegalArgumentException("satisfy must be 'all' or 'any' (was " + raw + ")");
    };
  }
}
