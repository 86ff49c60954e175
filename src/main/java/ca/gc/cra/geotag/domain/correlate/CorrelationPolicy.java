package ca.gc.cra.geotag.domain.correlate;

import java.util.Locale;

/**
 * Tie-break policy selecting a position from the two track points bracketing a photo timestamp.
 *
 * @since 0.1.0
 */
public enum CorrelationPolicy {
  /** Linear interpolation between the bracketing points. */
  AVERAGE,
  /** Whichever bracketing point is temporally closer. */
  NEAREST,
  /** The bracketing point after the photo. */
  NEXT,
  /** The bracketing point before the photo. */
  PREV;

  /**
   * Parses a policy name case-insensitively.
   *
   * @param raw policy text; {@code null} or blank yields {@link #AVERAGE}
   * @return parsed policy
   * @throws IllegalArgumentException if the value is not a known policy
   */
  public static CorrelationPolicy fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return AVERAGE;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    try {
      return CorrelationPolicy.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("policy must be one of average, nearest, next, prev (was " + raw + ")", ex);
    }
  }
}
