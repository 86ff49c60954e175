package ca.gc.cra.geotag.validation;

/**
 * Numeric bounds checks used while validating configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name label used in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is a finite number no smaller than zero.
   *
   * @param name label used in the error message
   * @param value value to check
   * @return {@code value}
   * @throws IllegalArgumentException when negative, NaN or infinite
   */
  public static double requireNonNegative(String name, double value) {
    if (!Double.isFinite(value) || value < 0d) {
      throw new IllegalArgumentException(label(name) + " must be a non-negative number (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
