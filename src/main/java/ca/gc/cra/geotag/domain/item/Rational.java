package ca.gc.cra.geotag.domain.item;

/**
 * Unsigned-style rational number as stored in EXIF rational fields.
 *
 * @param numerator numerator
 * @param denominator denominator; must be positive
 * @since 0.1.0
 */
public record Rational(long numerator, long denominator) {

  public Rational {
    if (denominator <= 0L) {
      throw new IllegalArgumentException("denominator must be positive (was " + denominator + ")");
    }
  }

  /**
   * Approximates {@code value} with a fixed denominator.
   *
   * @param value value to encode
   * @param denominator fixed denominator, e.g. {@code 1000} for millisecond-style precision
   * @return rounded rational
   */
  public static Rational of(double value, long denominator) {
    return new Rational(Math.round(value * denominator), denominator);
  }

  /**
   * Parses {@code "n/d"} or a plain integer.
   *
   * @param text rational text
   * @return parsed rational
   * @throws IllegalArgumentException if the text is malformed
   */
  public static Rational parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("rational text must not be blank");
    }
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    try {
      if (slash < 0) {
        return new Rational(Long.parseLong(trimmed), 1L);
      }
      return new Rational(
          Long.parseLong(trimmed.substring(0, slash).trim()),
          Long.parseLong(trimmed.substring(slash + 1).trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("malformed rational: " + text, ex);
    }
  }

  public double doubleValue() {
    return (double) numerator / denominator;
  }

  @Override
  public String toString() {
    return numerator + "/" + denominator;
  }
}
