package ca.gc.cra.geotag.domain.geo;

/**
 * <strong>What:</strong> Geographic point in decimal degrees with an optional elevation.
 * <p><strong>Role:</strong> Domain value object shared by tracks, correlation results, and metadata codecs.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param latitude latitude in decimal degrees, positive north
 * @param longitude longitude in decimal degrees, positive east
 * @param elevation elevation in metres above sea level; {@code null} when unknown
 * @since 0.1.0
 */
public record Position(double latitude, double longitude, Double elevation) {

  /**
   * Validates coordinate ranges.
   *
   * @throws IllegalArgumentException if latitude or longitude are out of range or not finite
   */
  public Position {
    if (!Double.isFinite(latitude) || latitude < -90d || latitude > 90d) {
      throw new IllegalArgumentException("latitude must be between -90 and 90 (was " + latitude + ")");
    }
    if (!Double.isFinite(longitude) || longitude < -180d || longitude > 180d) {
      throw new IllegalArgumentException("longitude must be between -180 and 180 (was " + longitude + ")");
    }
    if (elevation != null && !Double.isFinite(elevation)) {
      throw new IllegalArgumentException("elevation must be finite");
    }
  }

  /**
   * Creates a position without elevation.
   *
   * @param latitude latitude in decimal degrees
   * @param longitude longitude in decimal degrees
   * @return position with no elevation
   */
  public static Position of(double latitude, double longitude) {
    return new Position(latitude, longitude, null);
  }

  /**
   * Indicates whether this position carries an elevation.
   *
   * @return {@code true} when {@link #elevation()} is non-null
   */
  public boolean hasElevation() {
    return elevation != null;
  }
}
