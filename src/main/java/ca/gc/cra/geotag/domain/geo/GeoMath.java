package ca.gc.cra.geotag.domain.geo;

/**
 * <strong>What:</strong> Spherical-earth distance helpers.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Constant-time trigonometry; no allocation.</p>
 *
 * @since 0.1.0
 */
public final class GeoMath {
  /** Mean Earth radius in metres used by the haversine formula. */
  public static final double EARTH_RADIUS_METERS = 6_371_000d;

  private GeoMath() {
    // Utility
  }

  /**
   * Computes the haversine great-circle distance between two positions. Elevation is ignored.
   *
   * @param a first position; never {@code null}
   * @param b second position; never {@code null}
   * @return distance in metres; {@code 0} for coincident points
   */
  public static double distance(Position a, Position b) {
    double lat1 = Math.toRadians(a.latitude());
    double lat2 = Math.toRadians(b.latitude());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(b.longitude() - a.longitude());
    double sinLat = Math.sin(dLat / 2d);
    double sinLon = Math.sin(dLon / 2d);
    double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
    // rounding can push h marginally above 1 for antipodal points
    double c = 2d * Math.asin(Math.sqrt(Math.min(1d, h)));
    return EARTH_RADIUS_METERS * c;
  }
}
