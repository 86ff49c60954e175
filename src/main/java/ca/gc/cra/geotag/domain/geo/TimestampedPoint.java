package ca.gc.cra.geotag.domain.geo;

import java.time.Instant;
import java.util.Objects;

/**
 * Track sample: a {@link Position} recorded at a UTC instant.
 *
 * @param time UTC instant of the sample; never {@code null}
 * @param position recorded position; never {@code null}
 * @since 0.1.0
 */
public record TimestampedPoint(Instant time, Position position) {

  public TimestampedPoint {
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(position, "position");
  }

  /**
   * Convenience factory for tests and parsers.
   *
   * @param time UTC instant
   * @param latitude latitude in decimal degrees
   * @param longitude longitude in decimal degrees
   * @param elevation elevation in metres; may be {@code null}
   * @return new point
   */
  public static TimestampedPoint of(Instant time, double latitude, double longitude, Double elevation) {
    return new TimestampedPoint(time, new Position(latitude, longitude, elevation));
  }
}
