package ca.gc.cra.geotag.domain.geo;

import java.util.Objects;

/**
 * Pair of track points surrounding a query instant.
 *
 * <p>When the query falls outside the recorded span both points are the same clamped endpoint and
 * {@code boundary} is {@code true}.</p>
 *
 * @param prev last point at or before the query (or the clamped endpoint)
 * @param next first point after the query (or the clamped endpoint)
 * @param boundary whether the query lies outside the track span
 * @since 0.1.0
 */
public record TrackBracket(TimestampedPoint prev, TimestampedPoint next, boolean boundary) {

  public TrackBracket {
    Objects.requireNonNull(prev, "prev");
    Objects.requireNonNull(next, "next");
  }
}
