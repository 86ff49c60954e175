package ca.gc.cra.geotag.domain.correlate;

import ca.gc.cra.geotag.domain.geo.GeoMath;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.geo.TimestampedPoint;
import ca.gc.cra.geotag.domain.geo.Track;
import ca.gc.cra.geotag.domain.geo.TrackBracket;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Maps a photo timestamp onto a GPS track.
 * <p><strong>Why:</strong> Camera and GPS logger are separate devices; the only shared key is time.</p>
 * <p><strong>Role:</strong> Domain service invoked by the correlate stage for every photo.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Dominated by the O(log n) bracket lookup.</p>
 *
 * @since 0.1.0
 */
public final class Correlator {

  private Correlator() {
    // Utility
  }

  /**
   * Correlates {@code time} using the supplied settings.
   *
   * @param time UTC capture instant
   * @param track non-empty track
   * @param settings policy and thresholds
   * @return resolved position or {@link CorrelationResult#noMatch()}
   * @throws ca.gc.cra.geotag.domain.geo.EmptyTrackException if the track is empty
   */
  public static CorrelationResult locate(Instant time, Track track, CorrelationSettings settings) {
    Objects.requireNonNull(settings, "settings");
    return locate(
        time,
        track,
        settings.policy(),
        settings.maxDelta(),
        settings.maxDistanceMeters(),
        settings.satisfy());
  }

  /**
   * Correlates {@code time} against {@code track}.
   *
   * @param time UTC capture instant
   * @param track non-empty track
   * @param policy tie-break policy
   * @param maxDelta largest acceptable time gap
   * @param maxDistanceMeters largest acceptable distance between the bracketing points
   * @param satisfy threshold combination
   * @return resolved position or {@link CorrelationResult#noMatch()}
   * @throws ca.gc.cra.geotag.domain.geo.EmptyTrackException if the track is empty
   */
  public static CorrelationResult locate(
      Instant time,
      Track track,
      CorrelationPolicy policy,
      Duration maxDelta,
      double maxDistanceMeters,
      SatisfyMode satisfy) {
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(track, "track");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(maxDelta, "maxDelta");
    Objects.requireNonNull(satisfy, "satisfy");

    TrackBracket bracket = track.bracket(time);
    TimestampedPoint prev = bracket.prev();
    TimestampedPoint next = bracket.next();
    double distance = bracket.boundary() ? 0d : GeoMath.distance(prev.position(), next.position());

    Position position;
    Duration delta;
    switch (policy) {
      case NEAREST -> {
        Duration toPrev = Duration.between(prev.time(), time).abs();
        Duration toNext = Duration.between(time, next.time()).abs();
        boolean usePrev = toPrev.compareTo(toNext) <= 0;
        position = usePrev ? prev.position() : next.position();
        delta = usePrev ? toPrev : toNext;
      }
      case NEXT -> {
        position = next.position();
        delta = Duration.between(time, next.time()).abs();
      }
      case PREV -> {
        position = prev.position();
        delta = Duration.between(prev.time(), time).abs();
      }
      case AVERAGE -> {
        position = bracket.boundary() ? prev.position() : interpolate(prev, next, time);
        delta = Duration.between(prev.time(), next.time());
      }
      default -> throw new IllegalStateException("Unhandled policy " + policy);
    }

    boolean withinDistance = distance <= maxDistanceMeters;
    boolean withinDelta = delta.compareTo(maxDelta) <= 0;
    // kept in its original two-clause form; for ANY it reduces to a plain OR
    boolean valid = (satisfy != SatisfyMode.ALL && (withinDistance || withinDelta))
        || (withinDistance && withinDelta);
    if (!valid) {
      return CorrelationResult.noMatch();
    }
    return new CorrelationResult.Resolved(position, distance, delta);
  }

  static Position interpolate(TimestampedPoint prev, TimestampedPoint next, Instant time) {
    long span = Duration.between(prev.time(), next.time()).toMillis();
    double weight = span == 0L ? 0d : (double) Duration.between(prev.time(), time).toMillis() / span;
    Position a = prev.position();
    Position b = next.position();
    double latitude = a.latitude() + weight * (b.latitude() - a.latitude());
    double longitude = a.longitude() + weight * (b.longitude() - a.longitude());
    Double elevation = null;
    if (a.hasElevation() && b.hasElevation()) {
      elevation = a.elevation() + weight * (b.elevation() - a.elevation());
    }
    return new Position(latitude, longitude, elevation);
  }
}
