package ca.gc.cra.geotag.domain.geo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable, time-ordered, de-duplicated sequence of GPS samples.
 * <p><strong>Why:</strong> Correlation needs a sorted track to bracket photo timestamps by binary search.</p>
 * <p><strong>Role:</strong> Domain aggregate built once at startup and shared read-only by the correlate stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link #build(Collection)}; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> {@link #bracket(Instant)} is O(log n).</p>
 *
 * @since 0.1.0
 */
public final class Track {
  private static final Track EMPTY = new Track(List.of());

  private final List<TimestampedPoint> points;

  private Track(List<TimestampedPoint> points) {
    this.points = points;
  }

  /**
   * Sorts the supplied points by timestamp and drops exact duplicates.
   *
   * <p>Sorting is stable, so samples sharing a timestamp keep their input order.</p>
   *
   * @param points raw samples in any order; {@code null} or empty yields an empty track
   * @return immutable track
   */
  public static Track build(Collection<TimestampedPoint> points) {
    if (points == null || points.isEmpty()) {
      return EMPTY;
    }
    List<TimestampedPoint> sorted = new ArrayList<>(points.size());
    for (TimestampedPoint point : points) {
      sorted.add(Objects.requireNonNull(point, "point"));
    }
    sorted.sort(Comparator.comparing(TimestampedPoint::time));
    // record equality covers (timestamp, latitude, longitude, elevation)
    List<TimestampedPoint> unique = new ArrayList<>(new LinkedHashSet<>(sorted));
    return new Track(List.copyOf(unique));
  }

  /**
   * Returns the empty track.
   *
   * @return shared empty instance
   */
  public static Track empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public int size() {
    return points.size();
  }

  /**
   * Returns the ordered points.
   *
   * @return unmodifiable list
   */
  public List<TimestampedPoint> points() {
    return points;
  }

  /**
   * Returns the earliest point.
   *
   * @return first point
   * @throws EmptyTrackException if the track has no points
   */
  public TimestampedPoint first() {
    requireNonEmpty();
    return points.get(0);
  }

  /**
   * Returns the latest point.
   *
   * @return last point
   * @throws EmptyTrackException if the track has no points
   */
  public TimestampedPoint last() {
    requireNonEmpty();
    return points.get(points.size() - 1);
  }

  /**
   * Fails when the track has no points.
   *
   * @return this track for fluent call sites
   * @throws EmptyTrackException if the track has no points
   */
  public Track requireNonEmpty() {
    if (points.isEmpty()) {
      throw new EmptyTrackException("track contains no points");
    }
    return this;
  }

  /**
   * Finds the points surrounding {@code time}.
   *
   * @param time query instant; never {@code null}
   * @return bracketing pair, clamped to the endpoints when {@code time} is outside the track span
   * @throws EmptyTrackException if the track has no points
   */
  public TrackBracket bracket(Instant time) {
    Objects.requireNonNull(time, "time");
    requireNonEmpty();
    int index = firstAfter(time);
    if (index == 0) {
      TimestampedPoint first = points.get(0);
      return new TrackBracket(first, first, true);
    }
    if (index == points.size()) {
      TimestampedPoint last = points.get(points.size() - 1);
      return new TrackBracket(last, last, true);
    }
    return new TrackBracket(points.get(index - 1), points.get(index), false);
  }

  // index of the first point whose timestamp is strictly after time, or size() if none
  private int firstAfter(Instant time) {
    int low = 0;
    int high = points.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (points.get(mid).time().isAfter(time)) {
        high = mid;
      } else {
        low = mid + 1;
      }
    }
    return low;
  }

  @Override
  public String toString() {
    if (points.isEmpty()) {
      return "Track[empty]";
    }
    return "Track[" + points.size() + " points, " + first().time() + " .. " + last().time() + "]";
  }
}
