package ca.gc.cra.geotag.domain.correlate;

import ca.gc.cra.geotag.domain.geo.Position;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of correlating one timestamp against a track.
 *
 * @since 0.1.0
 */
public sealed interface CorrelationResult permits CorrelationResult.Resolved, CorrelationResult.NoMatch {

  /**
   * Returns the shared no-match result.
   *
   * @return no-match singleton
   */
  static CorrelationResult noMatch() {
    return NoMatch.INSTANCE;
  }

  /**
   * Thresholds were satisfied.
   *
   * @param position chosen or interpolated position
   * @param distanceMeters distance between the bracketing track points (0 on a boundary)
   * @param delta time gap used for validation
   */
  record Resolved(Position position, double distanceMeters, Duration delta) implements CorrelationResult {
    public Resolved {
      Objects.requireNonNull(position, "position");
      Objects.requireNonNull(delta, "delta");
    }
  }

  /** Thresholds were not satisfied; not an error. */
  enum NoMatch implements CorrelationResult {
    INSTANCE
  }
}
