package ca.gc.cra.geotag.domain.correlate;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and policy applied by {@link Correlator#locate}.
 *
 * @param policy tie-break policy
 * @param maxDelta largest acceptable time gap
 * @param maxDistanceMeters largest acceptable distance between the bracketing points
 * @param satisfy how the two thresholds combine
 * @since 0.1.0
 */
public record CorrelationSettings(
    CorrelationPolicy policy,
    Duration maxDelta,
    double maxDistanceMeters,
    SatisfyMode satisfy) {

  public CorrelationSettings {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(maxDelta, "maxDelta");
    Objects.requireNonNull(satisfy, "satisfy");
    if (maxDelta.isNegative()) {
      throw new IllegalArgumentException("maxDelta must not be negative");
    }
    if (!(maxDistanceMeters >= 0d)) {
      throw new IllegalArgumentException("maxDistanceMeters must not be negative");
    }
  }

  /**
   * Returns the defaults: average policy, 10 minutes, 1 km, satisfy any.
   *
   * @return default settings
   */
  public static CorrelationSettings defaults() {
    return new CorrelationSettings(
        CorrelationPolicy.AVERAGE, Duration.ofMinutes(10), 1_000d, SatisfyMode.ANY);
  }
}
