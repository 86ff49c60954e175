package ca.gc.cra.geotag.infrastructure.metrics;

import ca.gc.cra.geotag.application.port.MetricsPort;

/**
 * Metrics adapter selected when {@code metricsExporter=none}; drops every counter and observation.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
