/**
 * Metrics adapters implementing {@link ca.gc.cra.geotag.application.port.MetricsPort}.
 */
package ca.gc.cra.geotag.infrastructure.metrics;
