/**
 * <strong>Purpose:</strong> Logging utilities for GEOTAG: verbosity control and log-line hygiene.
 * <p><strong>Concurrency:</strong> Stateless helpers; safe from any stage thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geotag.logging;
