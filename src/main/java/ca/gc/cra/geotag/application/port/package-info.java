/**
 * <strong>Purpose:</strong> Ports between the GEOTAG pipeline and the outside world: track input, metadata store,
 * place lookup, tabular input and output, metrics, and time.
 * <p>Adapters live under {@code ca.gc.cra.geotag.infrastructure}; tests use hand-written fakes.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geotag.application.port;
