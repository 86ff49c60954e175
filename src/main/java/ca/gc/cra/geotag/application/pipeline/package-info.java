/**
 * <strong>Purpose:</strong> The concurrent stage pipeline and the use case that drives it.
 * <p><strong>Model:</strong> one platform thread per active stage, joined by bounded
 * {@link java.util.concurrent.ArrayBlockingQueue}s. A single end-of-stream marker enters at the head and each
 * stage forwards exactly one downstream before stopping. A failing item is logged and dropped; the stage keeps
 * running.</p>
 * <p><strong>Stages:</strong> augment, correlate, geocode (each optional) and writer, always in that order.</p>
 * <p><strong>Observability:</strong> counters {@code pipeline.<stage>.processed|dropped}, histogram
 * {@code pipeline.<stage>.latencyNanos}; MDC keys {@code pipeline} and {@code stage}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geotag.application.pipeline;
