package ca.gc.cra.geotag.application.pipeline;

/**
 * Lifecycle of a {@link PipelineStage}.
 *
 * @since 0.1.0
 */
public enum StageState {
  /** Created but not yet started. */
  NEW,
  /** Consuming items from the input queue. */
  RUNNING,
  /** End-of-stream received; forwarding the marker downstream. */
  DRAINING,
  /** Terminal; the stage thread has exited its loop. */
  STOPPED
}
