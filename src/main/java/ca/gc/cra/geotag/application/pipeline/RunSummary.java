package ca.gc.cra.geotag.application.pipeline;

import java.util.List;

/**
 * Outcome counters for one pipeline run.
 *
 * @param stages active stage names in chain order
 * @param discovered photo identities found in the store
 * @param submitted items handed to the pipeline
 * @param written items that completed the writer stage
 * @param dropped items dropped by any stage or skipped by the driver because their metadata could not be loaded
 * @param interrupted whether submission stopped early on a user interrupt
 * @since 0.1.0
 */
public record RunSummary(
    List<String> stages,
    long discovered,
    long submitted,
    long written,
    long dropped,
    boolean interrupted) {

  public RunSummary {
    stages = List.copyOf(stages);
  }
}
