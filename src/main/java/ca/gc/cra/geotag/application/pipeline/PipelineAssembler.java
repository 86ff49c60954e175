package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles the enabled stages in their fixed relative order: augment, correlate, geocode, writer.
 *
 * <p>Disabled stages are skipped; each enabled stage feeds the next enabled one, and the earliest enabled stage's
 * queue becomes the single submission point. The writer is always present and always last.</p>
 *
 * @since 0.1.0
 */
public final class PipelineAssembler {

  private PipelineAssembler() {}

  /**
   * Builds an unstarted pipeline.
   *
   * @param augment optional augment stage
   * @param correlate optional correlate stage
   * @param geocode optional geocode stage
   * @param writer terminal writer stage
   * @param queueCapacity inter-stage queue capacity
   * @param metrics metrics sink
   * @return pipeline ready to {@link Pipeline#start()}
   */
  public static Pipeline assemble(
      Optional<AugmentStage> augment,
      Optional<CorrelateStage> correlate,
      Optional<GeocodeStage> geocode,
      WriterStage writer,
      int queueCapacity,
      MetricsPort metrics) {
    List<StageHandler> handlers = new ArrayList<>(4);
    augment.ifPresent(handlers::add);
    correlate.ifPresent(handlers::add);
    geocode.ifPresent(handlers::add);
    handlers.add(Objects.requireNonNull(writer, "writer"));
    return Pipeline.of(handlers, queueCapacity, metrics);
  }
}
