package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-item transformation run by a {@link PipelineStage}.
 * <p><strong>Contract:</strong> Return the item (usually the same instance) to forward it, or
 * {@link Optional#empty()} to consume it. Throwing drops the item; the stage keeps running.</p>
 * <p><strong>Thread-safety:</strong> Invoked from exactly one stage thread; handlers may keep unsynchronized state.</p>
 *
 * @since 0.1.0
 */
public interface StageHandler {

  /**
   * Short stable name used for thread names, logs, and metric keys.
   *
   * @return stage name such as {@code correlate}
   */
  String name();

  /**
   * Processes one item.
   *
   * @param item item now owned by this stage
   * @return item to forward downstream, or empty to stop here
   * @throws Exception any per-item fault; the item is dropped
   */
  Optional<WorkItem> process(WorkItem item) throws Exception;

  /**
   * Releases resources once the stage has stopped. Invoked on the thread awaiting pipeline termination.
   *
   * @throws Exception if cleanup fails
   */
  default void close() throws Exception {}
}
