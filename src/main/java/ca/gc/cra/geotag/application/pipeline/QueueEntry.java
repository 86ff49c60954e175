package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.Objects;

/**
 * Entry travelling through a stage queue: either a work item or the end-of-stream marker.
 *
 * <p>The marker is its own variant, so no item value can be mistaken for it.</p>
 *
 * @since 0.1.0
 */
public sealed interface QueueEntry permits QueueEntry.Item, QueueEntry.EndOfStream {

  static QueueEntry of(WorkItem item) {
    return new Item(item);
  }

  static QueueEntry endOfStream() {
    return EndOfStream.INSTANCE;
  }

  /**
   * Work item hand-off.
   *
   * @param item the item; ownership transfers to the consumer
   */
  record Item(WorkItem item) implements QueueEntry {
    public Item {
      Objects.requireNonNull(item, "item");
    }
  }

  /** No more entries will arrive on this queue. */
  enum EndOfStream implements QueueEntry {
    INSTANCE
  }
}
