package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.MetadataStore;
import ca.gc.cra.geotag.application.port.ResultSink;
import ca.gc.cra.geotag.domain.item.ItemProcessingException;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal stage: commits modified metadata and records one result row per item. Never forwards.
 *
 * @since 0.1.0
 */
public final class WriterStage implements StageHandler {
  private static final Logger log = LoggerFactory.getLogger(WriterStage.class);

  private final MetadataStore store;
  private final ResultSink results;
  private final boolean dryRun;
  private final AtomicLong written = new AtomicLong();

  /**
   * Creates the writer.
   *
   * @param store metadata store receiving commits
   * @param results result sink; use {@link ResultSink#NONE} to skip result rows
   * @param dryRun when {@code true}, dirty items are logged instead of committed
   */
  public WriterStage(MetadataStore store, ResultSink results, boolean dryRun) {
    this.store = Objects.requireNonNull(store, "store");
    this.results = Objects.requireNonNull(results, "results");
    this.dryRun = dryRun;
  }

  @Override
  public String name() {
    return "writer";
  }

  @Override
  public Optional<WorkItem> process(WorkItem item) throws Exception {
    if (item.isDirty()) {
      if (dryRun) {
        log.info("Dry run: would update {}", item.identity());
      } else if (store.commit(item)) {
        item.markClean();
        log.debug("Committed {}", item.identity());
      } else {
        throw new ItemProcessingException(item.identity(), "metadata store rejected commit");
      }
    }
    results.record(item.result());
    written.incrementAndGet();
    return Optional.empty();
  }

  @Override
  public void close() throws Exception {
    results.close();
  }

  /**
   * Returns the number of items that completed the writer stage.
   *
   * @return written item count
   */
  public long writtenCount() {
    return written.get();
  }
}
