package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.MetadataStore;
import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.domain.item.GpsTags;
import ca.gc.cra.geotag.domain.item.ItemProcessingException;
import ca.gc.cra.geotag.domain.item.PhotoTime;
import ca.gc.cra.geotag.domain.item.ResultField;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one geotagging run: enumerates photos, feeds them into the pipeline, and waits for
 * the chain to drain.
 * <p><strong>Role:</strong> Application-layer use case invoked by the CLI; the calling thread is the driver.</p>
 * <p><strong>Cancellation:</strong> {@link #requestStop()} (or interrupting the driver thread) stops further
 * submission. The end-of-stream marker is still enqueued and every stage drains the items already queued;
 * nothing is forcibly terminated.</p>
 * <p><strong>Errors:</strong> an item whose stored metadata cannot be loaded is logged and skipped. Stage faults
 * never surface here; they appear in {@link RunSummary#dropped()} and the logs.</p>
 * <p>Instances are single-use.</p>
 *
 * @since 0.1.0
 */
public final class GeotagUseCase {
  private static final Logger log = LoggerFactory.getLogger(GeotagUseCase.class);

  private final MetadataStore store;
  private final Pipeline pipeline;
  private final WriterStage writer;
  private final MetricsPort metrics;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final CountDownLatch completed = new CountDownLatch(1);

  /**
   * Creates the use case.
   *
   * @param store metadata store used to enumerate and load photos
   * @param pipeline assembled, unstarted pipeline
   * @param writer the writer stage inside {@code pipeline}, used for the written count
   * @param metrics metrics sink
   */
  public GeotagUseCase(MetadataStore store, Pipeline pipeline, WriterStage writer, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the pipeline over every photo in the store.
   *
   * @return run counters
   * @throws IOException if the store cannot enumerate photos; the pipeline is not started in that case
   */
  public RunSummary run() throws IOException {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Geotag run already started");
    }
    MDC.put("pipeline", "geotag");
    try {
      SortedSet<String> identities = store.identities();
      log.info("Found {} photos", identities.size());
      pipeline.start();
      long submitted = 0L;
      long skipped = 0L;
      boolean interrupted = false;
      try {
        for (String identity : identities) {
          if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
            interrupted = true;
            break;
          }
          WorkItem item = newItem(identity);
          if (item == null) {
            skipped++;
            continue;
          }
          try {
            pipeline.submit(item);
            submitted++;
            metrics.increment("driver.submitted");
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            interrupted = true;
            break;
          }
        }
      } finally {
        if (interrupted) {
          log.warn("Interrupted after submitting {} of {} photos; draining queued items", submitted, identities.size());
        }
        pipeline.finish();
        pipeline.awaitTermination();
      }
      RunSummary summary = new RunSummary(
          pipeline.stageNames(),
          identities.size(),
          submitted,
          writer.writtenCount(),
          pipeline.droppedCount() + skipped,
          interrupted);
      log.info(
          "Run complete: {} submitted, {} written, {} dropped{}",
          summary.submitted(),
          summary.written(),
          summary.dropped(),
          interrupted ? " (interrupted)" : "");
      return summary;
    } finally {
      MDC.remove("pipeline");
      completed.countDown();
    }
  }

  /**
   * Asks the driver to stop submitting; queued items still drain.
   */
  public void requestStop() {
    if (stopRequested.compareAndSet(false, true)) {
      log.info("Stop requested; finishing queued photos");
    }
  }

  /**
   * Blocks until {@link #run()} has returned or thrown. Returns immediately if the run never started.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitCompletion() throws InterruptedException {
    if (runThread.get() == null) {
      return;
    }
    completed.await();
  }

  private WorkItem newItem(String identity) {
    Map<String, TagValue> metadata;
    try {
      metadata = store.load(identity);
    } catch (IOException ex) {
      log.error("Skipping {}: failed to load metadata", identity, ex);
      metrics.increment("driver.skipped");
      return null;
    }
    WorkItem item = new WorkItem(identity, metadata);
    try {
      GpsTags.read(item).ifPresent(item::position);
    } catch (ItemProcessingException ex) {
      log.error("Skipping {}: {}", identity, ex.getMessage());
      metrics.increment("driver.skipped");
      return null;
    }
    PhotoTime.findLocalCaptureTime(item)
        .ifPresent(t -> item.result(ResultField.DATE, t.format(PhotoTime.EXIF_FORMAT)));
    return item;
  }
}
