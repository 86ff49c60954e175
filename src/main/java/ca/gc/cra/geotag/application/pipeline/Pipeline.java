package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.domain.item.WorkItem;
import ca.gc.cra.geotag.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Linear chain of {@link PipelineStage}s joined by bounded queues.
 * <p><strong>Role:</strong> Application-layer scheduler; the driver submits items to the first stage and waits for
 * the chain to drain.</p>
 * <p><strong>Concurrency:</strong> One non-daemon thread per stage, named {@code geotag-<stage>}. {@link #submit}
 * blocks while the first queue is full. Each queue is FIFO, and every stage consumes and forwards in order, so
 * per-stage ordering holds end to end.</p>
 * <p><strong>Shutdown:</strong> {@link #finish()} enqueues exactly one end-of-stream marker; every stage forwards one
 * marker downstream and stops. {@link #awaitTermination()} waits for that without forcing termination.</p>
 * <p>Instances are single-use.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);
  /** Default capacity of each inter-stage queue. */
  public static final int DEFAULT_QUEUE_CAPACITY = 16;

  private final List<PipelineStage> stages;
  private final BlockingQueue<QueueEntry> head;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean finished = new AtomicBoolean();
  private final AtomicBoolean terminated = new AtomicBoolean();
  private volatile ExecutorService executor;

  private Pipeline(List<PipelineStage> stages, BlockingQueue<QueueEntry> head) {
    this.stages = List.copyOf(stages);
    this.head = head;
  }

  /**
   * Wires handlers into a chain in the given order. The last handler is terminal and forwards nothing.
   *
   * @param handlers stage handlers in downstream order; at least one
   * @param queueCapacity capacity of every inter-stage queue, including the submission queue
   * @param metrics metrics sink shared by all stages
   * @return unstarted pipeline
   */
  public static Pipeline of(List<? extends StageHandler> handlers, int queueCapacity, MetricsPort metrics) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    return of(handlers, metrics, () -> new ArrayBlockingQueue<>(queueCapacity));
  }

  static Pipeline of(
      List<? extends StageHandler> handlers, MetricsPort metrics, Supplier<BlockingQueue<QueueEntry>> queueFactory) {
    Objects.requireNonNull(handlers, "handlers");
    Objects.requireNonNull(metrics, "metrics");
    if (handlers.isEmpty()) {
      throw new IllegalArgumentException("pipeline requires at least one stage");
    }
    List<BlockingQueue<QueueEntry>> queues = new ArrayList<>(handlers.size());
    for (int i = 0; i < handlers.size(); i++) {
      queues.add(queueFactory.get());
    }
    List<PipelineStage> stages = new ArrayList<>(handlers.size());
    for (int i = 0; i < handlers.size(); i++) {
      BlockingQueue<QueueEntry> output = i + 1 < handlers.size() ? queues.get(i + 1) : null;
      stages.add(new PipelineStage(handlers.get(i), queues.get(i), output, metrics));
    }
    return new Pipeline(stages, queues.get(0));
  }

  /**
   * Starts one thread per stage.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Pipeline already started");
    }
    UncaughtExceptionHandler crashHandler =
        (thread, ex) -> log.error("Stage thread {} terminated unexpectedly", thread.getName(), ex);
    executor = ExecutorFactories.newStagePool(stageNames(), "geotag", crashHandler);
    for (PipelineStage stage : stages) {
      executor.execute(stage);
    }
    log.info("Pipeline started with stages {}", stageNames());
  }

  /**
   * Hands an item to the first stage, blocking while its queue is full.
   *
   * @param item item to process; ownership transfers to the pipeline
   * @throws InterruptedException if interrupted while waiting for queue space
   * @throws IllegalStateException if the pipeline is not running or already finished
   */
  public void submit(WorkItem item) throws InterruptedException {
    Objects.requireNonNull(item, "item");
    if (!started.get()) {
      throw new IllegalStateException("Pipeline not started");
    }
    if (finished.get()) {
      throw new IllegalStateException("Pipeline already finished");
    }
    head.put(QueueEntry.of(item));
  }

  /**
   * Enqueues the end-of-stream marker. Later calls are no-ops. Waits for queue space even if interrupted.
   */
  public void finish() {
    if (!started.get()) {
      throw new IllegalStateException("Pipeline not started");
    }
    if (!finished.compareAndSet(false, true)) {
      return;
    }
    boolean interrupted = false;
    while (true) {
      try {
        head.put(QueueEntry.endOfStream());
        break;
      } catch (InterruptedException ex) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    log.debug("End of stream submitted");
  }

  /**
   * Waits until every stage has drained and stopped, then closes the stage handlers.
   *
   * <p>An interrupt does not abort the wait; it is re-asserted once all stages have stopped.</p>
   *
   * @throws IllegalStateException if {@link #finish()} has not been called
   */
  public void awaitTermination() {
    if (!finished.get()) {
      throw new IllegalStateException("finish() must be called before awaitTermination()");
    }
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    boolean interrupted = false;
    executor.shutdown();
    while (true) {
      try {
        if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
          break;
        }
        log.debug("Waiting for pipeline stages to drain");
      } catch (InterruptedException ex) {
        interrupted = true;
        log.info("Interrupt received while draining; waiting for queued items to finish");
      }
    }
    for (PipelineStage stage : stages) {
      try {
        stage.handler().close();
      } catch (Exception ex) {
        log.error("Failed to close stage {}", stage.name(), ex);
      }
    }
    log.info("Pipeline terminated");
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  public List<PipelineStage> stages() {
    return stages;
  }

  /**
   * Returns stage names in chain order.
   *
   * @return names such as {@code [correlate, geocode, writer]}
   */
  public List<String> stageNames() {
    List<String> names = new ArrayList<>(stages.size());
    for (PipelineStage stage : stages) {
      names.add(stage.name());
    }
    return names;
  }

  /**
   * Sums the items dropped by every stage.
   *
   * @return dropped item count
   */
  public long droppedCount() {
    long total = 0L;
    for (PipelineStage stage : stages) {
      total += stage.droppedCount();
    }
    return total;
  }
}
