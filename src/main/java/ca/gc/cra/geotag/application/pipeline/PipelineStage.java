package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Bounded-queue worker that runs one {@link StageHandler} over a stream of items.
 * <p><strong>Lifecycle:</strong> {@code RUNNING -> DRAINING -> STOPPED}. An end-of-stream entry moves the stage to
 * draining, where it forwards exactly one marker downstream (when it has an output) and stops.</p>
 * <p><strong>Failure isolation:</strong> A handler failure, including an {@link Error}, is logged with stage and item
 * identity; the item is dropped (not forwarded, retried, or requeued) and the stage keeps running. A
 * {@link VirtualMachineError} ends processing: the stage discards its remaining input, still forwards the
 * end-of-stream marker, then rethrows.</p>
 * <p><strong>Back-pressure:</strong> Forwarding blocks while the downstream queue is full; this is the only flow
 * control in the pipeline.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} executes on a single dedicated thread; counters and
 * {@link #state()} may be read from any thread.</p>
 * <p><strong>Metrics:</strong> {@code pipeline.<stage>.processed}, {@code pipeline.<stage>.forwarded},
 * {@code pipeline.<stage>.dropped}, {@code pipeline.<stage>.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class PipelineStage implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(PipelineStage.class);

  private final StageHandler handler;
  private final BlockingQueue<QueueEntry> input;
  private final BlockingQueue<QueueEntry> output;
  private final MetricsPort metrics;
  private final String metricPrefix;
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong forwarded = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private volatile StageState state = StageState.NEW;
  private boolean interrupted;

  /**
   * Creates a stage.
   *
   * @param handler per-item transformation
   * @param input queue this stage consumes
   * @param output downstream queue, or {@code null} for the terminal stage
   * @param metrics metrics sink
   */
  public PipelineStage(
      StageHandler handler,
      BlockingQueue<QueueEntry> input,
      BlockingQueue<QueueEntry> output,
      MetricsPort metrics) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.input = Objects.requireNonNull(input, "input");
    this.output = output;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricPrefix = "pipeline." + handler.name() + ".";
  }

  @Override
  public void run() {
    if (state != StageState.NEW) {
      throw new IllegalStateException("Stage " + name() + " already started");
    }
    state = StageState.RUNNING;
    MDC.put("stage", name());
    log.debug("Stage {} running", name());
    try {
      while (state == StageState.RUNNING) {
        QueueEntry entry = take();
        if (entry instanceof QueueEntry.Item item) {
          handle(item.item());
        } else {
          state = StageState.DRAINING;
        }
      }
      log.info(
          "Stage {} stopped after {} items ({} forwarded, {} dropped)",
          name(),
          processed.get(),
          forwarded.get(),
          dropped.get());
    } finally {
      try {
        if (state == StageState.RUNNING) {
          log.error("Stage {} failed; discarding remaining input until end of stream", name());
          discardUntilEndOfStream();
        }
        if (output != null) {
          put(QueueEntry.endOfStream());
        }
      } finally {
        state = StageState.STOPPED;
        MDC.remove("stage");
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
    }
  }

  private void handle(WorkItem item) {
    long started = System.nanoTime();
    Optional<WorkItem> result;
    try {
      result = handler.process(item);
    } catch (InterruptedException ex) {
      interrupted = true;
      drop(item, ex);
      return;
    } catch (Exception ex) {
      drop(item, ex);
      return;
    } catch (Error ex) {
      drop(item, ex);
      if (ex instanceof VirtualMachineError) {
        throw ex;
      }
      return;
    } finally {
      processed.incrementAndGet();
      metrics.increment(metricPrefix + "processed");
      metrics.observe(metricPrefix + "latencyNanos", System.nanoTime() - started);
    }
    if (result.isPresent() && output != null) {
      // the item now belongs to the downstream stage
      put(QueueEntry.of(result.get()));
      forwarded.incrementAndGet();
    }
  }

  private void drop(WorkItem item, Throwable failure) {
    dropped.incrementAndGet();
    metrics.increment(metricPrefix + "dropped");
    log.error("Stage {} dropped item {}: {}", name(), item.identity(), failure.getMessage(), failure);
  }

  // Upstream stages block on a full input queue, so a failed stage keeps consuming until the marker arrives.
  private void discardUntilEndOfStream() {
    while (true) {
      QueueEntry entry = take();
      if (!(entry instanceof QueueEntry.Item item)) {
        return;
      }
      dropped.incrementAndGet();
      metrics.increment(metricPrefix + "dropped");
      log.warn("Stage {} discarded item {}", name(), item.item().identity());
    }
  }

  // Stages are never cancelled mid-stream; an interrupt is remembered and re-asserted on exit.
  private QueueEntry take() {
    while (true) {
      try {
        return input.take();
      } catch (InterruptedException ex) {
        interrupted = true;
        log.warn("Stage {} interrupted while waiting for input; continuing until end of stream", name());
      }
    }
  }

  private void put(QueueEntry entry) {
    while (true) {
      try {
        output.put(entry);
        return;
      } catch (InterruptedException ex) {
        interrupted = true;
        log.warn("Stage {} interrupted while forwarding; retrying", name());
      }
    }
  }

  public String name() {
    return handler.name();
  }

  StageHandler handler() {
    return handler;
  }

  public StageState state() {
    return state;
  }

  public long processedCount() {
    return processed.get();
  }

  public long forwardedCount() {
    return forwarded.get();
  }

  public long droppedCount() {
    return dropped.get();
  }
}
