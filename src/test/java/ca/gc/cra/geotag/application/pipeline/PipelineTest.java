package ca.gc.cra.geotag.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.domain.item.ResultField;
import ca.gc.cra.geotag.domain.item.WorkItem;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PipelineTest {

  @Test
  void capacityOneChainDeliversEveryItemInOrder() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    Tagging first = new Tagging("first", ResultField.CITY);
    Tagging second = new Tagging("second", ResultField.COUNTRY_NAME);
    Collecting last = new Collecting(seen);
    Pipeline pipeline = Pipeline.of(List.of(first, second, last), 1, MetricsPort.NO_OP);

    assertTimeoutPreemptively(Duration.ofSeconds(20), () -> {
      pipeline.start();
      for (int i = 0; i < 500; i++) {
        pipeline.submit(new WorkItem(String.format("IMG_%04d.jpg", i)));
      }
      pipeline.finish();
      pipeline.awaitTermination();
    });

    assertEquals(500, seen.size());
    assertEquals("IMG_0000.jpg", seen.get(0));
    assertEquals("IMG_0499.jpg", seen.get(499));
    for (PipelineStage stage : pipeline.stages()) {
      assertEquals(StageState.STOPPED, stage.state());
      assertEquals(500, stage.processedCount());
    }
    assertEquals(500, pipeline.stages().get(0).forwardedCount());
    assertEquals(0, pipeline.stages().get(2).forwardedCount());
    assertEquals(1, first.closed.get());
    assertEquals(1, last.closed.get());
  }

  @Test
  void failingItemIsDroppedAndOthersContinue() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    StageHandler picky = new StageHandler() {
      @Override
      public String name() {
        return "picky";
      }

      @Override
      public Optional<WorkItem> process(WorkItem item) {
        if (item.identity().equals("bad.jpg")) {
          throw new IllegalStateException("boom");
        }
        return Optional.of(item);
      }
    };
    Pipeline pipeline = Pipeline.of(List.of(picky, new Collecting(seen)), 2, MetricsPort.NO_OP);

    Logger logger = (Logger) LoggerFactory.getLogger(PipelineStage.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
        pipeline.start();
        pipeline.submit(new WorkItem("a.jpg"));
        pipeline.submit(new WorkItem("bad.jpg"));
        pipeline.submit(new WorkItem("c.jpg"));
        pipeline.finish();
        pipeline.awaitTermination();
      });
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(true);
      appender.stop();
    }

    assertEquals(List.of("a.jpg", "c.jpg"), seen);
    assertEquals(1, pipeline.droppedCount());
    ILoggingEvent event = appender.list.stream()
        .filter(e -> e.getLevel() == Level.ERROR)
        .findFirst()
        .orElseThrow();
    assertEquals("Stage {} dropped item {}: {}", event.getMessage());
    assertEquals("bad.jpg", event.getArgumentArray()[1]);
  }

  @Test
  void slowFirstStageNeitherDeadlocksNorDuplicatesEndOfStream() {
    assertChainDrainsWithSlowStage(0);
  }

  @Test
  void slowMiddleStageNeitherDeadlocksNorDuplicatesEndOfStream() {
    assertChainDrainsWithSlowStage(1);
  }

  @Test
  void slowLastStageNeitherDeadlocksNorDuplicatesEndOfStream() {
    assertChainDrainsWithSlowStage(2);
  }

  @Test
  void assertionErrorDropsItemAndChainContinues() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    StageHandler broken = failingOn("bad.jpg", () -> new AssertionError("broken invariant"));
    Pipeline pipeline = Pipeline.of(List.of(broken, new Collecting(seen)), 1, MetricsPort.NO_OP);

    ListAppender<ILoggingEvent> appender = captureStageLogs();
    try {
      runToCompletion(pipeline, "a.jpg", "bad.jpg", "c.jpg");
    } finally {
      releaseStageLogs(appender);
    }

    assertEquals(List.of("a.jpg", "c.jpg"), seen);
    assertEquals(1, pipeline.droppedCount());
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
        && e.getThrowableProxy() != null
        && e.getThrowableProxy().getClassName().equals(AssertionError.class.getName())));
    for (PipelineStage stage : pipeline.stages()) {
      assertEquals(StageState.STOPPED, stage.state());
    }
  }

  @Test
  void virtualMachineErrorStopsStageButDownstreamStillTerminates() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    StageHandler broken = failingOn("deep.jpg", () -> new StackOverflowError("too deep"));
    Pipeline pipeline = Pipeline.of(List.of(broken, new Collecting(seen)), 1, MetricsPort.NO_OP);

    Logger pipelineLogger = (Logger) LoggerFactory.getLogger(Pipeline.class);
    Level previous = pipelineLogger.getLevel();
    pipelineLogger.setLevel(Level.OFF);
    ListAppender<ILoggingEvent> appender = captureStageLogs();
    try {
      runToCompletion(pipeline, "a.jpg", "deep.jpg", "c.jpg", "d.jpg");
    } finally {
      releaseStageLogs(appender);
      pipelineLogger.setLevel(previous);
    }

    assertEquals(List.of("a.jpg"), seen);
    assertEquals(3, pipeline.stages().get(0).droppedCount());
    for (PipelineStage stage : pipeline.stages()) {
      assertEquals(StageState.STOPPED, stage.state());
    }
  }

  @Test
  void filteredItemsAreNotForwarded() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    StageHandler filter = new StageHandler() {
      @Override
      public String name() {
        return "filter";
      }

      @Override
      public Optional<WorkItem> process(WorkItem item) {
        return item.identity().startsWith("keep") ? Optional.of(item) : Optional.empty();
      }
    };
    Pipeline pipeline = Pipeline.of(List.of(filter, new Collecting(seen)), 4, MetricsPort.NO_OP);

    assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
      pipeline.start();
      pipeline.submit(new WorkItem("keep-1"));
      pipeline.submit(new WorkItem("skip-1"));
      pipeline.submit(new WorkItem("keep-2"));
      pipeline.finish();
      pipeline.awaitTermination();
    });

    assertEquals(List.of("keep-1", "keep-2"), seen);
    assertEquals(0, pipeline.droppedCount());
  }

  @Test
  void emptyRunTerminates() {
    Pipeline pipeline = Pipeline.of(List.of(new Collecting(new ArrayList<>())), 1, MetricsPort.NO_OP);

    assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
      pipeline.start();
      pipeline.finish();
      pipeline.finish();
      pipeline.awaitTermination();
    });

    assertEquals(StageState.STOPPED, pipeline.stages().get(0).state());
  }

  @Test
  void lifecycleMisuseIsRejected() throws Exception {
    Pipeline pipeline = Pipeline.of(List.of(new Collecting(new ArrayList<>())), 1, MetricsPort.NO_OP);

    assertThrows(IllegalStateException.class, () -> pipeline.submit(new WorkItem("a")));
    assertThrows(IllegalStateException.class, pipeline::finish);
    pipeline.start();
    assertThrows(IllegalStateException.class, pipeline::start);
    assertThrows(IllegalStateException.class, pipeline::awaitTermination);
    pipeline.finish();
    assertThrows(IllegalStateException.class, () -> pipeline.submit(new WorkItem("b")));
    pipeline.awaitTermination();
  }

  @Test
  void rejectsInvalidShapes() {
    assertThrows(IllegalArgumentException.class, () -> Pipeline.of(List.of(), 1, MetricsPort.NO_OP));
    assertThrows(
        IllegalArgumentException.class,
        () -> Pipeline.of(List.of(new Collecting(new ArrayList<>())), 0, MetricsPort.NO_OP));
  }

  @Test
  void stageNamesFollowChainOrder() {
    Pipeline pipeline = Pipeline.of(
        List.of(new Tagging("augment", ResultField.CITY), new Collecting(new ArrayList<>())), 1, MetricsPort.NO_OP);

    assertEquals(List.of("augment", "collect"), pipeline.stageNames());
  }

  private static void assertChainDrainsWithSlowStage(int slowIndex) {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    List<StageHandler> handlers = new ArrayList<>();
    for (int i = 0; i < 2; i++) {
      handlers.add(new Pausing("stage" + i, i == slowIndex ? 2L : 0L));
    }
    handlers.add(new Pausing("last", slowIndex == 2 ? 2L : 0L) {
      @Override
      public Optional<WorkItem> process(WorkItem item) throws InterruptedException {
        super.process(item);
        seen.add(item.identity());
        return Optional.empty();
      }
    });
    List<CountingQueue> queues = new ArrayList<>();
    Pipeline pipeline = Pipeline.of(handlers, MetricsPort.NO_OP, () -> {
      CountingQueue queue = new CountingQueue();
      queues.add(queue);
      return queue;
    });

    String[] ids = new String[60];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = String.format("IMG_%02d.jpg", i);
    }
    runToCompletion(pipeline, ids);

    assertEquals(List.of(ids), seen);
    assertEquals(3, queues.size());
    for (CountingQueue queue : queues) {
      assertEquals(1, queue.endMarkers.get());
      assertEquals(ids.length, queue.items.get());
    }
    for (PipelineStage stage : pipeline.stages()) {
      assertEquals(StageState.STOPPED, stage.state());
    }
  }

  private static void runToCompletion(Pipeline pipeline, String... ids) {
    assertTimeoutPreemptively(Duration.ofSeconds(20), () -> {
      pipeline.start();
      for (String id : ids) {
        pipeline.submit(new WorkItem(id));
      }
      pipeline.finish();
      pipeline.awaitTermination();
    });
  }

  private static StageHandler failingOn(String identity, Supplier<Error> error) {
    return new StageHandler() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public Optional<WorkItem> process(WorkItem item) {
        if (item.identity().equals(identity)) {
          throw error.get();
        }
        return Optional.of(item);
      }
    };
  }

  private static ListAppender<ILoggingEvent> captureStageLogs() {
    Logger logger = (Logger) LoggerFactory.getLogger(PipelineStage.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    return appender;
  }

  private static void releaseStageLogs(ListAppender<ILoggingEvent> appender) {
    Logger logger = (Logger) LoggerFactory.getLogger(PipelineStage.class);
    logger.detachAppender(appender);
    logger.setAdditive(true);
    appender.stop();
  }

  /** Bounded queue of capacity one that counts what passes through it. */
  private static final class CountingQueue extends ArrayBlockingQueue<QueueEntry> {
    final AtomicInteger endMarkers = new AtomicInteger();
    final AtomicInteger items = new AtomicInteger();

    CountingQueue() {
      super(1);
    }

    @Override
    public void put(QueueEntry entry) throws InterruptedException {
      if (entry instanceof QueueEntry.Item) {
        items.incrementAndGet();
      } else {
        endMarkers.incrementAndGet();
      }
      super.put(entry);
    }
  }

  private static class Pausing implements StageHandler {
    private final String name;
    private final long pauseMillis;

    Pausing(String name, long pauseMillis) {
      this.name = name;
      this.pauseMillis = pauseMillis;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Optional<WorkItem> process(WorkItem item) throws InterruptedException {
      if (pauseMillis > 0) {
        Thread.sleep(pauseMillis);
      }
      return Optional.of(item);
    }
  }

  private static final class Tagging implements StageHandler {
    private final String name;
    private final ResultField field;
    final AtomicInteger closed = new AtomicInteger();

    Tagging(String name, ResultField field) {
      this.name = name;
      this.field = field;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Optional<WorkItem> process(WorkItem item) {
      item.result(field, name);
      return Optional.of(item);
    }

    @Override
    public void close() {
      closed.incrementAndGet();
    }
  }

  private static final class Collecting implements StageHandler {
    private final List<String> seen;
    final AtomicInteger closed = new AtomicInteger();

    Collecting(List<String> seen) {
      this.seen = seen;
    }

    @Override
    public String name() {
      return "collect";
    }

    @Override
    public Optional<WorkItem> process(WorkItem item) {
      seen.add(item.identity());
      return Optional.empty();
    }

    @Override
    public void close() {
      closed.incrementAndGet();
    }
  }
}
