package ca.gc.cra.geotag.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Factory helpers for the executors that host pipeline stage threads.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds an executor with exactly one thread per pipeline stage.
   *
   * <p>The executor has no task queue: a runnable beyond the last stage is rejected. Threads are created in
   * submission order and named {@code <prefix>-<stage>}, so stages must be submitted in the order of
   * {@code stageNames}.</p>
   *
   * @param stageNames stage names in submission order
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newStagePool(
      List<String> stageNames, String prefix, UncaughtExceptionHandler handler) {
    if (stageNames == null || stageNames.isEmpty()) {
      throw new IllegalArgumentException("at least one stage is required");
    }
    Objects.requireNonNull(handler, "handler");
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "geotag" : prefix;
    Iterator<String> names = List.copyOf(stageNames).iterator();
    ThreadFactory factory = runnable -> {
      String stage;
      synchronized (names) {
        stage = names.hasNext() ? names.next() : "extra";
      }
      Thread thread = new Thread(runnable, threadPrefix + "-" + stage);
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    };

    int size = stageNames.size();
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new SynchronousQueue<>(), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
