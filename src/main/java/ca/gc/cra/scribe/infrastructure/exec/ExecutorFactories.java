package ca.gc.cra.scribe.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for SCRIBE executors.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Creates a fixed-size worker pool with named threads and an unbounded task queue.
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread name prefix
   * @param handler handler for uncaught worker exceptions; {@code null} ignores them
   * @return executor owned by the caller
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedThreads(prefix == null || prefix.isBlank() ? "scribe-worker" : prefix, handler, false),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates a single daemon thread executor for bounded-wait work such as staging copies.
   *
   * @param name thread name
   * @return executor owned by the caller
   */
  public static ExecutorService newSingleDaemon(String name) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedThreads(name, null, true));
  }

  private static ThreadFactory namedThreads(String prefix, UncaughtExceptionHandler handler, boolean daemon) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
