package ca.gc.cra.mimetic.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named worker threads and bounded pools used across the pipeline.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing named threads with a shared uncaught-exception handler.
   *
   * @param prefix thread-name prefix; blank falls back to {@code mimetic-worker}
   * @param daemon whether threads should not keep the JVM alive
   * @param handler uncaught exception handler installed on each thread; {@code null} ignores failures
   * @return thread factory
   */
  public static ThreadFactory namedThreadFactory(
      String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "mimetic-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Creates, but does not start, a single named worker thread.
   *
   * @param name full thread name
   * @param task worker body
   * @param handler uncaught exception handler
   * @return unstarted thread
   */
  public static Thread newWorkerThread(String name, Runnable task, UncaughtExceptionHandler handler) {
    Objects.requireNonNull(task, "task");
    Thread thread = new Thread(task, Objects.requireNonNull(name, "name"));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, (t, ex) -> {}));
    return thread;
  }

  /**
   * Builds a fixed-size pool with a bounded hand-off queue that rejects work when saturated.
   *
   * <p>Callers submit with {@code execute} and treat {@link java.util.concurrent.RejectedExecutionException}
   * as a drop.</p>
   *
   * @param size number of worker threads
   * @param queueCapacity pending tasks held before rejecting
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newBoundedPool(
      int size, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        namedThreadFactory(prefix, true, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
