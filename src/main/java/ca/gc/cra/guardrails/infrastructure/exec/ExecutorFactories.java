package ca.gc.cra.guardrails.infrastructure.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the engine's background threads: spam-store maintenance and bounded cache calls.
 *
 * <p>All threads are daemons so an engine that is never closed does not keep the JVM alive.</p>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded scheduler for periodic maintenance; cancelled tasks are removed from its queue.
   *
   * @param prefix thread-name prefix
   * @return scheduler owned by the caller
   */
  public static ScheduledExecutorService newMaintenanceScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, daemonFactory(prefix, "guardrails-maint"));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds a fixed-size pool for cache calls that run under a timeout.
   *
   * <p>The pool has no queue: when every worker is busy, submission throws
   * {@link java.util.concurrent.RejectedExecutionException} instead of piling up work behind a hung cache.</p>
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread-name prefix
   * @return executor owned by the caller
   */
  public static ExecutorService newCachePool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        daemonFactory(prefix, "guardrails-cache"),
        new ThreadPoolExecutor.AbortPolicy());
  }

  private static ThreadFactory daemonFactory(String prefix, String defaultPrefix) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? defaultPrefix : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler((t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
      return thread;
    };
  }
}
