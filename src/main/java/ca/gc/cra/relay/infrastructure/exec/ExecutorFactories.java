package ca.gc.cra.relay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors RELAY runs its flush trigger on.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded scheduler for the periodic flush trigger.
   *
   * <p>Flushes of consecutive ticks never overlap; a tick that overruns delays the next one.</p>
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the scheduler thread
   * @return scheduler whose pending tasks are dropped on shutdown
   */
  public static ScheduledExecutorService newFlushScheduler(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "relay-flush" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }
}
