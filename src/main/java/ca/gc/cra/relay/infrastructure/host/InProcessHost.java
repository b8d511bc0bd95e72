package ca.gc.cra.relay.infrastructure.host;

import ca.gc.cra.relay.application.port.HostRuntime;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Minimal {@link HostRuntime} that runs RELAY inside a standalone JVM.
 * <p><strong>Why:</strong> Publishers are written against the host contract of a metrics agent; this class plays
 * that agent for the CLI by dispatching records read from stdin and driving the periodic flush.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect write, flush, init and shutdown registrations until {@link #start()}.</li>
 *   <li>Run init hooks, then flush every registered callback at a fixed delay.</li>
 *   <li>Hand every dispatched record to every write callback.</li>
 *   <li>On {@link #stop()}, cancel the trigger and run shutdown hooks in reverse registration order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Registration and lifecycle calls are synchronized; {@link #dispatch} may be
 * called from any thread once started.</p>
 *
 * @since 0.1.0
 */
public final class InProcessHost implements HostRuntime {
  private static final Logger log = LoggerFactory.getLogger(InProcessHost.class);

  private final Duration flushInterval;
  private final long flushTimeoutMillis;
  private final Supplier<ScheduledExecutorService> schedulerFactory;

  private final Map<String, WriteCallback> writers = new LinkedHashMap<>();
  private final Map<String, FlushCallback> flushers = new LinkedHashMap<>();
  private final Map<String, Runnable> initHooks = new LinkedHashMap<>();
  private final Map<String, Runnable> shutdownHooks = new LinkedHashMap<>();

  private volatile List<Map.Entry<String, WriteCallback>> activeWriters = List.of();
  private volatile boolean running;
  private ScheduledExecutorService scheduler;
  private boolean started;
  private boolean stopped;

  /**
   * Creates a host whose flush trigger runs on a daemon scheduler thread.
   *
   * @param flushInterval delay between the end of one flush round and the start of the next
   * @param flushTimeout staleness threshold handed to every flush callback; zero flushes unconditionally
   */
  public InProcessHost(Duration flushInterval, Duration flushTimeout) {
    this(flushInterval, flushTimeout,
        () -> ExecutorFactories.newFlushScheduler("relay-flush",
            (thread, ex) -> log.error("Flush trigger thread {} died", thread.getName(), ex)));
  }

  InProcessHost(Duration flushInterval, Duration flushTimeout, Supplier<ScheduledExecutorService> schedulerFactory) {
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    Objects.requireNonNull(flushTimeout, "flushTimeout");
    if (flushTimeout.isNegative()) {
      throw new IllegalArgumentException("flushTimeout must not be negative");
    }
    this.flushTimeoutMillis = flushTimeout.toMillis();
    this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory");
  }

  @Override
  public synchronized void registerWrite(String name, WriteCallback callback) {
    register(writers, name, callback, "write");
  }

  @Override
  public synchronized void registerFlush(String name, FlushCallback callback) {
    register(flushers, name, callback, "flush");
  }

  @Override
  public synchronized void registerInit(String name, Runnable hook) {
    register(initHooks, name, hook, "init");
  }

  @Override
  public synchronized void registerShutdown(String name, Runnable hook) {
    register(shutdownHooks, name, hook, "shutdown");
  }

  /**
   * Runs init hooks and schedules the flush trigger.
   *
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (started) {
      throw new IllegalStateException("host already started");
    }
    started = true;
    initHooks.forEach((name, hook) -> {
      log.debug("Running init hook {}", name);
      hook.run();
    });
    activeWriters = List.copyOf(writers.entrySet());
    scheduler = schedulerFactory.get();
    long delay = flushInterval.toMillis();
    scheduler.scheduleWithFixedDelay(this::flushAllQuietly, delay, delay, TimeUnit.MILLISECONDS);
    running = true;
    log.info("Host started: {} writer(s), {} flusher(s), flush every {} ms (timeout {} ms)",
        writers.size(), flushers.size(), delay, flushTimeoutMillis);
  }

  /**
   * Hands one record to every write callback.
   *
   * @param record record to dispatch
   * @return number of callbacks that reported a failure status
   * @throws IllegalStateException if the host is not running
   */
  public int dispatch(MetricRecord record) {
    Objects.requireNonNull(record, "record");
    if (!running) {
      throw new IllegalStateException("host is not running");
    }
    List<Map.Entry<String, WriteCallback>> targets = activeWriters;
    int failures = 0;
    for (Map.Entry<String, WriteCallback> entry : targets) {
      int status = entry.getValue().write(record);
      if (status != 0) {
        failures++;
        log.debug("Write callback {} returned status {} for {}", entry.getKey(), status, record.identifier());
      }
    }
    return failures;
  }

  /**
   * Calls every flush callback once with {@code timeoutMillis}.
   *
   * @param timeoutMillis staleness threshold; zero flushes unconditionally
   * @return number of callbacks that reported a failure status
   */
  public int flushAll(long timeoutMillis) {
    List<Map.Entry<String, FlushCallback>> targets;
    synchronized (this) {
      targets = new ArrayList<>(flushers.entrySet());
    }
    int failures = 0;
    for (Map.Entry<String, FlushCallback> entry : targets) {
      int status = entry.getValue().flush(timeoutMillis);
      if (status != 0) {
        failures++;
        log.debug("Flush callback {} returned status {}", entry.getKey(), status);
      }
    }
    return failures;
  }

  /**
   * Cancels the flush trigger and runs shutdown hooks, newest first. Idempotent; a host that never started
   * still runs its shutdown hooks.
   */
  public synchronized void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    running = false;
    activeWriters = List.of();
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Flush trigger did not stop within 5 seconds");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    List<Map.Entry<String, Runnable>> hooks = new ArrayList<>(shutdownHooks.entrySet());
    Collections.reverse(hooks);
    for (Map.Entry<String, Runnable> hook : hooks) {
      try {
        hook.getValue().run();
      } catch (RuntimeException ex) {
        log.error("Shutdown hook {} failed", hook.getKey(), ex);
      }
    }
    log.info("Host stopped");
  }

  /**
   * Indicates whether {@link #start()} ran and {@link #stop()} did not.
   *
   * @return running flag
   */
  public boolean isRunning() {
    return running;
  }

  /**
   * Returns the registered write callback names in registration order.
   *
   * @return immutable snapshot
   */
  public synchronized List<String> writerNames() {
    return List.copyOf(writers.keySet());
  }

  private void flushAllQuietly() {
    try {
      flushAll(flushTimeoutMillis);
    } catch (RuntimeException ex) {
      log.error("Periodic flush failed", ex);
    }
  }

  private <T> void register(Map<String, T> target, String name, T callback, String kind) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(callback, "callback");
    if (started) {
      throw new IllegalStateException("cannot register " + kind + " callback " + name + " after start");
    }
    if (target.putIfAbsent(name, callback) != null) {
      throw new IllegalArgumentException(kind + " callback " + name + " is already registered");
    }
  }
}
