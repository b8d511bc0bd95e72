package ca.gc.cra.relay.application.publish;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.error.FramingException;
import ca.gc.cra.relay.domain.error.OverflowException;
import ca.gc.cra.relay.domain.error.RelayException;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import ca.gc.cra.relay.logging.Logs;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-endpoint orchestrator batching records and publishing them to the broker.
 * <p><strong>Why:</strong> Producers call {@link #write(MetricRecord)} from arbitrary threads; a periodic trigger
 * calls {@link #flush(long)} to bound staleness. Both paths share one buffer and one session.</p>
 * <p><strong>Role:</strong> Application service composed by {@code EndpointRegistry}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Initialize lazily: connect and open the first batch on first use.</li>
 *   <li>Flush once and retry once when a record overflows the buffer.</li>
 *   <li>Publish due batches and reset the buffer whatever the publish outcome.</li>
 *   <li>Perform one best-effort final flush at shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; one {@link ReentrantLock} covers buffer mutation, connection
 * establishment and publish. Blocking network I/O inside the lock is accepted backpressure.</p>
 * <p><strong>Observability:</strong> Emits {@code relay.<node>.publish.success}, {@code publish.failure},
 * {@code write.overflow}, {@code batch.bytes} and {@code framing.failure}.</p>
 *
 * @since 0.1.0
 */
public final class Publisher {
  private static final Logger log = LoggerFactory.getLogger(Publisher.class);
  private static final int PREVIEW_BYTES = 256;

  private final String name;
  private final ReentrantLock lock = new ReentrantLock();
  private final FrameBuffer buffer;
  private final ConnectionManager connection;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ComplaintThrottle oversized;
  private final String metricPrefix;

  private boolean initialized;
  private boolean closed;

  /**
   * Creates a publisher around an allocated buffer and a not-yet-connected connection manager.
   *
   * @param name endpoint name
   * @param buffer send buffer owned by this publisher
   * @param connection broker session manager owned by this publisher
   * @param clock time source for staleness checks
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public Publisher(
      String name, FrameBuffer buffer, ConnectionManager connection, ClockPort clock, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.oversized = new ComplaintThrottle(log, clock);
    this.metricPrefix = "relay." + name + '.';
  }

  /**
   * Encodes one record into the current batch, publishing the batch first when it is full.
   *
   * @param record record to buffer
   * @throws ca.gc.cra.relay.domain.error.ConnectionException if initialization or the overflow flush cannot
   *     reach the broker
   * @throws ca.gc.cra.relay.domain.error.PublishException if the overflow flush fails to publish
   * @throws FramingException if the record or the batch cannot be framed
   * @throws OverflowException if the record does not fit even into an empty buffer
   */
  public void write(MetricRecord record) throws RelayException {
    Objects.requireNonNull(record, "record");
    lock.lock();
    try {
      ensureInitialized();
      if (buffer.append(record)) {
        traceFill();
        return;
      }
      metrics.increment(metricPrefix + "write.overflow");
      try {
        flushLocked(0);
      } catch (RelayException ex) {
        buffer.reset();
        throw ex;
      }
      if (!buffer.append(record)) {
        oversized.report(
            "write_mqtt plugin: <{}> record {} does not fit into a {}-byte send buffer",
            name, record.identifier(), buffer.capacity());
        throw new OverflowException(
            "record " + record.identifier() + " exceeds the " + buffer.capacity() + "-byte send buffer");
      }
      oversized.clear("write_mqtt plugin: <{}> records fit into the send buffer again", name);
      traceFill();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Publishes the current batch if it is older than {@code timeoutMillis}.
   *
   * @param timeoutMillis staleness threshold; {@code 0} flushes unconditionally
   * @throws ca.gc.cra.relay.domain.error.ConnectionException if the broker cannot be reached
   * @throws ca.gc.cra.relay.domain.error.PublishException if the publish fails; the batch is dropped
   * @throws FramingException if the batch cannot be closed; the batch is dropped
   */
  public void flush(long timeoutMillis) throws RelayException {
    lock.lock();
    try {
      ensureInitialized();
      flushLocked(timeoutMillis);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Performs a final best-effort flush, closes the session and releases the buffer. Idempotent.
   */
  public void shutdown() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      if (initialized) {
        try {
          flushLocked(0);
        } catch (RelayException ex) {
          log.warn("Endpoint {} dropped its final batch during shutdown: {}", name, ex.getMessage());
        }
      }
      connection.close();
      buffer.release();
      log.debug("Endpoint {} shut down", name);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the endpoint name.
   *
   * @return name
   */
  public String name() {
    return name;
  }

  /**
   * Indicates whether the first connect succeeded.
   *
   * @return {@code true} once initialized
   */
  public boolean isInitialized() {
    lock.lock();
    try {
      return initialized;
    } finally {
      lock.unlock();
    }
  }

  FrameBuffer buffer() {
    return buffer;
  }

  ConnectionManager connection() {
    return connection;
  }

  private void ensureInitialized() throws RelayException {
    if (closed) {
      throw new IllegalStateException("endpoint " + name + " has been shut down");
    }
    if (initialized) {
      return;
    }
    try {
      connection.ensureConnected();
    } catch (RelayException ex) {
      log.debug("Endpoint {} could not initialize: {}", name, ex.getMessage());
      throw ex;
    }
    buffer.reset();
    initialized = true;
  }

  private void flushLocked(long timeoutMillis) throws RelayException {
    long now = clock.nowMillis();
    log.debug("Endpoint {} flush: timeout={}ms filled={}", name, timeoutMillis, buffer.filled());
    if (timeoutMillis > 0 && !buffer.isDue(timeoutMillis, now)) {
      return;
    }
    if (buffer.isEffectivelyEmpty()) {
      buffer.restartClock(now);
      return;
    }
    byte[] payload;
    try {
      payload = buffer.finalizeBatch();
    } catch (FramingException ex) {
      metrics.increment(metricPrefix + "framing.failure");
      log.error("write_mqtt plugin: <{}> closing the batch failed; batch dropped: {}", name, ex.getMessage());
      throw ex;
    }
    try {
      connection.ensureConnected();
      connection.publish(payload);
      metrics.increment(metricPrefix + "publish.success");
      metrics.observe(metricPrefix + "batch.bytes", payload.length);
      if (log.isDebugEnabled()) {
        log.debug("Endpoint {} published {} bytes: {}", name, payload.length,
            Logs.preview(payload, PREVIEW_BYTES));
      }
    } catch (RelayException ex) {
      metrics.increment(metricPrefix + "publish.failure");
      throw ex;
    } finally {
      buffer.reset();
    }
  }

  private void traceFill() {
    if (log.isDebugEnabled()) {
      log.debug(
          "write_mqtt plugin: <{}> buffer {}/{} ({}%)",
          name, buffer.filled(), buffer.capacity(),
          String.format("%.1f", 100.0 * buffer.filled() / buffer.capacity()));
    }
  }
}
