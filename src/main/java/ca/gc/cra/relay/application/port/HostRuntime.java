package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.metric.MetricRecord;

/**
 * <strong>What:</strong> Port through which endpoints register themselves with the hosting process.
 * <p><strong>Why:</strong> The host decides when records arrive and when flushes are due; endpoints only expose
 * opaque write/flush capabilities plus process-wide init and shutdown hooks.</p>
 * <p><strong>Role:</strong> Implemented by {@code InProcessHost}; consumed by {@code EndpointRegistry}.</p>
 * <p><strong>Thread-safety:</strong> Registration happens on the configuration thread; callbacks may be invoked
 * from any thread afterwards.</p>
 *
 * @since 0.1.0
 */
public interface HostRuntime {

  /**
   * Registers a write capability under a unique callback name.
   *
   * @param name callback name (e.g., {@code write_mqtt/local})
   * @param callback capability invoked with every record
   */
  void registerWrite(String name, WriteCallback callback);

  /**
   * Registers a flush capability under a unique callback name.
   *
   * @param name callback name
   * @param callback capability invoked with a staleness timeout
   */
  void registerFlush(String name, FlushCallback callback);

  /**
   * Registers a hook run once before the first write.
   *
   * @param name hook name
   * @param hook initialization action
   */
  void registerInit(String name, Runnable hook);

  /**
   * Registers a hook run once at process shutdown, after producers have stopped.
   *
   * @param name hook name
   * @param hook shutdown action
   */
  void registerShutdown(String name, Runnable hook);

  /**
   * Write capability; returns {@code 0} on success and a negative status code on failure.
   */
  @FunctionalInterface
  interface WriteCallback {
    /**
     * Encodes one record into the endpoint buffer.
     *
     * @param record record to write
     * @return status code
     */
    int write(MetricRecord record);
  }

  /**
   * Flush capability; returns {@code 0} on success and a negative status code on failure.
   */
  @FunctionalInterface
  interface FlushCallback {
    /**
     * Publishes the buffered batch when it is older than {@code timeoutMillis}; {@code 0} flushes
     * unconditionally.
     *
     * @param timeoutMillis staleness threshold in milliseconds
     * @return status code
     */
    int flush(long timeoutMillis);
  }
}
