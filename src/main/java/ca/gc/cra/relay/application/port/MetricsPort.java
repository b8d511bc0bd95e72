package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Port abstracting RELAY metrics emission.
 * <p><strong>Why:</strong> Lets the publish core count successes, failures, and batch sizes without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like publish failures or buffer overflows.</li>
 *   <li>Record numeric observations such as published batch bytes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from every endpoint.</p>
 * <p><strong>Performance:</strong> Calls run inside endpoint critical sections and must not block.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code relay.<node>.publish.failure}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code relay.local.publish.success}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; used when the exporter is disabled and in tests.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
