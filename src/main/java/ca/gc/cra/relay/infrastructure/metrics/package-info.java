/**
 * Metrics adapters bridging the RELAY {@link ca.gc.cra.relay.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are cached per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code relay.<node>.*} namespace.</p>
 */
package ca.gc.cra.relay.infrastructure.metrics;
