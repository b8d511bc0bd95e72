package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.TransportClient;
import ca.gc.cra.relay.application.publish.EndpointRegistry;
import ca.gc.cra.relay.infrastructure.host.InProcessHost;
import ca.gc.cra.relay.infrastructure.host.NdjsonRecordReader;
import ca.gc.cra.relay.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.relay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.relay.infrastructure.serialization.json.JsonRecordSerializer;
import ca.gc.cra.relay.infrastructure.transport.mqtt.PahoTransportClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires RELAY's ports to their production adapters for one CLI run.
 * <p><strong>Why:</strong> Keeps adapter choice in one place so the publishing core only sees ports.</p>
 * <p><strong>Role:</strong> Composition root between {@link RelayConfig} and the running host.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the clock, metrics adapter and MQTT transport.</li>
 *   <li>Create the in-process host and the endpoint registry bound to it.</li>
 *   <li>Close the metrics adapter when the run ends.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build and use on the bootstrap thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RelayConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final InProcessHost host;
  private final EndpointRegistry registry;

  /**
   * Creates the production wiring: Paho transport, JSON serializer, OpenTelemetry metrics, system clock.
   *
   * @param config effective configuration
   * @param metricsSettings metrics exporter settings
   */
  public CompositionRoot(RelayConfig config, MetricsSettings metricsSettings) {
    this(config, new PahoTransportClient(), new OpenTelemetryMetricsAdapter(metricsSettings),
        ClockPort.SYSTEM, new NodeConfigParser());
  }

  /**
   * Creates a wiring with explicit adapters.
   *
   * @param config effective configuration
   * @param transport transport shared by all endpoints
   * @param metrics metrics sink; closed by {@link #close()} when it is {@link AutoCloseable}
   * @param clock time source
   * @param parser node block parser
   */
  public CompositionRoot(
      RelayConfig config, TransportClient transport, MetricsPort metrics, ClockPort clock, NodeConfigParser parser) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.host = new InProcessHost(config.flushInterval(), config.flushTimeout());
    this.registry = new EndpointRegistry(
        host,
        Objects.requireNonNull(transport, "transport"),
        Objects.requireNonNull(parser, "parser"),
        node -> new JsonRecordSerializer(node.storeRates()),
        clock,
        metrics);
  }

  /**
   * Builds and registers one endpoint per configured node.
   *
   * @return registration outcome
   */
  public EndpointRegistry.Registration registerEndpoints() {
    return registry.registerAll(config.nodes());
  }

  /**
   * Returns the host that dispatches records and drives flushes.
   *
   * @return host
   */
  public InProcessHost host() {
    return host;
  }

  /**
   * Returns the endpoint registry.
   *
   * @return registry
   */
  public EndpointRegistry registry() {
    return registry;
  }

  /**
   * Builds a reader for newline-delimited JSON records.
   *
   * @return reader stamping records without a time with this root's clock
   */
  public NdjsonRecordReader recordReader() {
    return new NdjsonRecordReader(clock);
  }

  /**
   * Returns the metrics sink shared by every endpoint.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter: {}", ex.getMessage());
      }
    }
  }
}
