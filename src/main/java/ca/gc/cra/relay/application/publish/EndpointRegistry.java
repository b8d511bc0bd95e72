package ca.gc.cra.relay.application.publish;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.HostRuntime;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.RecordSerializer;
import ca.gc.cra.relay.application.port.TransportClient;
import ca.gc.cra.relay.config.NodeConfig;
import ca.gc.cra.relay.config.NodeConfigParser;
import ca.gc.cra.relay.domain.error.ConfigurationException;
import ca.gc.cra.relay.domain.error.RelayException;
import ca.gc.cra.relay.domain.error.ResourceException;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns configured node blocks into independent {@link Publisher}s and registers them with
 * the host.
 * <p><strong>Why:</strong> A bad node must not take the others down: each block is parsed, allocated and registered
 * on its own, and a failure only skips that node.</p>
 * <p><strong>Role:</strong> Application service wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse every node block and build its serializer, buffer, connection manager and publisher.</li>
 *   <li>Register {@code write_mqtt/<name>} write and flush callbacks mapping failures to {@link Status} codes.</li>
 *   <li>Register the process-wide transport init hook and a shutdown hook tearing down every endpoint.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #registerAll(Map)} runs once on the bootstrap thread; the registered
 * callbacks are thread-safe through each publisher's lock.</p>
 *
 * @since 0.1.0
 */
public final class EndpointRegistry {
  private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);
  static final String PLUGIN_NAME = "write_mqtt";

  private final HostRuntime host;
  private final TransportClient transport;
  private final NodeConfigParser parser;
  private final Function<NodeConfig, RecordSerializer> serializers;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final Map<String, Publisher> publishers = new LinkedHashMap<>();
  private final Map<String, NodeConfig> configs = new LinkedHashMap<>();
  private boolean hooksRegistered;
  private boolean shutDown;

  /**
   * Creates a registry.
   *
   * @param host runtime receiving the callbacks
   * @param transport transport shared by every endpoint
   * @param parser node block parser
   * @param serializers builds the serializer for a node; called once per node
   * @param clock time source
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public EndpointRegistry(
      HostRuntime host,
      TransportClient transport,
      NodeConfigParser parser,
      Function<NodeConfig, RecordSerializer> serializers,
      ClockPort clock,
      MetricsPort metrics) {
    this.host = Objects.requireNonNull(host, "host");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.serializers = Objects.requireNonNull(serializers, "serializers");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Outcome of {@link #registerAll(Map)}.
   *
   * @param registered node names registered, in document order
   * @param rejected rejected node names mapped to the reason
   */
  public record Registration(List<String> registered, Map<String, String> rejected) {
    /**
     * Copies components.
     */
    public Registration {
      registered = List.copyOf(registered);
      rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
    }
  }

  /**
   * Builds and registers one endpoint per node block. Invalid blocks are logged at ERROR and skipped.
   *
   * @param nodes node blocks keyed by node name, in document order
   * @return registered and rejected node names
   */
  public synchronized Registration registerAll(Map<String, Map<String, String>> nodes) {
    Objects.requireNonNull(nodes, "nodes");
    if (shutDown) {
      throw new IllegalStateException("registry has been shut down");
    }
    registerHooks();
    List<String> registered = new ArrayList<>();
    Map<String, String> rejected = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, String>> entry : nodes.entrySet()) {
      String name = entry.getKey();
      try {
        register(name, entry.getValue());
        registered.add(name);
      } catch (ConfigurationException | ResourceException ex) {
        log.error("write_mqtt plugin: node \"{}\" skipped: {}", name, ex.getMessage());
        rejected.put(name, ex.getMessage());
      }
    }
    return new Registration(registered, rejected);
  }

  /**
   * Parses one node block without allocating anything; used by {@code check}.
   *
   * @param name node name
   * @param block raw key/value block
   * @return validated node settings
   * @throws ConfigurationException if the block is invalid
   */
  public NodeConfig validate(String name, Map<String, String> block) throws ConfigurationException {
    return parser.parse(name, block);
  }

  /**
   * Shuts down every publisher, then releases the transport. Idempotent.
   */
  public synchronized void shutdownAll() {
    if (shutDown) {
      return;
    }
    shutDown = true;
    for (Publisher publisher : publishers.values()) {
      try {
        publisher.shutdown();
      } catch (RuntimeException ex) {
        log.error("Endpoint {} failed to shut down cleanly", publisher.name(), ex);
      }
    }
    transport.cleanup();
  }

  /**
   * Returns the publisher registered under {@code name}.
   *
   * @param name node name
   * @return publisher, if registered
   */
  public synchronized Optional<Publisher> publisher(String name) {
    return Optional.ofNullable(publishers.get(key(name)));
  }

  /**
   * Returns the settings of every registered node in registration order.
   *
   * @return immutable snapshot
   */
  public synchronized List<NodeConfig> nodeConfigs() {
    return List.copyOf(configs.values());
  }

  static int write(Publisher publisher, MetricRecord record) {
    try {
      publisher.write(record);
      return Status.SUCCESS.code();
    } catch (RelayException ex) {
      return Status.of(ex).code();
    } catch (IllegalStateException | IllegalArgumentException ex) {
      log.debug("Endpoint {} rejected write: {}", publisher.name(), ex.getMessage());
      return Status.INVALID.code();
    }
  }

  static int flush(Publisher publisher, long timeoutMillis) {
    try {
      publisher.flush(timeoutMillis);
      return Status.SUCCESS.code();
    } catch (RelayException ex) {
      return Status.of(ex).code();
    } catch (IllegalStateException ex) {
      log.debug("Endpoint {} rejected flush: {}", publisher.name(), ex.getMessage());
      return Status.INVALID.code();
    }
  }

  private void register(String name, Map<String, String> block) throws ConfigurationException, ResourceException {
    if (publishers.containsKey(key(name))) {
      throw new ConfigurationException("duplicate node name \"" + name + "\"");
    }
    NodeConfig node = parser.parse(name, block);
    RecordSerializer serializer = serializers.apply(node);
    FrameBuffer buffer = FrameBuffer.allocate(node.bufferSize(), serializer, clock);
    ConnectionManager connection = new ConnectionManager(
        node.name(), node.toTransportSettings(), node.topic(), node.qos(), transport, clock, metrics);
    Publisher publisher = new Publisher(node.name(), buffer, connection, clock, metrics);

    host.registerWrite(node.callbackName(), record -> write(publisher, record));
    host.registerFlush(node.callbackName(), timeout -> flush(publisher, timeout));
    publishers.put(key(name), publisher);
    configs.put(key(name), node);
    log.info("write_mqtt plugin: node \"{}\" publishes to {}:{} on topic \"{}\" (qos {}, {} TLS, buffer {} bytes)",
        node.name(), node.host(), node.port(), node.topic(), node.qos(),
        node.caPath().isPresent() ? "with" : "without", node.bufferSize());
  }

  private void registerHooks() {
    if (hooksRegistered) {
      return;
    }
    hooksRegistered = true;
    host.registerInit(PLUGIN_NAME, transport::initialize);
    host.registerShutdown(PLUGIN_NAME, this::shutdownAll);
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
