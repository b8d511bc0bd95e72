package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.port.TransportSettings;
import ca.gc.cra.relay.application.port.TransportSettings.ProtocolVersion;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, validated settings of one configured destination ("node").
 * <p><strong>Why:</strong> Each node becomes one independent endpoint with its own buffer, session and lock.</p>
 * <p><strong>Role:</strong> Produced by {@link NodeConfigParser}; consumed by {@code EndpointRegistry}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param name unique node name used in callback names and metric keys
 * @param host broker host
 * @param port broker TCP port
 * @param clientId client identifier presented to the broker
 * @param caPath CA bundle; presence enables TLS
 * @param clientCert client certificate for mutual TLS
 * @param clientKey client private key for mutual TLS
 * @param insecure disables the broker host name check; the certificate chain is still verified against the CA
 * @param qos publish quality of service, 0 or 1
 * @param topic publish topic
 * @param storeRates convert counter-like values to per-second rates
 * @param bufferSize send buffer capacity in bytes
 * @param protocolVersion MQTT protocol revision
 * @since 0.1.0
 */
public record NodeConfig(
    String name,
    String host,
    int port,
    String clientId,
    Optional<Path> caPath,
    Optional<Path> clientCert,
    Optional<Path> clientKey,
    boolean insecure,
    int qos,
    String topic,
    boolean storeRates,
    int bufferSize,
    ProtocolVersion protocolVersion) {

  /** Default broker port (MQTT over TLS). */
  public static final int DEFAULT_PORT = 8883;
  /** Default publish topic. */
  public static final String DEFAULT_TOPIC = "collectd";
  /** Smallest accepted send buffer. */
  public static final int MIN_BUFFER_SIZE = 1024;
  /** Largest accepted send buffer, also the default. */
  public static final int MAX_BUFFER_SIZE = 128 * 1024;
  /** Keepalive interval negotiated with the broker. */
  public static final int KEEPALIVE_SECONDS = 60;

  /**
   * Validates required components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public NodeConfig {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(caPath, "caPath");
    Objects.requireNonNull(clientCert, "clientCert");
    Objects.requireNonNull(clientKey, "clientKey");
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(protocolVersion, "protocolVersion");
  }

  /**
   * Builds the transport parameters for this node; TLS is enabled only when {@link #caPath()} is set.
   *
   * @return connection settings handed to the transport client
   */
  public TransportSettings toTransportSettings() {
    Optional<TransportSettings.Tls> tls =
        caPath.map(ca -> new TransportSettings.Tls(ca, clientCert, clientKey, insecure));
    return new TransportSettings(host, port, clientId, KEEPALIVE_SECONDS, protocolVersion, tls);
  }

  /**
   * Returns the host callback name ({@code write_mqtt/<name>}).
   *
   * @return callback name
   */
  public String callbackName() {
    return "write_mqtt/" + name;
  }
}
