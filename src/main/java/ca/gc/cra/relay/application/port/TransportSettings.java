package ca.gc.cra.relay.application.port;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection parameters handed to {@link TransportClient#connect(TransportSettings)}.
 *
 * @param host broker host name or address
 * @param port broker TCP port
 * @param clientId client identifier presented to the broker
 * @param keepAliveSeconds keepalive interval
 * @param protocolVersion protocol revision to negotiate
 * @param tls TLS material; empty for plain TCP
 * @since 0.1.0
 */
public record TransportSettings(
    String host,
    int port,
    String clientId,
    int keepAliveSeconds,
    ProtocolVersion protocolVersion,
    Optional<Tls> tls) {

  /**
   * Validates required components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public TransportSettings {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(protocolVersion, "protocolVersion");
    Objects.requireNonNull(tls, "tls");
  }

  /**
   * Protocol revision requested at connect time.
   */
  public enum ProtocolVersion {
    /** MQTT 3.1. */
    V3_1("3.1"),
    /** MQTT 3.1.1. */
    V3_1_1("3.1.1");

    private final String label;

    ProtocolVersion(String label) {
      this.label = label;
    }

    /**
     * Returns the configuration label ({@code "3.1"} or {@code "3.1.1"}).
     *
     * @return label
     */
    public String label() {
      return label;
    }

    /**
     * Parses a configuration label.
     *
     * @param raw label such as {@code "3.1.1"}
     * @return matching version
     * @throws IllegalArgumentException if the label is unknown
     */
    public static ProtocolVersion fromLabel(String raw) {
      String trimmed = raw == null ? "" : raw.trim();
      for (ProtocolVersion version : values()) {
        if (version.label.equals(trimmed)) {
          return version;
        }
      }
      throw new IllegalArgumentException("unsupported protocol version: " + raw);
    }
  }

  /**
   * TLS material; enabled when a certificate authority file is configured.
   *
   * @param caFile PEM file holding the trusted certificate authorities
   * @param clientCert optional PEM client certificate chain
   * @param clientKey optional PEM (PKCS#8) client private key
   * @param insecure when {@code true}, the broker host name is not checked against its certificate; the chain is still
   *     verified against {@code caFile}
   */
  public record Tls(Path caFile, Optional<Path> clientCert, Optional<Path> clientKey, boolean insecure) {

    /**
     * Validates required components.
     *
     * @throws NullPointerException if a component is {@code null}
     */
    public Tls {
      Objects.requireNonNull(caFile, "caFile");
      Objects.requireNonNull(clientCert, "clientCert");
      Objects.requireNonNull(clientKey, "clientKey");
    }
  }
}
