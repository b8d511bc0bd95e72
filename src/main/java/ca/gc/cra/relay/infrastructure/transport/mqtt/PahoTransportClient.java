package ca.gc.cra.relay.infrastructure.transport.mqtt;

import ca.gc.cra.relay.application.port.TransportClient;
import ca.gc.cra.relay.application.port.TransportException;
import ca.gc.cra.relay.application.port.TransportSession;
import ca.gc.cra.relay.application.port.TransportSettings;
import ca.gc.cra.relay.validation.Net;
import java.io.IOException;
import java.security.GeneralSecurityException;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TransportClient} backed by the Eclipse Paho MQTT v3 asynchronous client.
 * <p><strong>Why:</strong> Paho runs its own network threads, so publishes hand the message to the client and
 * return without waiting for broker acknowledgement.</p>
 * <p><strong>Role:</strong> Production transport adapter wired by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each {@link #connect(TransportSettings)} builds an independent
 * client.</p>
 *
 * @implNote Sessions are clean, keep nothing on disk ({@link MemoryPersistence}) and never reconnect on their
 * own; reconnects happen only when the publish path asks for one.
 * @since 0.1.0
 */
public final class PahoTransportClient implements TransportClient {
  private static final Logger log = LoggerFactory.getLogger(PahoTransportClient.class);
  static final int MAX_INFLIGHT = 1000;

  @Override
  public void initialize() {
    log.debug("Paho MQTT transport ready");
  }

  @Override
  public void cleanup() {
    log.debug("Paho MQTT transport released");
  }

  @Override
  public TransportSession connect(TransportSettings settings) throws TransportException {
    MqttConnectOptions options = connectOptions(settings);
    String uri = serverUri(settings);
    MqttAsyncClient client;
    try {
      client = new MqttAsyncClient(uri, settings.clientId(), new MemoryPersistence());
    } catch (MqttException | IllegalArgumentException ex) {
      throw new TransportException("cannot create MQTT client for " + uri + ": " + ex.getMessage(), ex);
    }
    try {
      client.connect(options).waitForCompletion();
    } catch (MqttException ex) {
      PahoTransportSession.closeQuietly(client);
      throw new TransportException("connect to " + uri + " failed: " + ex.getMessage(), ex);
    }
    log.debug("Connected MQTT client {} to {}", settings.clientId(), uri);
    return new PahoTransportSession(client, options, uri);
  }

  static String serverUri(TransportSettings settings) {
    String scheme = settings.tls().isPresent() ? "ssl" : "tcp";
    String host = Net.isIpv6Literal(settings.host()) ? '[' + settings.host() + ']' : settings.host();
    return scheme + "://" + host + ':' + settings.port();
  }

  static MqttConnectOptions connectOptions(TransportSettings settings) throws TransportException {
    MqttConnectOptions options = new MqttConnectOptions();
    options.setCleanSession(true);
    options.setAutomaticReconnect(false);
    options.setKeepAliveInterval(settings.keepAliveSeconds());
    options.setMaxInflight(MAX_INFLIGHT);
    options.setMqttVersion(settings.protocolVersion() == TransportSettings.ProtocolVersion.V3_1
        ? MqttConnectOptions.MQTT_VERSION_3_1
        : MqttConnectOptions.MQTT_VERSION_3_1_1);
    if (settings.tls().isPresent()) {
      TransportSettings.Tls tls = settings.tls().get();
      try {
        options.setSocketFactory(TlsSocketFactories.create(tls));
      } catch (GeneralSecurityException | IOException ex) {
        throw new TransportException("cannot set up TLS from " + tls.caFile() + ": " + ex.getMessage(), ex);
      }
      options.setHttpsHostnameVerificationEnabled(!tls.insecure());
    }
    return options;
  }
}
