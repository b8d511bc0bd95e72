package ca.gc.cra.relay.infrastructure.transport.mqtt;

import ca.gc.cra.relay.application.port.TransportException;
import ca.gc.cra.relay.application.port.TransportSession;
import java.util.Objects;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportSession} wrapping one connected {@link MqttAsyncClient}.
 *
 * <p>Paho starts its network threads as part of the connect, so {@link #startBackgroundLoop()} only verifies the
 * client is up. {@link #stopBackgroundLoop()} always forces the threads down: a disconnect that timed out leaves the
 * client disconnecting, where {@link MqttAsyncClient#isConnected()} is already {@code false} but {@code close()}
 * is still refused.</p>
 */
final class PahoTransportSession implements TransportSession {
  private static final Logger log = LoggerFactory.getLogger(PahoTransportSession.class);
  static final long DISCONNECT_TIMEOUT_MILLIS = 5_000L;

  private final MqttAsyncClient client;
  private final MqttConnectOptions options;
  private final String uri;

  PahoTransportSession(MqttAsyncClient client, MqttConnectOptions options, String uri) {
    this.client = Objects.requireNonNull(client, "client");
    this.options = Objects.requireNonNull(options, "options");
    this.uri = Objects.requireNonNull(uri, "uri");
  }

  @Override
  public void startBackgroundLoop() throws TransportException {
    if (!client.isConnected()) {
      throw new TransportException("MQTT client for " + uri + " is not running");
    }
  }

  @Override
  public void reconnect() throws TransportException {
    try {
      client.connect(options).waitForCompletion();
    } catch (MqttException ex) {
      if (ex.getReasonCode() == MqttException.REASON_CODE_CLIENT_CONNECTED) {
        return;
      }
      throw new TransportException("reconnect to " + uri + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void publish(String topic, byte[] payload, int qos, boolean retain) throws TransportException {
    try {
      client.publish(topic, payload, qos, retain);
    } catch (MqttException | IllegalArgumentException ex) {
      throw new TransportException("publish to " + uri + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void disconnect() {
    try {
      client.disconnect().waitForCompletion(DISCONNECT_TIMEOUT_MILLIS);
    } catch (MqttException ex) {
      log.debug("Disconnect from {} failed: {}", uri, ex.getMessage());
    }
  }

  @Override
  public void stopBackgroundLoop() {
    try {
      client.disconnectForcibly(0L, DISCONNECT_TIMEOUT_MILLIS);
    } catch (MqttException ex) {
      if (ex.getReasonCode() == MqttException.REASON_CODE_CLIENT_ALREADY_DISCONNECTED
          || ex.getReasonCode() == MqttException.REASON_CODE_CLIENT_CLOSED) {
        return;
      }
      log.warn("Forced disconnect from {} failed: {}", uri, ex.getMessage());
    }
  }

  @Override
  public void destroy() {
    closeQuietly(client);
  }

  static void closeQuietly(MqttAsyncClient client) {
    try {
      client.close();
    } catch (MqttException ex) {
      if (ex.getReasonCode() == MqttException.REASON_CODE_CLIENT_CLOSED) {
        return;
      }
      log.warn("Closing MQTT client {} failed ({}); its network threads may still be running",
          client.getServerURI(), ex.getReasonCode());
    }
  }
}
