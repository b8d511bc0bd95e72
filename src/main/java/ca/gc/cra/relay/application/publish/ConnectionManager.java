package ca.gc.cra.relay.application.publish;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.TransportClient;
import ca.gc.cra.relay.application.port.TransportException;
import ca.gc.cra.relay.application.port.TransportSession;
import ca.gc.cra.relay.application.port.TransportSettings;
import ca.gc.cra.relay.domain.error.ConnectionException;
import ca.gc.cra.relay.domain.error.PublishException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Connect/reconnect/publish state machine for one endpoint's broker session.
 * <p><strong>Why:</strong> Brokers come and go; the session is created lazily on first use and re-established on
 * demand after a failed publish, without blocking producers on a background retry loop.</p>
 * <p><strong>Role:</strong> Owned by {@link Publisher}; wraps a {@link TransportClient} and the
 * {@link TransportSession} it creates.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Connect on first demand and start the session's background I/O.</li>
 *   <li>Reconnect an existing session after liveness was lost.</li>
 *   <li>Report connect and publish failures through one throttled complaint, cleared by the next successful
 *   publish.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; every call runs under the endpoint lock.</p>
 * <p><strong>Observability:</strong> Emits {@code relay.<node>.connect.failure}; complaint lines go to this
 * class's logger.</p>
 *
 * <p>{@code connected} is optimistic: it stays {@code true} until a publish fails, even if the broker has
 * silently dropped the session.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final String name;
  private final TransportSettings settings;
  private final String topic;
  private final int qos;
  private final TransportClient client;
  private final ComplaintThrottle complaint;
  private final MetricsPort metrics;
  private final String connectFailureKey;

  private TransportSession session;
  private boolean connected;

  /**
   * Creates a disconnected manager; no network activity happens until {@link #ensureConnected()}.
   *
   * @param name endpoint name used in metric keys
   * @param settings broker connection parameters
   * @param topic publish topic
   * @param qos quality of service, 0 or 1
   * @param client transport factory
   * @param clock time source for complaint re-report deadlines
   * @param metrics metrics sink
   */
  public ConnectionManager(
      String name,
      TransportSettings settings,
      String topic,
      int qos,
      TransportClient client,
      ClockPort clock,
      MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.topic = Objects.requireNonNull(topic, "topic");
    this.qos = qos;
    this.client = Objects.requireNonNull(client, "client");
    this.complaint = new ComplaintThrottle(log, Objects.requireNonNull(clock, "clock"));
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.connectFailureKey = "relay." + name + ".connect.failure";
  }

  /**
   * Makes sure a live session exists, connecting or reconnecting if necessary.
   *
   * @throws ConnectionException if the broker cannot be reached; retried on the next call without backoff
   */
  public void ensureConnected() throws ConnectionException {
    if (connected) {
      return;
    }
    try {
      if (session == null) {
        session = openSession();
      } else {
        session.reconnect();
      }
    } catch (TransportException ex) {
      metrics.increment(connectFailureKey);
      complaint.report(
          "write_mqtt plugin: cannot connect to broker \"{}:{}\": {}",
          settings.host(), settings.port(), ex.getMessage());
      throw new ConnectionException(
          "cannot connect to broker " + settings.host() + ":" + settings.port(), ex);
    }
    connected = true;
    log.debug("Endpoint {} connected to {}:{}", name, settings.host(), settings.port());
  }

  /**
   * Sends one batch on the configured topic without retain. The first success after a reported failure logs
   * one recovery line.
   *
   * @param payload framed batch
   * @throws PublishException if the session refuses the message; the session is then marked disconnected
   * @throws IllegalStateException if called before {@link #ensureConnected()} succeeded
   */
  public void publish(byte[] payload) throws PublishException {
    if (!connected || session == null) {
      throw new IllegalStateException("endpoint " + name + " is not connected");
    }
    try {
      session.publish(topic, payload, qos, false);
    } catch (TransportException ex) {
      complaint.report(
          "write_mqtt plugin: cannot publish data to \"{}:{}\" on topic \"{}\": {}",
          settings.host(), settings.port(), topic, ex.getMessage());
      connected = false;
      session.disconnect();
      throw new PublishException("publish to topic " + topic + " failed", ex);
    }
    complaint.clear(
        "write_mqtt plugin: publishing again to broker \"{}:{}\"", settings.host(), settings.port());
  }

  /**
   * Disconnects, stops background I/O and releases the session. Safe to call repeatedly.
   */
  public void close() {
    if (session == null) {
      return;
    }
    if (connected) {
      session.disconnect();
      connected = false;
    }
    session.stopBackgroundLoop();
    session.destroy();
    session = null;
  }

  /**
   * Indicates whether the session is believed to be live.
   *
   * @return optimistic liveness flag
   */
  public boolean isConnected() {
    return connected;
  }

  /**
   * Indicates whether a session handle currently exists.
   *
   * @return {@code true} once a connect succeeded and until {@link #close()}
   */
  public boolean hasSession() {
    return session != null;
  }

  ComplaintThrottle complaint() {
    return complaint;
  }

  private TransportSession openSession() throws TransportException {
    TransportSession fresh = client.connect(settings);
    try {
      fresh.startBackgroundLoop();
    } catch (TransportException ex) {
      fresh.disconnect();
      fresh.destroy();
      throw ex;
    }
    return fresh;
  }
}
