package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Port creating publish/subscribe sessions against a broker.
 * <p><strong>Why:</strong> Isolates the protocol library (connect, TLS handshake, framing, background I/O) from
 * the connection state machine in {@code ConnectionManager}.</p>
 * <p><strong>Role:</strong> Implemented by {@code PahoTransportClient}; tests supply scripted fakes.</p>
 * <p><strong>Thread-safety:</strong> {@link #connect(TransportSettings)} may be called concurrently for different
 * endpoints; each returned session is used under its endpoint's lock only.</p>
 *
 * @since 0.1.0
 */
public interface TransportClient {

  /**
   * Process-wide library initialization, run once before any endpoint connects.
   */
  default void initialize() {}

  /**
   * Process-wide library cleanup, run once after every endpoint has been torn down.
   */
  default void cleanup() {}

  /**
   * Opens a new session and performs the initial connect (including TLS setup).
   *
   * <p>The returned session is connected but its background I/O may not be running yet; callers follow up
   * with {@link TransportSession#startBackgroundLoop()}.</p>
   *
   * @param settings connection parameters
   * @return connected session
   * @throws TransportException if the session cannot be created or the connect fails; no session leaks
   */
  TransportSession connect(TransportSettings settings) throws TransportException;
}
