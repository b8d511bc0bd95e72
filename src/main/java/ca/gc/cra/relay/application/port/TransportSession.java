package ca.gc.cra.relay.application.port;

/**
 * Handle on one broker session created by {@link TransportClient}.
 *
 * <p>Callers serialize access through the endpoint lock. {@link #disconnect()}, {@link #stopBackgroundLoop()}
 * and {@link #destroy()} are best-effort and never throw.</p>
 *
 * @since 0.1.0
 */
public interface TransportSession {

  /**
   * Starts the background I/O pump that services keepalives and in-flight acknowledgements.
   *
   * @throws TransportException if the pump cannot be started
   */
  void startBackgroundLoop() throws TransportException;

  /**
   * Re-establishes the session with the settings used at connect time.
   *
   * @throws TransportException if the broker cannot be reached
   */
  void reconnect() throws TransportException;

  /**
   * Sends a message without waiting for broker acknowledgement.
   *
   * @param topic destination topic
   * @param payload message body
   * @param qos quality of service level (0 or 1)
   * @param retain whether the broker should retain the message
   * @throws TransportException if the message cannot be handed to the session
   */
  void publish(String topic, byte[] payload, int qos, boolean retain) throws TransportException;

  /**
   * Disconnects from the broker, ignoring failures.
   */
  void disconnect();

  /**
   * Stops the background I/O pump, ignoring failures.
   */
  void stopBackgroundLoop();

  /**
   * Releases every resource held by the session. The session is unusable afterwards.
   */
  void destroy();
}
