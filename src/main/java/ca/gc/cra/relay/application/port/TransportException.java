package ca.gc.cra.relay.application.port;

/**
 * Checked exception thrown by {@link TransportClient} and {@link TransportSession} implementations.
 *
 * @since 0.1.0
 */
public final class TransportException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public TransportException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause from the client library
   */
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
