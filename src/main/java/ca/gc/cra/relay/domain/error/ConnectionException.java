package ca.gc.cra.relay.domain.error;

/**
 * Raised when connecting or reconnecting to the broker fails. The endpoint retries on its next write or flush.
 *
 * @since 0.1.0
 */
public final class ConnectionException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ConnectionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
