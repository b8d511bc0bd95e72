package ca.gc.cra.relay.domain.error;

/**
 * Raised when the transport rejects a publish. The in-flight batch is dropped and the connection is marked down.
 *
 * @since 0.1.0
 */
public final class PublishException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public PublishException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
