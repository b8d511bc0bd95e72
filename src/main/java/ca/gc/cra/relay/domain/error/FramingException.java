package ca.gc.cra.relay.domain.error;

/**
 * Raised when the serializer cannot frame or close a batch. The batch is presumed corrupt and discarded.
 *
 * @since 0.1.0
 */
public final class FramingException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public FramingException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public FramingException(String message, Throwable cause) {
    super(message, cause);
  }
}
