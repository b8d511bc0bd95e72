package ca.gc.cra.relay.domain.error;

/**
 * Raised when a record does not fit even into a freshly flushed, empty buffer.
 *
 * @since 0.1.0
 */
public final class OverflowException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public OverflowException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public OverflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
