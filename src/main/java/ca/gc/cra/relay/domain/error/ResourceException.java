package ca.gc.cra.relay.domain.error;

/**
 * Raised when an endpoint cannot allocate its buffer or internal structures during setup.
 *
 * @since 0.1.0
 */
public final class ResourceException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ResourceException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ResourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
