package ca.gc.cra.relay.domain.error;

/**
 * Base checked exception for failures raised while buffering, framing, or publishing telemetry.
 *
 * <p>Subclasses identify the failure kind so callers can map them to host status codes without
 * inspecting messages.</p>
 *
 * @since 0.1.0
 */
public abstract class RelayException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  protected RelayException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  protected RelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
