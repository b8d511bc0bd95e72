package ca.gc.cra.relay.domain.error;

/**
 * Raised when a node block carries an unknown key, an out-of-range value, or lacks a required key.
 * The offending node is not registered; other nodes are unaffected.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
