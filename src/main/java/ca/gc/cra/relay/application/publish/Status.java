package ca.gc.cra.relay.application.publish;

import ca.gc.cra.relay.domain.error.ConfigurationException;
import ca.gc.cra.relay.domain.error.ConnectionException;
import ca.gc.cra.relay.domain.error.FramingException;
import ca.gc.cra.relay.domain.error.OverflowException;
import ca.gc.cra.relay.domain.error.PublishException;
import ca.gc.cra.relay.domain.error.RelayException;
import ca.gc.cra.relay.domain.error.ResourceException;

/**
 * Integer status codes returned to the host from write and flush callbacks.
 *
 * @since 0.1.0
 */
public enum Status {
  /** Operation completed. */
  SUCCESS(0),
  /** Broker unreachable. */
  CONNECTION_FAILED(-1),
  /** Publish refused by the session. */
  PUBLISH_FAILED(-2),
  /** Batch could not be framed. */
  FRAMING_FAILED(-3),
  /** Record exceeds the buffer. */
  OVERFLOW(-4),
  /** Allocation failed. */
  RESOURCE(-5),
  /** Invalid configuration. */
  CONFIGURATION(-6),
  /** Invalid argument or endpoint state. */
  INVALID(-22);

  private final int code;

  Status(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric code handed to the host.
   *
   * @return {@code 0} on success, negative otherwise
   */
  public int code() {
    return code;
  }

  /**
   * Maps a domain failure to its status.
   *
   * @param failure exception raised by a publisher
   * @return matching status; {@link #INVALID} for unknown kinds
   */
  public static Status of(RelayException failure) {
    if (failure instanceof ConnectionException) {
      return CONNECTION_FAILED;
    }
    if (failure instanceof PublishException) {
      return PUBLISH_FAILED;
    }
    if (failure instanceof FramingException) {
      return FRAMING_FAILED;
    }
    if (failure instanceof OverflowException) {
      return OVERFLOW;
    }
    if (failure instanceof ResourceException) {
      return RESOURCE;
    }
    if (failure instanceof ConfigurationException) {
      return CONFIGURATION;
    }
    return INVALID;
  }
}
