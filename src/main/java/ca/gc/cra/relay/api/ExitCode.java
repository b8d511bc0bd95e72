package ca.gc.cra.relay.api;

/**
 * <strong>What:</strong> Process exit statuses of the {@code relay} command.
 * <p><strong>Why:</strong> Service managers and scripts distinguish a bad command line from a bad configuration
 * file or a runtime failure.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the configuration or the record stream failed. */
  IO_ERROR(3),
  /** Configuration was malformed, or no node could be registered. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted while running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the status handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
