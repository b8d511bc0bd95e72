package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Time source for batch staleness, complaint re-report deadlines and default record
 * timestamps.
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; producers and the flush trigger
 * read the clock concurrently.</p>
 *
 * <p>Tests substitute a manually advanced clock; production uses {@link #SYSTEM}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /** Wall clock; a backwards adjustment delays the next due flush. */
  ClockPort SYSTEM = System::currentTimeMillis;

  /**
   * Returns the current epoch time.
   *
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /**
   * Returns the current epoch time in the fractional-seconds unit metric records carry.
   *
   * @return seconds since the epoch, millisecond precision
   */
  default double nowSeconds() {
    return nowMillis() / 1000.0;
  }
}
