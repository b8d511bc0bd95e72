package ca.gc.cra.relay.application.publish;

import ca.gc.cra.relay.application.port.ClockPort;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Log-suppression state machine for one failure condition of one endpoint.
 * <p><strong>Why:</strong> An unreachable broker fails every write and flush; without suppression the error log
 * would receive one identical line per call.</p>
 * <p><strong>Role:</strong> Owned by {@link ConnectionManager} ("cannot publish/connect") and {@link Publisher}
 * ("record too large").</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Log the first report of a condition at ERROR and mark it active.</li>
 *   <li>Suppress further reports while active, re-reporting only after an interval that doubles from one
 *   minute up to one day.</li>
 *   <li>Log exactly one INFO recovery line when the condition clears.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers hold the endpoint lock.</p>
 *
 * @since 0.1.0
 */
public final class ComplaintThrottle {
  static final long INITIAL_INTERVAL_MILLIS = 60_000L;
  static final long MAX_INTERVAL_MILLIS = 86_400_000L;

  private final Logger log;
  private final ClockPort clock;
  private boolean active;
  private long intervalMillis;
  private long nextReportAtMillis;
  private long suppressed;

  /**
   * Creates an inactive throttle.
   *
   * @param log logger receiving the ERROR and INFO lines; usually the owner's logger
   * @param clock time source for re-report deadlines
   */
  public ComplaintThrottle(Logger log, ClockPort clock) {
    this.log = Objects.requireNonNull(log, "log");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reports the condition, logging at ERROR unless it is already active and not yet due for a re-report.
   *
   * @param format SLF4J message format
   * @param args message arguments
   * @return {@code true} when a line was logged
   */
  public boolean report(String format, Object... args) {
    long now = clock.nowMillis();
    if (active && now < nextReportAtMillis) {
      suppressed++;
      return false;
    }
    intervalMillis = active ? Math.min(intervalMillis * 2, MAX_INTERVAL_MILLIS) : INITIAL_INTERVAL_MILLIS;
    nextReportAtMillis = now + intervalMillis;
    active = true;
    log.error(format, args);
    return true;
  }

  /**
   * Clears the condition, logging a single INFO line if it was active.
   *
   * @param format SLF4J message format
   * @param args message arguments
   * @return {@code true} when the condition was active and a recovery line was logged
   */
  public boolean clear(String format, Object... args) {
    if (!active) {
      return false;
    }
    active = false;
    if (suppressed > 0) {
      Object[] withCount = Arrays.copyOf(args, args.length + 1);
      withCount[args.length] = suppressed;
      log.info(format + " ({} repeated failures were not logged)", withCount);
    } else {
      log.info(format, args);
    }
    suppressed = 0;
    intervalMillis = 0;
    nextReportAtMillis = 0;
    return true;
  }

  /**
   * Indicates whether the condition is currently being reported.
   *
   * @return {@code true} while active
   */
  public boolean isActive() {
    return active;
  }

  /**
   * Returns how many reports were suppressed since the condition became active.
   *
   * @return suppressed report count
   */
  public long suppressedCount() {
    return suppressed;
  }
}
