package ca.gc.cra.relay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches RELAY's own loggers to DEBUG for {@code --verbose}.
 * <p><strong>Why:</strong> Buffer fill levels, flush decisions and batch previews are DEBUG lines; operators
 * turn them on per run instead of editing {@code logback.xml}. Third-party loggers (OpenTelemetry exporter,
 * gRPC) keep their configured level so the DEBUG stream stays about the publisher.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Logback only; other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger name covering every RELAY class. */
  public static final String RELAY_LOGGER = "ca.gc.cra.relay";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the {@value #RELAY_LOGGER} logger to DEBUG.
   *
   * @return {@code true} when the level changed; {@code false} when it already was DEBUG or the backend is not
   *     Logback
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return false;
    }
    Logger relay = context.getLogger(RELAY_LOGGER);
    if (Level.DEBUG.equals(relay.getLevel())) {
      return false;
    }
    relay.setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled for {}", RELAY_LOGGER);
    return true;
  }
}
