/**
 * Logging helpers: runtime verbosity toggling and log-line hygiene.
 *
 * <p>RELAY logs through SLF4J with Logback as the backend; these helpers are the only code touching Logback
 * directly.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.logging;
