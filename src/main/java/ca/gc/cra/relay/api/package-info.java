/**
 * <strong>Purpose:</strong> Command-line entry points: the {@code relay} dispatcher and its {@code run} and
 * {@code check} commands.
 * <p>Arguments are {@code key=value} pairs plus flags; output meant for humans goes through
 * {@link ca.gc.cra.relay.api.CliPrinter}, diagnostics through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.api;
