/**
 * Executor factories for the periodic flush trigger.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 */
package ca.gc.cra.relay.infrastructure.exec;
