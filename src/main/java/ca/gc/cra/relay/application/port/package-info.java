/**
 * <strong>Purpose:</strong> Ports defining the contracts between the publish core and its collaborators:
 * record serialization, broker transport, host registration, metrics, and time.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise; the core
 * calls serializer and session methods under the endpoint lock.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.port;
