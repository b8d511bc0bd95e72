/**
 * <strong>Purpose:</strong> Telemetry record model flowing from producers into endpoint buffers.
 * <p><strong>Concurrency:</strong> All types are immutable records or enums.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.metric;
