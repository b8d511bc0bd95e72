/**
 * <strong>Purpose:</strong> The publishing core: batch buffering, the broker connection state machine, the
 * write/flush protocol and throttled failure logging.
 * <p><strong>Concurrency:</strong> Every endpoint is guarded by its own lock inside {@link
 * ca.gc.cra.relay.application.publish.Publisher}; endpoints share no state.</p>
 * <p><strong>Observability:</strong> Metric keys follow {@code relay.<node>.<event>}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.publish;
