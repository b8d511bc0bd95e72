/**
 * <strong>Purpose:</strong> MQTT transport adapter built on Eclipse Paho, including PEM-based TLS setup.
 * <p><strong>Concurrency:</strong> Sessions are driven under their endpoint's lock; Paho's network threads
 * service keepalives and acknowledgements independently.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.transport.mqtt;
