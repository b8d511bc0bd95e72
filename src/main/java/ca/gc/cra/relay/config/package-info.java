/**
 * <strong>Purpose:</strong> Configuration loading, merging and validation, plus the composition root.
 * <p>Process-wide settings merge with precedence CLI &gt; YAML &gt; defaults; each node block is validated on its
 * own by {@link ca.gc.cra.relay.config.NodeConfigParser} so one bad node does not block the others.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.config;
