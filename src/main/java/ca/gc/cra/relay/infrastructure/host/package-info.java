/**
 * Standalone host adapter: the in-process {@link ca.gc.cra.relay.application.port.HostRuntime} and the NDJSON
 * record reader feeding it from stdin.
 */
package ca.gc.cra.relay.infrastructure.host;
