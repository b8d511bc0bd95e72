/**
 * JSON batch framing and rate conversion for published records.
 */
package ca.gc.cra.relay.infrastructure.serialization.json;
