/**
 * Checked failure taxonomy shared by the publish core and its adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.error;
