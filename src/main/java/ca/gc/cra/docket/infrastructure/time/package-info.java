/**
 * Wall-clock adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.infrastructure.time;
