/**
 * Caller identity presented to the upstream record API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.domain.auth;
