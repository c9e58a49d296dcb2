/**
 * Executor construction helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.infrastructure.exec;
