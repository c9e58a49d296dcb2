/**
 * Static author directory sources.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.infrastructure.directory;
