/**
 * Fingerprint-based de-duplication and the chronological merge.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.merge;
