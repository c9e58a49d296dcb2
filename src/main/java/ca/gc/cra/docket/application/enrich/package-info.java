/**
 * Bounded-concurrency comment enrichment with per-note failure isolation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.enrich;
