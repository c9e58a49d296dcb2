/**
 * Timeline data model: raw upstream payloads and their canonical, upstream-independent views.
 * <p>Canonical values are immutable records; enrichment steps produce copies.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.domain.record;
