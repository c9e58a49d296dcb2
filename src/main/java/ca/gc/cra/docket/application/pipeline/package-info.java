/**
 * <strong>Purpose:</strong> Orchestration of one export run.
 * <p><strong>Pipeline role:</strong> Fetch, normalize, resolve, enrich, merge, render; partial failures are
 * absorbed at the smallest unit and surfaced in the {@link ca.gc.cra.docket.application.pipeline.ExportReport}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.pipeline;
