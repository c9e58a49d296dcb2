/**
 * <strong>Purpose:</strong> Renderers for the exported timeline.
 * <p>The NDJSON writer is the bundled renderer; document layouts plug into
 * {@link ca.gc.cra.docket.application.port.TimelineRendererPort} the same way.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.infrastructure.render;
