/**
 * <strong>Purpose:</strong> Strategy-ranked, paginated retrieval of upstream collections.
 * <p><strong>Pipeline role:</strong> First stage of the export; produces {@code RawRecord}s in upstream order.
 * <p><strong>Failure model:</strong> A collection whose candidates all fail raises
 * {@link ca.gc.cra.docket.application.fetch.NoRouteAvailableException}; callers decide whether that is fatal.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.fetch;
