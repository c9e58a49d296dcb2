/**
 * <strong>Purpose:</strong> Author resolution through inline fields, a static directory, creator links, and user
 * lookups.
 * <p><strong>Concurrency:</strong> remote calls are deduplicated per run with compute-once caches; concurrent
 * callers for the same link or id share one upstream call.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.author;
