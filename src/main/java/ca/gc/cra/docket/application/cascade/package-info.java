/**
 * Ordered fallback evaluation shared by the fetcher, the comment fetcher, and the author resolver.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.cascade;
