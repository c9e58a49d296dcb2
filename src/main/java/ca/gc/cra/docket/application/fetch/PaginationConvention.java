package ca.gc.cra.docket.application.fetch;

/**
 * How a strategy transports its paging cursor.
 *
 * @since 0.1.0
 */
public enum PaginationConvention {
  /** {@code limit} and {@code offset} appended as query parameters (GET routes). */
  QUERY_OFFSET,
  /** {@code limit} and {@code offset} sent inside a JSON request body (POST routes). */
  BODY_OFFSET
}
