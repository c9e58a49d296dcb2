package ca.gc.cra.docket.application.fetch;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One candidate route for realizing a collection fetch: HTTP method, target, and paging rules.
 *
 * @param method {@code GET} or {@code POST}
 * @param uri absolute route, possibly carrying fixed query parameters
 * @param convention how {@code limit}/{@code offset} travel
 * @param moreSignal rule for requesting another page
 * @param bodyFields fixed JSON fields merged into POST bodies
 * @since 0.1.0
 */
public record FetchStrategy(
    String method,
    URI uri,
    PaginationConvention convention,
    MoreSignal moreSignal,
    Map<String, Object> bodyFields) {

  public FetchStrategy {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(convention, "convention");
    moreSignal = moreSignal == null ? MoreSignal.FLAG_OR_FULL_PAGE : moreSignal;
    bodyFields = bodyFields == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(bodyFields));
  }

  /**
   * GET route paged through query parameters.
   *
   * @param uri absolute route
   * @return strategy
   */
  public static FetchStrategy get(URI uri) {
    return new FetchStrategy("GET", uri, PaginationConvention.QUERY_OFFSET, MoreSignal.FLAG_OR_FULL_PAGE, Map.of());
  }

  /**
   * POST route paged through the JSON body.
   *
   * @param uri absolute route
   * @param bodyFields fixed body fields such as a parent id
   * @return strategy
   */
  public static FetchStrategy post(URI uri, Map<String, Object> bodyFields) {
    return new FetchStrategy("POST", uri, PaginationConvention.BODY_OFFSET, MoreSignal.FLAG_OR_FULL_PAGE, bodyFields);
  }

  /**
   * Returns a copy using another more-pages rule.
   *
   * @param signal replacement rule
   * @return updated strategy
   */
  public FetchStrategy withMoreSignal(MoreSignal signal) {
    return new FetchStrategy(method, uri, convention, signal, bodyFields);
  }

  /** Short label used in logs and diagnostics, e.g. {@code GET /fv-app/v2/projects/7/notes}. */
  public String label() {
    String query = uri.getRawQuery();
    return method + " " + uri.getRawPath() + (query == null ? "" : "?" + query);
  }

  @Override
  public String toString() {
    return label();
  }
}
