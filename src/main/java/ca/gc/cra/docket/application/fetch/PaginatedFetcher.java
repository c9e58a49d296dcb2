package ca.gc.cra.docket.application.fetch;

import ca.gc.cra.docket.application.cascade.Cascade;
import ca.gc.cra.docket.application.cascade.CascadeOutcome;
import ca.gc.cra.docket.application.cascade.Rejection;
import ca.gc.cra.docket.application.cascade.Verdict;
import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.application.port.UpstreamRequest;
import ca.gc.cra.docket.application.port.UpstreamResponse;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.domain.record.RawRecord;
import ca.gc.cra.docket.logging.Logs;
import ca.gc.cra.docket.validation.Numbers;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Retrieves one logical collection by walking ranked candidate routes, then paginating the
 * first route that yields data.
 * <p><strong>Why:</strong> The upstream contract differs between tenants and versions; the export has to find a
 * working route at run time instead of assuming one.</p>
 * <p><strong>Lock-in:</strong> once a candidate produces an accepted first page, every later page comes from that
 * candidate. A later page that fails stops pagination with the records gathered so far; no other candidate is
 * consulted.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; the notes and emails tasks share one instance.</p>
 * <p><strong>Observability:</strong> {@code fetch.page.requested}, {@code fetch.strategy.failed},
 * {@code fetch.strategy.locked}, {@code fetch.collection.noRoute}, {@code fetch.page.failed},
 * {@code fetch.items}.</p>
 *
 * @since 0.1.0
 */
public final class PaginatedFetcher {
  private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);
  private static final int ERROR_SNIPPET_BYTES = 600;

  private final UpstreamPort upstream;
  private final StrategyCatalog catalog;
  private final PageParser parser;
  private final JsonSupport json;
  private final MetricsPort metrics;
  private final int pageLimit;
  private final int maxPages;

  /**
   * Creates a fetcher.
   *
   * @param upstream transport, usually wrapped with retries
   * @param catalog candidate routes
   * @param json JSON helper shared with the page parser
   * @param metrics metrics sink
   * @param pageLimit page size requested from the upstream
   * @param maxPages safety cap on pages read for one collection
   */
  public PaginatedFetcher(
      UpstreamPort upstream,
      StrategyCatalog catalog,
      JsonSupport json,
      MetricsPort metrics,
      int pageLimit,
      int maxPages) {
    this.upstream = Objects.requireNonNull(upstream, "upstream");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.json = Objects.requireNonNull(json, "json");
    this.parser = new PageParser(json);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.pageLimit = (int) Numbers.requireRange("pageLimit", pageLimit, 1, 500);
    this.maxPages = (int) Numbers.requireRange("maxPages", maxPages, 1, 100_000);
  }

  /**
   * Fetches a collection using the catalog's candidates for the scope.
   *
   * @param scope collection to fetch
   * @param credentials caller identity
   * @return records and the strategy that produced them
   * @throws NoRouteAvailableException if no candidate produced an accepted first page
   * @throws InterruptedException if interrupted while waiting on the upstream
   */
  public FetchedCollection fetchCollection(CollectionScope scope, Credentials credentials)
      throws NoRouteAvailableException, InterruptedException {
    return fetch(scope.label(), catalog.candidates(scope), credentials, scope.kind().emptyFirstPageAccepted());
  }

  /**
   * Fetches a collection from an explicit candidate list.
   *
   * @param label collection label for logs and diagnostics
   * @param candidates strategies in priority order
   * @param credentials caller identity
   * @param acceptEmptyFirstPage whether a 2xx empty first page ends the cascade
   * @return records and the strategy that produced them
   * @throws NoRouteAvailableException if no candidate produced an accepted first page
   * @throws InterruptedException if interrupted while waiting on the upstream
   */
  public FetchedCollection fetch(
      String label, List<FetchStrategy> candidates, Credentials credentials, boolean acceptEmptyFirstPage)
      throws NoRouteAvailableException, InterruptedException {
    Map<String, String> headers = RequestHeaders.forCredentials(credentials);
    Map<FetchStrategy, Integer> statuses = new HashMap<>();

    CascadeOutcome<FetchStrategy, Page> outcome = Cascade.firstSuccess(label, candidates, strategy -> {
      UpstreamResponse response = requestPage(label, strategy, headers, 0);
      statuses.put(strategy, response.status());
      if (!response.isSuccess()) {
        log.debug("{}: {} answered {} body={}", label, strategy, response.status(),
            Logs.snippet(response.body(), ERROR_SNIPPET_BYTES));
        return Verdict.reject("HTTP " + response.status());
      }
      Page first = parser.parse(response.body(), 0);
      if (first.isEmpty() && !acceptEmptyFirstPage) {
        return Verdict.reject("empty");
      }
      return Verdict.accept(first);
    });

    for (int i = 0; i < outcome.rejections().size(); i++) {
      metrics.increment("fetch.strategy.failed");
    }
    if (!outcome.succeeded()) {
      List<StrategyAttempt> attempts = new ArrayList<>();
      for (Rejection<FetchStrategy> rejection : outcome.rejections()) {
        Integer status = statuses.get(rejection.candidate());
        attempts.add(new StrategyAttempt(
            rejection.candidate().label(),
            status == null ? OptionalInt.empty() : OptionalInt.of(status),
            rejection.reason()));
      }
      metrics.increment("fetch.collection.noRoute");
      throw new NoRouteAvailableException(label, attempts);
    }

    FetchStrategy locked = outcome.winner().orElseThrow();
    metrics.increment("fetch.strategy.locked");
    log.debug("{}: locked strategy {} after {} rejected candidates", label, locked, outcome.rejections().size());
    return paginate(label, locked, headers, outcome.result().orElseThrow());
  }

  private FetchedCollection paginate(String label, FetchStrategy strategy, Map<String, String> headers, Page first)
      throws InterruptedException {
    List<RawRecord> records = new ArrayList<>(first.items());
    Page page = first;
    int pages = 1;
    long offset = 0;
    boolean truncated = false;
    while (strategy.moreSignal().hasMore(page, pageLimit)) {
      if (pages >= maxPages) {
        log.warn("{}: stopped after {} pages on {} (maxPages reached)", label, pages, strategy);
        truncated = true;
        break;
      }
      offset = nextOffset(page, offset);
      UpstreamResponse response;
      try {
        response = requestPage(label, strategy, headers, offset);
      } catch (IOException ex) {
        log.warn("{}: page at offset {} failed on locked strategy {}: {}; keeping {} records",
            label, offset, strategy, ex.getMessage(), records.size());
        metrics.increment("fetch.page.failed");
        truncated = true;
        break;
      }
      if (!response.isSuccess()) {
        log.warn("{}: page at offset {} answered {} on locked strategy {}; keeping {} records",
            label, offset, response.status(), strategy, records.size());
        log.debug("{}: error body={}", label, Logs.snippet(response.body(), ERROR_SNIPPET_BYTES));
        metrics.increment("fetch.page.failed");
        truncated = true;
        break;
      }
      page = parser.parse(response.body(), records.size());
      records.addAll(page.items());
      pages++;
      log.debug("{}: page {} received {} items (total {})", label, pages, page.items().size(), records.size());
    }
    metrics.observe("fetch.items", records.size());
    log.debug("{}: {} records in {} pages via {}", label, records.size(), pages, strategy);
    return new FetchedCollection(records, strategy, pages, truncated);
  }

  private long nextOffset(Page page, long current) {
    if (page.nextOffset().isPresent() && page.nextOffset().getAsLong() > current) {
      return page.nextOffset().getAsLong();
    }
    return current + page.items().size();
  }

  private UpstreamResponse requestPage(
      String label, FetchStrategy strategy, Map<String, String> headers, long offset)
      throws IOException, InterruptedException {
    metrics.increment("fetch.page.requested");
    UpstreamRequest request;
    if (strategy.convention() == PaginationConvention.QUERY_OFFSET) {
      request = new UpstreamRequest(strategy.method(), withPaging(strategy.uri(), offset), headers, Optional.empty());
    } else {
      Map<String, Object> body = new LinkedHashMap<>(strategy.bodyFields());
      body.put("limit", pageLimit);
      body.put("offset", offset);
      Map<String, String> jsonHeaders = new LinkedHashMap<>(headers);
      jsonHeaders.put("Content-Type", "application/json");
      request = new UpstreamRequest(strategy.method(), strategy.uri(), jsonHeaders, Optional.of(json.write(body)));
    }
    log.debug("{}: {} offset={} limit={}", label, strategy, offset, pageLimit);
    return upstream.send(request);
  }

  private URI withPaging(URI uri, long offset) {
    String separator = uri.getRawQuery() == null ? "?" : "&";
    return URI.create(uri + separator + "limit=" + pageLimit + "&offset=" + offset);
  }
}
