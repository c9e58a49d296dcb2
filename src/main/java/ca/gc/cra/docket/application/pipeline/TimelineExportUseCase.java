package ca.gc.cra.docket.application.pipeline;

import ca.gc.cra.docket.application.author.AuthorDirectory;
import ca.gc.cra.docket.application.author.AuthorResolver;
import ca.gc.cra.docket.application.enrich.CommentEnricher;
import ca.gc.cra.docket.application.fetch.CollectionKind;
import ca.gc.cra.docket.application.fetch.CollectionScope;
import ca.gc.cra.docket.application.fetch.FetchedCollection;
import ca.gc.cra.docket.application.fetch.NoRouteAvailableException;
import ca.gc.cra.docket.application.fetch.PaginatedFetcher;
import ca.gc.cra.docket.application.fetch.StrategyCatalog;
import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.application.merge.Fingerprinter;
import ca.gc.cra.docket.application.merge.TimelineMerger;
import ca.gc.cra.docket.application.normalize.RecordNormalizer;
import ca.gc.cra.docket.application.port.ClockPort;
import ca.gc.cra.docket.application.port.ExportedTimeline;
import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.application.port.TimelineRendererPort;
import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.ItemKind;
import ca.gc.cra.docket.domain.record.SourcedItem;
import ca.gc.cra.docket.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.docket.validation.Strings;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one export: fetch notes and e-mails, normalize, resolve authors, attach comments,
 * de-duplicate, order, and hand the timeline to the renderer.
 * <p><strong>Concurrency:</strong> the two top-level collections are fetched as independent tasks on a two-thread
 * pool; comment enrichment runs on its own bounded pool. The run-scoped {@link AuthorDirectory} is the only state
 * shared between tasks.</p>
 * <p><strong>Failure model:</strong> a collection with no usable route contributes zero items and is listed in
 * {@link ExportReport#exhaustedCollections()}, unless it is listed as required, in which case the run aborts with
 * {@link ExportAbortedException} once both fetches have finished. Every other failure degrades locally.</p>
 * <p><strong>Observability:</strong> MDC keys {@code run} and {@code collection}; {@code export.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class TimelineExportUseCase {
  private static final Logger log = LoggerFactory.getLogger(TimelineExportUseCase.class);
  private static final String MDC_RUN = "run";
  private static final String MDC_COLLECTION = "collection";
  private static final List<CollectionKind> TOP_LEVEL = List.of(CollectionKind.NOTES, CollectionKind.EMAILS);

  private final UpstreamPort upstream;
  private final StrategyCatalog catalog;
  private final TimelineRendererPort renderer;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Map<String, String> preloadedAuthors;
  private final ExportSettings settings;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates the use case.
   *
   * @param upstream transport to the record API
   * @param catalog candidate routes
   * @param renderer receiver of the ordered timeline
   * @param clock wall clock for generation time and synthesized timestamps
   * @param metrics metrics sink
   * @param preloadedAuthors static id-to-name table
   * @param settings tuning knobs
   */
  public TimelineExportUseCase(
      UpstreamPort upstream,
      StrategyCatalog catalog,
      TimelineRendererPort renderer,
      ClockPort clock,
      MetricsPort metrics,
      Map<String, String> preloadedAuthors,
      ExportSettings settings) {
    this.upstream = Objects.requireNonNull(upstream, "upstream");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.preloadedAuthors = preloadedAuthors == null ? Map.of() : Map.copyOf(preloadedAuthors);
    this.settings = settings == null ? ExportSettings.defaults() : settings;
  }

  /**
   * Exports the timeline of one project.
   *
   * @param projectId project to export
   * @param credentials caller identity
   * @return report describing the exported timeline
   * @throws ExportAbortedException if a required collection had no usable route
   * @throws IOException if the renderer fails
   * @throws InterruptedException if the run is interrupted
   */
  public ExportReport run(String projectId, Credentials credentials)
      throws ExportAbortedException, IOException, InterruptedException {
    String project = Strings.requireNonBlank("projectId", projectId);
    Objects.requireNonNull(credentials, "credentials");
    String runId = UUID.randomUUID().toString().substring(0, 8);
    String previousRun = MDC.get(MDC_RUN);
    MDC.put(MDC_RUN, runId);
    long started = clock.nowMillis();
    try {
      PaginatedFetcher fetcher =
          new PaginatedFetcher(upstream, catalog, json, metrics, settings.pageLimit(), settings.maxPages());
      RecordNormalizer normalizer = new RecordNormalizer(clock, metrics);
      AuthorResolver resolver = new AuthorResolver(upstream, catalog, json, metrics, credentials);
      CommentEnricher enricher =
          new CommentEnricher(fetcher, normalizer, resolver, metrics, credentials, settings.enrichWorkers());
      AuthorDirectory directory = new AuthorDirectory(preloadedAuthors);
      log.info("Export of project {} started ({} preloaded authors)", project, directory.preloadedSize());

      Map<CollectionKind, CollectionOutcome> outcomes = fetchTopLevel(fetcher, project, credentials);
      List<CollectionKind> exhausted = checkOutcomes(outcomes);

      List<SourcedItem> notes = withAuthors(
          normalizer.normalizeAll(outcomes.get(CollectionKind.NOTES).records(), ItemKind.NOTE), resolver, directory);
      List<SourcedItem> emails = withAuthors(
          normalizer.normalizeAll(outcomes.get(CollectionKind.EMAILS).records(), ItemKind.EMAIL), resolver, directory);
      notes = enricher.attachComments(project, notes, directory);

      List<CanonicalItem> combined = new ArrayList<>(notes.size() + emails.size());
      notes.forEach(sourced -> combined.add(sourced.item()));
      emails.forEach(sourced -> combined.add(sourced.item()));
      List<CanonicalItem> ordered = new TimelineMerger(new Fingerprinter(), metrics).mergeAndSort(combined);

      Instant generatedAt = clock.now();
      String artifact = renderer.render(new ExportedTimeline(project, generatedAt, ordered));

      Map<CollectionKind, Integer> fetched = new EnumMap<>(CollectionKind.class);
      outcomes.forEach((kind, outcome) -> fetched.put(kind, outcome.records().size()));
      long elapsed = clock.nowMillis() - started;
      metrics.observe("export.latencyMillis", elapsed);
      log.info("Export of project {} finished: {} notes, {} emails, {} timeline items, {} duplicates dropped in {} ms",
          project, notes.size(), emails.size(), ordered.size(), combined.size() - ordered.size(), elapsed);
      return new ExportReport(runId, project, generatedAt, ordered, fetched, exhausted,
          combined.size() - ordered.size(), artifact);
    } finally {
      if (previousRun == null) {
        MDC.remove(MDC_RUN);
      } else {
        MDC.put(MDC_RUN, previousRun);
      }
    }
  }

  private Map<CollectionKind, CollectionOutcome> fetchTopLevel(
      PaginatedFetcher fetcher, String projectId, Credentials credentials) throws InterruptedException {
    Map<String, String> context = MDC.getCopyOfContextMap();
    ExecutorService pool = ExecutorFactories.newWorkerPool(TOP_LEVEL.size(), "docket-fetch");
    try {
      Map<CollectionKind, Future<CollectionOutcome>> futures = new EnumMap<>(CollectionKind.class);
      for (CollectionKind kind : TOP_LEVEL) {
        Callable<CollectionOutcome> task = () -> fetchOne(fetcher, kind, projectId, credentials, context);
        futures.put(kind, pool.submit(task));
      }
      Map<CollectionKind, CollectionOutcome> outcomes = new EnumMap<>(CollectionKind.class);
      for (Map.Entry<CollectionKind, Future<CollectionOutcome>> entry : futures.entrySet()) {
        outcomes.put(entry.getKey(), await(entry.getValue()));
      }
      return outcomes;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Collection fetch interrupted; requesting shutdown");
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
    }
  }

  private CollectionOutcome fetchOne(
      PaginatedFetcher fetcher,
      CollectionKind kind,
      String projectId,
      Credentials credentials,
      Map<String, String> context) throws InterruptedException {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (context != null) {
      MDC.setContextMap(context);
    }
    MDC.put(MDC_COLLECTION, kind.plural());
    try {
      FetchedCollection fetched = fetcher.fetchCollection(CollectionScope.project(kind, projectId), credentials);
      log.info("Fetched {} {} via {} ({} pages{})", fetched.records().size(), kind.plural(), fetched.strategy(),
          fetched.pages(), fetched.truncated() ? ", truncated" : "");
      return CollectionOutcome.fetched(kind, fetched);
    } catch (NoRouteAvailableException ex) {
      log.warn("{}", ex.getMessage());
      return CollectionOutcome.noRoute(kind, ex);
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private static CollectionOutcome await(Future<CollectionOutcome> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Collection fetch failed", cause);
    }
  }

  private List<CollectionKind> checkOutcomes(Map<CollectionKind, CollectionOutcome> outcomes)
      throws ExportAbortedException {
    List<CollectionKind> exhausted = new ArrayList<>();
    for (CollectionKind kind : TOP_LEVEL) {
      CollectionOutcome outcome = outcomes.get(kind);
      if (!outcome.exhausted()) {
        continue;
      }
      NoRouteAvailableException failure = outcome.failure().orElseThrow();
      if (settings.requiredCollections().contains(kind)) {
        log.error("Required collection {} has no usable route; aborting export", kind.plural());
        throw new ExportAbortedException(failure);
      }
      log.warn("Collection {} contributes no items to the timeline", kind.plural());
      exhausted.add(kind);
    }
    return exhausted;
  }

  private static List<SourcedItem> withAuthors(
      List<SourcedItem> items, AuthorResolver resolver, AuthorDirectory directory) throws InterruptedException {
    List<SourcedItem> out = new ArrayList<>(items.size());
    for (SourcedItem sourced : items) {
      String author = resolver.resolveAuthor(sourced.raw(), directory);
      out.add(sourced.withItem(sourced.item().withAuthor(author)));
    }
    return out;
  }
}
