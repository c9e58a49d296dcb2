package ca.gc.cra.docket.application.enrich;

import ca.gc.cra.docket.application.author.AuthorDirectory;
import ca.gc.cra.docket.application.author.AuthorResolver;
import ca.gc.cra.docket.application.fetch.CollectionScope;
import ca.gc.cra.docket.application.fetch.FetchedCollection;
import ca.gc.cra.docket.application.fetch.NoRouteAvailableException;
import ca.gc.cra.docket.application.fetch.PaginatedFetcher;
import ca.gc.cra.docket.application.normalize.ProbeTable;
import ca.gc.cra.docket.application.normalize.RecordNormalizer;
import ca.gc.cra.docket.application.normalize.TextNormalizer;
import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.domain.record.CanonicalComment;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.ItemKind;
import ca.gc.cra.docket.domain.record.RawRecord;
import ca.gc.cra.docket.domain.record.SourcedItem;
import ca.gc.cra.docket.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.docket.validation.Numbers;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Attaches comments to notes using a fixed-size worker pool, one task per note.
 * <p><strong>Sources:</strong> comments embedded in the note record are used directly; otherwise the comment
 * collection is fetched through the {@link PaginatedFetcher} cascade, then normalized and author-resolved.</p>
 * <p><strong>Failure model:</strong> a failure while enriching one note leaves that note with no comments and
 * never affects sibling notes.</p>
 * <p><strong>Observability:</strong> MDC key {@code note} on worker threads; {@code enrich.comments.embedded},
 * {@code enrich.comments.fetched}, {@code enrich.comments.failed}.</p>
 *
 * @since 0.1.0
 */
public final class CommentEnricher {
  private static final Logger log = LoggerFactory.getLogger(CommentEnricher.class);
  private static final String MDC_NOTE = "note";

  static final ProbeTable<List<?>> EMBEDDED = ProbeTable.of("comments.embedded", CommentEnricher::nonEmptyList,
      "comments", "replies", "commentItems", "noteComments", "thread.comments");
  static final ProbeTable<String> COMMENTS_LINK = ProbeTable.of("comments.link", TextNormalizer::text,
      "_links.comments.href", "links.comments.href", "links.comments", "commentsLink", "commentsUrl");

  private final PaginatedFetcher fetcher;
  private final RecordNormalizer normalizer;
  private final AuthorResolver resolver;
  private final MetricsPort metrics;
  private final Credentials credentials;
  private final int workers;

  /**
   * Creates an enricher.
   *
   * @param fetcher fetcher used for the comment cascade
   * @param normalizer comment normalizer
   * @param resolver author resolver for comments
   * @param metrics metrics sink
   * @param credentials caller identity
   * @param workers worker pool size (1..32)
   */
  public CommentEnricher(
      PaginatedFetcher fetcher,
      RecordNormalizer normalizer,
      AuthorResolver resolver,
      MetricsPort metrics,
      Credentials credentials,
      int workers) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.workers = (int) Numbers.requireRange("enrichWorkers", workers, 1, 32);
  }

  /**
   * Returns the items with comments attached to every note, preserving order.
   *
   * @param projectId project the notes belong to
   * @param items normalized items; e-mails pass through untouched
   * @param directory run-scoped author directory
   * @return items in the same order, notes carrying their comments
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public List<SourcedItem> attachComments(String projectId, List<SourcedItem> items, AuthorDirectory directory)
      throws InterruptedException {
    ExecutorService pool = ExecutorFactories.newWorkerPool(workers, "docket-enrich");
    try {
      Map<String, String> context = MDC.getCopyOfContextMap();
      List<Future<List<CanonicalComment>>> futures = new ArrayList<>(items.size());
      for (SourcedItem item : items) {
        if (item.item().kind() != ItemKind.NOTE) {
          futures.add(null);
          continue;
        }
        Callable<List<CanonicalComment>> task = () -> commentsFor(projectId, item, directory, context);
        futures.add(pool.submit(task));
      }
      List<SourcedItem> out = new ArrayList<>(items.size());
      for (int i = 0; i < items.size(); i++) {
        SourcedItem item = items.get(i);
        Future<List<CanonicalComment>> future = futures.get(i);
        if (future == null) {
          out.add(item);
          continue;
        }
        List<CanonicalComment> comments = await(item.item(), future);
        out.add(item.withItem(item.item().withComments(comments)));
      }
      return out;
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
      throw ex;
    } finally {
      pool.shutdown();
    }
  }

  private List<CanonicalComment> await(CanonicalItem note, Future<List<CanonicalComment>> future)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      metrics.increment("enrich.comments.failed");
      log.warn("Comments for {} dropped after failure: {}", note.id(), cause.toString());
      return List.of();
    }
  }

  private List<CanonicalComment> commentsFor(
      String projectId, SourcedItem sourced, AuthorDirectory directory, Map<String, String> context)
      throws InterruptedException {
    CanonicalItem note = sourced.item();
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (context != null) {
      MDC.setContextMap(context);
    }
    MDC.put(MDC_NOTE, note.id());
    try {
      List<RawRecord> raws = embedded(sourced.raw());
      if (!raws.isEmpty()) {
        metrics.increment("enrich.comments.embedded");
        log.debug("Using {} embedded comments", raws.size());
      } else if (note.sourceId().isEmpty()) {
        log.debug("No source id; skipping comment fetch");
        return List.of();
      } else {
        Optional<FetchedCollection> fetched = fetch(projectId, note, sourced.raw());
        if (fetched.isEmpty()) {
          return List.of();
        }
        raws = fetched.get().records();
        metrics.increment("enrich.comments.fetched");
      }
      return normalize(raws, note.id(), directory);
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private Optional<FetchedCollection> fetch(String projectId, CanonicalItem note, RawRecord raw)
      throws InterruptedException {
    CollectionScope scope = CollectionScope.comments(projectId, note.sourceId(), COMMENTS_LINK.firstMatch(raw.fields()));
    try {
      return Optional.of(fetcher.fetchCollection(scope, credentials));
    } catch (NoRouteAvailableException ex) {
      if (ex.allRejected()) {
        metrics.increment("enrich.comments.failed");
        log.warn("No comment route answered for {}; continuing without comments", note.id());
        log.debug("{}", ex.getMessage());
      } else {
        log.debug("No comments found for {}", note.id());
      }
      return Optional.empty();
    }
  }

  private List<CanonicalComment> normalize(List<RawRecord> raws, String noteId, AuthorDirectory directory)
      throws InterruptedException {
    List<CanonicalComment> out = new ArrayList<>(raws.size());
    Set<String> seen = new HashSet<>();
    for (RawRecord raw : raws) {
      CanonicalComment comment = normalizer.normalizeComment(raw, noteId);
      String id = comment.id();
      int bump = 0;
      while (!seen.add(id)) {
        bump++;
        id = comment.id() + "#" + raw.ordinal() + (bump > 1 ? "." + bump : "");
      }
      String author = resolver.resolveAuthor(raw, directory);
      out.add(new CanonicalComment(id, comment.createdAt(), author, comment.body()));
    }
    return out;
  }

  private static List<RawRecord> embedded(RawRecord raw) {
    List<?> nodes = EMBEDDED.firstMatch(raw.fields()).orElse(List.of());
    List<RawRecord> out = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      RawRecord comment = RawRecord.of(nodes.get(i), i);
      if (!comment.isEmpty()) {
        out.add(comment);
      }
    }
    return out;
  }

  private static Optional<List<?>> nonEmptyList(Object value) {
    if (value instanceof List<?> list && !list.isEmpty()) {
      return Optional.of(list);
    }
    return Optional.empty();
  }
}
