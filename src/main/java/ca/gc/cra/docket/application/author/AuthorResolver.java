package ca.gc.cra.docket.application.author;

import ca.gc.cra.docket.application.cascade.Cascade;
import ca.gc.cra.docket.application.cascade.CascadeOutcome;
import ca.gc.cra.docket.application.cascade.Verdict;
import ca.gc.cra.docket.application.fetch.RequestHeaders;
import ca.gc.cra.docket.application.fetch.StrategyCatalog;
import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.application.normalize.Identifiers;
import ca.gc.cra.docket.application.normalize.ProbeTable;
import ca.gc.cra.docket.application.normalize.TextNormalizer;
import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.application.port.UpstreamRequest;
import ca.gc.cra.docket.application.port.UpstreamResponse;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.domain.record.RawRecord;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a human-readable author for a record or comment.
 * <p><strong>Cascade:</strong> inline name fields, then the static directory by creator id, then the creator link
 * (one remote fetch per distinct target), then a direct {@code /users/{id}} lookup (one per distinct id). The
 * first non-empty name wins.</p>
 * <p><strong>Failure model:</strong> network errors and non-2xx answers fall through to the next step; when every
 * step fails the author is the empty string, which is a valid result.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; shared state lives in the {@link AuthorDirectory}.</p>
 * <p><strong>Observability:</strong> {@code author.resolved.<step>}, {@code author.unresolved},
 * {@code author.remote.calls}.</p>
 *
 * @since 0.1.0
 */
public final class AuthorResolver {
  private static final Logger log = LoggerFactory.getLogger(AuthorResolver.class);

  /** Resolution steps in cascade order. */
  public enum Step {
    INLINE,
    DIRECTORY,
    LINK,
    LOOKUP;

    String metric() {
      return "author.resolved." + name().toLowerCase(Locale.ROOT);
    }
  }

  private static final List<Step> STEPS = List.of(Step.values());

  static final ProbeTable<String> INLINE_NAME = ProbeTable.of("author.name", TextNormalizer::text,
          "createdBy.name", "author.name", "user.name", "from.name", "sender.name", "createdByName",
          "authorName", "creatorName", "createdByFullName", "ownerName")
      .then(ProbeTable.of("author.plain", AuthorResolver::nonNumericText,
          "createdBy", "author", "user", "from", "sender"))
      .then(ProbeTable.of("author.person", NameExtractor::fromPerson,
          "createdBy", "author", "user", "from", "sender", "owner", "creator"))
      .then(ProbeTable.of("author.email", TextNormalizer::text,
          "from.email", "sender.email", "createdBy.email", "author.email"));

  static final ProbeTable<String> CREATOR_ID = ProbeTable.of("author.id", Identifiers::scalar,
          "createdById.native", "createdById", "createdBy.id.native", "createdBy.id", "authorId.native",
          "authorId", "userId")
      .then(ProbeTable.of("author.numericPlain", AuthorResolver::numericText, "createdBy"));

  static final ProbeTable<String> CREATOR_LINK = ProbeTable.of("author.link", TextNormalizer::text,
      "_links.createdBy.href", "links.createdBy.href", "links.createdBy", "_links.author.href",
      "links.author.href", "createdBy.href");

  private final UpstreamPort upstream;
  private final StrategyCatalog catalog;
  private final JsonSupport json;
  private final MetricsPort metrics;
  private final Map<String, String> headers;

  /**
   * Creates a resolver.
   *
   * @param upstream transport for link and lookup calls
   * @param catalog route builder for links and {@code /users/{id}}
   * @param json JSON helper
   * @param metrics metrics sink
   * @param credentials caller identity used on remote calls
   */
  public AuthorResolver(
      UpstreamPort upstream,
      StrategyCatalog catalog,
      JsonSupport json,
      MetricsPort metrics,
      Credentials credentials) {
    this.upstream = Objects.requireNonNull(upstream, "upstream");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.headers = RequestHeaders.forCredentials(Objects.requireNonNull(credentials, "credentials"));
  }

  /**
   * Resolves the author of a record.
   *
   * @param record upstream record (note, e-mail, or comment)
   * @param directory run-scoped directory and caches
   * @return author name; empty when unknown
   * @throws InterruptedException if interrupted while waiting on a remote lookup
   */
  public String resolveAuthor(RawRecord record, AuthorDirectory directory) throws InterruptedException {
    Map<String, Object> fields = record.fields();
    Optional<String> creatorId = CREATOR_ID.firstMatch(fields);
    CascadeOutcome<Step, String> outcome = Cascade.firstSuccess("author", STEPS, step -> {
      Optional<String> name = switch (step) {
        case INLINE -> INLINE_NAME.firstMatch(fields);
        case DIRECTORY -> creatorId.flatMap(directory::preloaded);
        case LINK -> resolveLink(fields, directory);
        case LOOKUP -> resolveLookup(creatorId, directory);
      };
      if (name.isPresent()) {
        return Verdict.accept(name.get());
      }
      return Verdict.reject("no name");
    });
    Optional<Step> winner = outcome.winner();
    if (winner.isEmpty()) {
      metrics.increment("author.unresolved");
      log.debug("Author unresolved for record #{} (creator id {})", record.ordinal(), creatorId.orElse("none"));
      return "";
    }
    metrics.increment(winner.get().metric());
    return outcome.result().orElse("");
  }

  private Optional<String> resolveLink(Map<String, Object> fields, AuthorDirectory directory)
      throws InterruptedException {
    Optional<URI> target = CREATOR_LINK.firstMatch(fields).flatMap(href -> catalog.absolutize(href, catalog.apiRoot()));
    if (target.isEmpty()) {
      return Optional.empty();
    }
    URI uri = target.get();
    return directory.byLink(uri.toString(), () -> fetchName(uri));
  }

  private Optional<String> resolveLookup(Optional<String> creatorId, AuthorDirectory directory)
      throws InterruptedException {
    if (creatorId.isEmpty()) {
      return Optional.empty();
    }
    String id = creatorId.get();
    return directory.byLookup(id, () -> fetchName(catalog.userLookup(id)));
  }

  private Optional<String> fetchName(URI uri) throws InterruptedException {
    metrics.increment("author.remote.calls");
    UpstreamResponse response;
    try {
      response = upstream.send(UpstreamRequest.get(uri, headers));
    } catch (IOException ex) {
      log.debug("Author lookup {} failed: {}", uri, ex.getMessage());
      return Optional.empty();
    }
    if (!response.isSuccess()) {
      log.debug("Author lookup {} answered {}", uri, response.status());
      return Optional.empty();
    }
    return json.tryParse(response.body()).flatMap(NameExtractor::fromUserPayload);
  }

  private static Optional<String> nonNumericText(Object value) {
    return TextNormalizer.text(value).filter(text -> !Identifiers.isNumeric(text));
  }

  private static Optional<String> numericText(Object value) {
    return Identifiers.scalar(value).filter(Identifiers::isNumeric);
  }
}
