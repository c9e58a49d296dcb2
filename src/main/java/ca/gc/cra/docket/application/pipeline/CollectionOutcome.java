package ca.gc.cra.docket.application.pipeline;

import ca.gc.cra.docket.application.fetch.CollectionKind;
import ca.gc.cra.docket.application.fetch.FetchedCollection;
import ca.gc.cra.docket.application.fetch.NoRouteAvailableException;
import ca.gc.cra.docket.domain.record.RawRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of fetching one top-level collection: either its records or the exhausted-routes failure.
 *
 * @since 0.1.0
 */
public final class CollectionOutcome {
  private final CollectionKind kind;
  private final FetchedCollection fetched;
  private final NoRouteAvailableException failure;

  private CollectionOutcome(CollectionKind kind, FetchedCollection fetched, NoRouteAvailableException failure) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.fetched = fetched;
    this.failure = failure;
  }

  public static CollectionOutcome fetched(CollectionKind kind, FetchedCollection fetched) {
    return new CollectionOutcome(kind, Objects.requireNonNull(fetched, "fetched"), null);
  }

  public static CollectionOutcome noRoute(CollectionKind kind, NoRouteAvailableException failure) {
    return new CollectionOutcome(kind, null, Objects.requireNonNull(failure, "failure"));
  }

  public CollectionKind kind() {
    return kind;
  }

  public boolean exhausted() {
    return failure != null;
  }

  public Optional<FetchedCollection> collection() {
    return Optional.ofNullable(fetched);
  }

  public Optional<NoRouteAvailableException> failure() {
    return Optional.ofNullable(failure);
  }

  /** Records of the collection; empty when the collection was exhausted. */
  public List<RawRecord> records() {
    return fetched == null ? List.of() : fetched.records();
  }
}
