package ca.gc.cra.docket.application.pipeline;

import ca.gc.cra.docket.application.fetch.CollectionKind;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tuning knobs of one export run.
 *
 * @param pageLimit page size requested from the upstream
 * @param maxPages page cap per collection
 * @param enrichWorkers comment enrichment pool size
 * @param requiredCollections collections whose absence aborts the run
 * @since 0.1.0
 */
public record ExportSettings(int pageLimit, int maxPages, int enrichWorkers, Set<CollectionKind> requiredCollections) {

  public ExportSettings {
    requiredCollections = requiredCollections == null || requiredCollections.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(requiredCollections));
  }

  /** Defaults: 50 items per page, 1000 pages, 4 workers, nothing required. */
  public static ExportSettings defaults() {
    return new ExportSettings(50, 1000, 4, Set.of());
  }
}
