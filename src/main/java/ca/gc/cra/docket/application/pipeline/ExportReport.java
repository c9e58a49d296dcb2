package ca.gc.cra.docket.application.pipeline;

import ca.gc.cra.docket.application.fetch.CollectionKind;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of a completed export.
 *
 * @param runId short identifier also used as the {@code run} MDC value
 * @param projectId exported project
 * @param generatedAt generation timestamp handed to the renderer
 * @param items final ordered timeline
 * @param fetched raw record count per top-level collection
 * @param exhaustedCollections collections that had no usable route and contributed no items
 * @param duplicatesDropped items removed by de-duplication
 * @param artifact location reported by the renderer
 * @since 0.1.0
 */
public record ExportReport(
    String runId,
    String projectId,
    Instant generatedAt,
    List<CanonicalItem> items,
    Map<CollectionKind, Integer> fetched,
    List<CollectionKind> exhaustedCollections,
    int duplicatesDropped,
    String artifact) {

  public ExportReport {
    items = List.copyOf(items);
    fetched = Map.copyOf(fetched);
    exhaustedCollections = List.copyOf(exhaustedCollections);
    artifact = artifact == null ? "" : artifact;
  }

  /** Whether any collection was exhausted; the timeline is then complete only for the others. */
  public boolean degraded() {
    return !exhaustedCollections.isEmpty();
  }
}
