package ca.gc.cra.docket.application.port;

import ca.gc.cra.docket.domain.record.CanonicalItem;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ordered timeline handed to a renderer.
 *
 * @param projectId project the timeline belongs to
 * @param generatedAt generation timestamp printed by renderers
 * @param items chronologically ordered, de-duplicated items with nested comments
 * @since 0.1.0
 */
public record ExportedTimeline(String projectId, Instant generatedAt, List<CanonicalItem> items) {

  public ExportedTimeline {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(generatedAt, "generatedAt");
    items = items == null ? List.of() : List.copyOf(items);
  }
}
