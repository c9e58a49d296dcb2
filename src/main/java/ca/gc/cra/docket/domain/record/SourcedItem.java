package ca.gc.cra.docket.domain.record;

import java.util.Objects;

/**
 * Pairs a canonical item with the raw record it was normalized from.
 *
 * <p>Author resolution and comment enrichment still need upstream fields (creator links, embedded
 * comment arrays) that the canonical shape deliberately drops.</p>
 *
 * @param raw upstream payload
 * @param item canonical view
 * @since 0.1.0
 */
public record SourcedItem(RawRecord raw, CanonicalItem item) {

  public SourcedItem {
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(item, "item");
  }

  /**
   * Replaces the canonical view while keeping the raw payload.
   *
   * @param updated new canonical view
   * @return updated pair
   */
  public SourcedItem withItem(CanonicalItem updated) {
    return new SourcedItem(raw, updated);
  }
}
