package ca.gc.cra.docket.application.fetch;

import ca.gc.cra.docket.domain.record.RawRecord;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One parsed page of an upstream collection.
 *
 * @param items records in upstream order
 * @param hasMoreFlag explicit "more pages" flag when the upstream sent one
 * @param nextOffset explicit next cursor when the upstream sent one
 * @since 0.1.0
 */
public record Page(List<RawRecord> items, Optional<Boolean> hasMoreFlag, OptionalLong nextOffset) {

  public Page {
    items = items == null ? List.of() : List.copyOf(items);
    hasMoreFlag = hasMoreFlag == null ? Optional.empty() : hasMoreFlag;
    nextOffset = nextOffset == null ? OptionalLong.empty() : nextOffset;
  }

  /** Page with no items and no paging hints. */
  public static Page empty() {
    return new Page(List.of(), Optional.empty(), OptionalLong.empty());
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
