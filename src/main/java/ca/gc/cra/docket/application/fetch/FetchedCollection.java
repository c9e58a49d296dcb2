package ca.gc.cra.docket.application.fetch;

import ca.gc.cra.docket.domain.record.RawRecord;
import java.util.List;
import java.util.Objects;

/**
 * Records of one collection together with the strategy that produced them.
 *
 * @param records concatenated page items in upstream order
 * @param strategy locked-in strategy
 * @param pages number of pages read
 * @param truncated whether pagination stopped early (page cap or a failing later page)
 * @since 0.1.0
 */
public record FetchedCollection(List<RawRecord> records, FetchStrategy strategy, int pages, boolean truncated) {

  public FetchedCollection {
    records = records == null ? List.of() : List.copyOf(records);
    Objects.requireNonNull(strategy, "strategy");
  }
}
