package ca.gc.cra.docket.application.merge;

import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.ItemKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Collapses cross-type duplicates and orders the timeline chronologically.
 * <p><strong>Dedup:</strong> items are visited in input order; an item colliding with an earlier kept item is
 * dropped, except that an e-mail takes over the slot of a colliding note. Fields are never merged.</p>
 * <p><strong>Order:</strong> ascending {@code createdAt}; equal timestamps keep their relative input order.</p>
 * <p><strong>Purity:</strong> deterministic function of its input; the only side effect is the
 * {@code merge.duplicates.dropped} counter.</p>
 *
 * @since 0.1.0
 */
public final class TimelineMerger {
  private static final Logger log = LoggerFactory.getLogger(TimelineMerger.class);

  private final Fingerprinter fingerprinter;
  private final MetricsPort metrics;

  public TimelineMerger(Fingerprinter fingerprinter, MetricsPort metrics) {
    this.fingerprinter = fingerprinter == null ? new Fingerprinter() : fingerprinter;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public TimelineMerger() {
    this(new Fingerprinter(), MetricsPort.NO_OP);
  }

  /**
   * De-duplicates and sorts.
   *
   * @param items items in input order (notes, then e-mails)
   * @return de-duplicated items ordered by creation time
   */
  public List<CanonicalItem> mergeAndSort(List<CanonicalItem> items) {
    List<CanonicalItem> kept = dedupe(items);
    kept.sort(Comparator.comparing(CanonicalItem::createdAt));
    return List.copyOf(kept);
  }

  /**
   * De-duplicates without reordering.
   *
   * @param items items in input order
   * @return kept items in first-seen slot order
   */
  public List<CanonicalItem> dedupe(List<CanonicalItem> items) {
    List<CanonicalItem> slots = new ArrayList<>(items.size());
    List<Fingerprint> prints = new ArrayList<>(items.size());
    Map<String, List<Integer>> slotsByContent = new HashMap<>();
    int dropped = 0;
    for (CanonicalItem item : items) {
      Fingerprint print = fingerprinter.fingerprint(item);
      List<Integer> sameContent = slotsByContent.computeIfAbsent(print.content(), key -> new ArrayList<>());
      Integer hit = null;
      for (Integer slot : sameContent) {
        if (prints.get(slot).collidesWith(print)) {
          hit = slot;
          break;
        }
      }
      if (hit == null) {
        sameContent.add(slots.size());
        slots.add(item);
        prints.add(print);
        continue;
      }
      dropped++;
      CanonicalItem existing = slots.get(hit);
      if (existing.kind() == ItemKind.NOTE && item.kind() == ItemKind.EMAIL) {
        log.debug("Email {} replaces duplicate note {}", item.id(), existing.id());
        slots.set(hit, item);
        prints.set(hit, print);
      } else {
        log.debug("Dropping {} as duplicate of {}", item.id(), existing.id());
      }
    }
    if (dropped > 0) {
      metrics.observe("merge.duplicates.dropped", dropped);
    }
    return slots;
  }
}
