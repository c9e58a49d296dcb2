package ca.gc.cra.docket.application.fetch;

import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.application.json.RecordPath;
import ca.gc.cra.docket.domain.record.RawRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Extracts the item array and paging hints from a page body of unknown shape.
 *
 * <p>Accepted shapes: a root array, or an object carrying the array under {@code items}, {@code results},
 * {@code data}, {@code activityItems}, or {@code page.items}. A body that is not JSON is an empty page.</p>
 *
 * @since 0.1.0
 */
public final class PageParser {
  private static final List<RecordPath> ITEM_PATHS = compile(
      "items", "results", "data", "activityItems", "page.items", "data.items");
  private static final List<RecordPath> HAS_MORE_PATHS = compile("hasMore", "page.hasMore", "paging.hasMore");
  private static final List<RecordPath> NEXT_OFFSET_PATHS = compile("nextOffset", "page.nextOffset", "paging.nextOffset");

  private final JsonSupport json;

  public PageParser(JsonSupport json) {
    this.json = json;
  }

  /**
   * Parses one page body.
   *
   * @param body response body
   * @param firstOrdinal collection-wide position of the first item on this page
   * @return parsed page; empty when the body has no recognizable item array
   */
  public Page parse(String body, int firstOrdinal) {
    Optional<Object> root = json.tryParse(body);
    if (root.isEmpty()) {
      return Page.empty();
    }
    Object tree = root.get();
    List<?> array = tree instanceof List<?> list ? list : firstArray(tree);
    List<RawRecord> items = new ArrayList<>(array.size());
    int ordinal = firstOrdinal;
    for (Object node : array) {
      items.add(RawRecord.of(node, ordinal++));
    }
    return new Page(items, hasMore(tree), nextOffset(tree));
  }

  private static List<?> firstArray(Object tree) {
    for (RecordPath path : ITEM_PATHS) {
      Optional<Object> value = path.read(tree);
      if (value.isPresent() && value.get() instanceof List<?> list) {
        return list;
      }
    }
    return List.of();
  }

  private static Optional<Boolean> hasMore(Object tree) {
    for (RecordPath path : HAS_MORE_PATHS) {
      Optional<Object> value = path.read(tree);
      if (value.isPresent()) {
        Object raw = value.get();
        if (raw instanceof Boolean flag) {
          return Optional.of(flag);
        }
        if (raw instanceof String text) {
          return Optional.of(Boolean.parseBoolean(text.trim()));
        }
      }
    }
    return Optional.empty();
  }

  private static OptionalLong nextOffset(Object tree) {
    for (RecordPath path : NEXT_OFFSET_PATHS) {
      Optional<Object> value = path.read(tree);
      if (value.isPresent()) {
        Object raw = value.get();
        if (raw instanceof Number number) {
          return OptionalLong.of(number.longValue());
        }
        if (raw instanceof String text && !text.isBlank()) {
          try {
            return OptionalLong.of(Long.parseLong(text.trim()));
          } catch (NumberFormatException ignored) {
            return OptionalLong.empty();
          }
        }
      }
    }
    return OptionalLong.empty();
  }

  private static List<RecordPath> compile(String... expressions) {
    List<RecordPath> out = new ArrayList<>(expressions.length);
    for (String expression : expressions) {
      out.add(RecordPath.compile(expression));
    }
    return List.copyOf(out);
  }
}
