package ca.gc.cra.docket.application.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docket.application.json.JsonSupport;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PageParserTest {
  private final PageParser parser = new PageParser(new JsonSupport());

  @Test
  void acceptsRootArray() {
    Page page = parser.parse("[{\"id\":1},{\"id\":2}]", 10);
    assertEquals(2, page.items().size());
    assertEquals(10, page.items().get(0).ordinal());
    assertEquals(11, page.items().get(1).ordinal());
  }

  @Test
  void findsItemsUnderKnownWrappers() {
    assertEquals(1, parser.parse("{\"results\":[{\"id\":1}]}", 0).items().size());
    assertEquals(1, parser.parse("{\"activityItems\":[{\"id\":1}]}", 0).items().size());
    assertEquals(1, parser.parse("{\"page\":{\"items\":[{\"id\":1}]}}", 0).items().size());
    assertEquals(2, parser.parse("{\"data\":{\"items\":[{\"id\":1},{\"id\":2}]}}", 0).items().size());
  }

  @Test
  void readsPagingHints() {
    Page page = parser.parse("{\"items\":[{\"id\":1}],\"paging\":{\"hasMore\":\"true\",\"nextOffset\":\"20\"}}", 0);
    assertEquals(Optional.of(true), page.hasMoreFlag());
    assertEquals(20L, page.nextOffset().getAsLong());
  }

  @Test
  void nonJsonOrUnknownShapeIsEmptyPage() {
    assertTrue(parser.parse("<html>oops</html>", 0).isEmpty());
    assertTrue(parser.parse("{\"count\":3}", 0).isEmpty());
    assertTrue(parser.parse("", 0).isEmpty());
  }

  @Test
  void nonObjectItemsBecomeEmptyRecords() {
    Page page = parser.parse("[1, {\"id\":2}]", 0);
    assertTrue(page.items().get(0).isEmpty());
    assertFalse(page.items().get(1).isEmpty());
  }

  @Test
  void moreSignalRules() {
    Page full = parser.parse("[{\"id\":1},{\"id\":2}]", 0);
    Page flagged = parser.parse("{\"items\":[{\"id\":1}],\"hasMore\":true}", 0);
    Page flaggedEmpty = parser.parse("{\"items\":[],\"hasMore\":true}", 0);

    assertTrue(MoreSignal.FLAG_OR_FULL_PAGE.hasMore(full, 2));
    assertFalse(MoreSignal.FLAG_ONLY.hasMore(full, 2));
    assertTrue(MoreSignal.FLAG_OR_FULL_PAGE.hasMore(flagged, 50));
    assertFalse(MoreSignal.FULL_PAGE.hasMore(flagged, 50));
    assertFalse(MoreSignal.FLAG_OR_FULL_PAGE.hasMore(flaggedEmpty, 50));
  }
}
