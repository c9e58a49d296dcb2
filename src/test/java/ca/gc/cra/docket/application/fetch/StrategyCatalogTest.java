package ca.gc.cra.docket.application.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StrategyCatalogTest {
  private final StrategyCatalog catalog = new StrategyCatalog("https://api.example.test", "/v2");

  @Test
  void topLevelCandidatesAreRankedGetsThenPosts() {
    List<String> labels = labels(catalog.candidates(CollectionScope.project(CollectionKind.NOTES, "7")));
    assertEquals(List.of(
        "GET /v2/projects/7/notes",
        "GET /v2/projects/7/activity/notes",
        "GET /v2/projects/7/activity?types=note",
        "GET /v2/projects/7/notes/list",
        "POST /v2/projects/7/notes",
        "POST /v2/projects/7/notes/list"), labels);
  }

  @Test
  void commentCandidatesStartWithAdvertisedLink() {
    List<FetchStrategy> candidates =
        catalog.candidates(CollectionScope.comments("7", "55", Optional.of("/notes/55/thread")));
    List<String> labels = labels(candidates);

    assertEquals(11, labels.size());
    assertEquals("GET /v2/notes/55/thread", labels.get(0));
    assertEquals("GET /notes/55/comments", labels.get(1));
    assertEquals("GET /v2/notes/55/comments", labels.get(2));
    assertEquals("GET /v2/projects/7/notes/55/comments", labels.get(3));
    assertEquals("GET /v2/projects/7/comments?parentType=note&parentId=55", labels.get(6));
    assertEquals("GET /v2/projects/7/activity?types=comment&parentType=note&parentId=55", labels.get(10));
    FetchStrategy postComments = candidates.get(8);
    assertEquals("POST /v2/projects/7/comments", postComments.label());
    assertEquals("note", postComments.bodyFields().get("parentType"));
    assertEquals("55", postComments.bodyFields().get("parentId"));
  }

  @Test
  void commentCandidatesWithoutLink() {
    assertEquals(10, catalog.candidates(CollectionScope.comments("7", "55", Optional.empty())).size());
  }

  @Test
  void encodesIdsAsPathSegments() {
    assertEquals("https://api.example.test/v2/users/a%20b%2Fc", catalog.userLookup("a b/c").toString());
  }

  @Test
  void absolutizesLinks() {
    String rel = catalog.projectRoot("7");
    assertEquals("https://other.test/x", catalog.absolutize("https://other.test/x", rel).orElseThrow().toString());
    assertEquals("https://api.example.test/v2/users/1", catalog.absolutize("/users/1", rel).orElseThrow().toString());
    assertEquals("https://api.example.test/v2/users/1",
        catalog.absolutize("/v2/users/1", rel).orElseThrow().toString());
    assertEquals("https://api.example.test/v2/projects/7/users/1",
        catalog.absolutize("users/1", rel).orElseThrow().toString());
    assertTrue(catalog.absolutize(" ", rel).isEmpty());
    assertTrue(catalog.absolutize("/bad path{", rel).isEmpty());
  }

  @Test
  void scopeLabels() {
    assertEquals("emails", CollectionScope.project(CollectionKind.EMAILS, "7").label());
    assertEquals("comments[note:55]", CollectionScope.comments("7", "55", Optional.empty()).label());
    assertThrows(IllegalArgumentException.class, () -> CollectionScope.project(CollectionKind.COMMENTS, "7"));
    assertThrows(IllegalArgumentException.class, () -> CollectionScope.comments("7", " ", Optional.empty()));
  }

  private static List<String> labels(List<FetchStrategy> strategies) {
    return strategies.stream().map(FetchStrategy::label).collect(Collectors.toList());
  }
}
