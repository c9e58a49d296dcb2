package ca.gc.cra.docket.application.enrich;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docket.application.author.AuthorDirectory;
import ca.gc.cra.docket.application.author.AuthorResolver;
import ca.gc.cra.docket.application.fetch.PaginatedFetcher;
import ca.gc.cra.docket.application.fetch.StrategyCatalog;
import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.application.normalize.RecordNormalizer;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.domain.record.CanonicalComment;
import ca.gc.cra.docket.domain.record.ItemKind;
import ca.gc.cra.docket.domain.record.RawRecord;
import ca.gc.cra.docket.domain.record.SourcedItem;
import ca.gc.cra.docket.testutil.FixedClock;
import ca.gc.cra.docket.testutil.RecordingMetricsPort;
import ca.gc.cra.docket.testutil.ScriptedUpstream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class CommentEnricherTest {
  private final ScriptedUpstream upstream = new ScriptedUpstream();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonSupport json = new JsonSupport();
  private final StrategyCatalog catalog = new StrategyCatalog("https://api.example.test", "/v2");
  private final Credentials credentials = new Credentials("tok", "u1", "o1");
  private final RecordNormalizer normalizer =
      new RecordNormalizer(new FixedClock(Instant.parse("2025-01-01T00:00:00Z")), metrics);
  private final CommentEnricher enricher = new CommentEnricher(
      new PaginatedFetcher(upstream, catalog, json, metrics, 50, 100),
      normalizer,
      new AuthorResolver(upstream, catalog, json, metrics, credentials),
      metrics,
      credentials,
      4);

  @Test
  void fetchesCommentsPerNoteAndResolvesAuthors() throws Exception {
    upstream.onJson("GET /notes/55/comments",
        "[{\"id\":\"c1\",\"createdDate\":\"2024-05-02T09:00:00Z\",\"text\":\"First\",\"createdById\":1001},"
            + "{\"id\":\"c2\",\"text\":\"Second\",\"createdBy\":{\"name\":\"Ann Lee\"}}]");

    List<SourcedItem> out = enricher.attachComments("7", items("{\"id\":55,\"text\":\"note\"}"),
        new AuthorDirectory(Map.of("1001", "Jane Smith")));

    List<CanonicalComment> comments = out.get(0).item().comments();
    assertEquals(2, comments.size());
    assertEquals("comment:c1", comments.get(0).id());
    assertEquals("Jane Smith", comments.get(0).author());
    assertEquals("Ann Lee", comments.get(1).author());
    assertEquals("Second", comments.get(1).body());
    assertEquals(1, metrics.count("enrich.comments.fetched"));
  }

  @Test
  void embeddedCommentsSkipTheNetwork() throws Exception {
    List<SourcedItem> out = enricher.attachComments("7",
        items("{\"id\":60,\"thread\":{\"comments\":[{\"id\":\"x\",\"text\":\"inline\"},{}]}}"),
        AuthorDirectory.empty());

    List<CanonicalComment> comments = out.get(0).item().comments();
    assertEquals(1, comments.size());
    assertEquals("inline", comments.get(0).body());
    assertEquals(1, metrics.count("enrich.comments.embedded"));
    assertEquals(0, upstream.count("GET /notes/60/comments"));
  }

  @Test
  void oneFailingNoteNeverAffectsSiblings() throws Exception {
    upstream.onJson("GET /notes/1/comments", "[{\"id\":\"a\",\"text\":\"kept\"}]");
    upstream.on("GET /notes/2/comments", request -> {
      throw new IOException("connection reset");
    });
    upstream.onJson("GET /notes/3/comments", "[{\"id\":\"b\",\"text\":\"also kept\"}]");

    List<SourcedItem> out = enricher.attachComments("7",
        items("{\"id\":1}", "{\"id\":2}", "{\"id\":3}"), AuthorDirectory.empty());

    assertEquals(List.of("note:1", "note:2", "note:3"),
        out.stream().map(s -> s.item().id()).collect(Collectors.toList()));
    assertEquals("kept", out.get(0).item().comments().get(0).body());
    assertTrue(out.get(1).item().comments().isEmpty());
    assertEquals("also kept", out.get(2).item().comments().get(0).body());
    assertEquals(1, metrics.count("enrich.comments.failed"));
  }

  @Test
  void noteWithoutCommentsIsNotAFailure() throws Exception {
    upstream.onJson("GET /notes/9/comments", "[]");

    List<SourcedItem> out = enricher.attachComments("7", items("{\"id\":9}"), AuthorDirectory.empty());

    assertTrue(out.get(0).item().comments().isEmpty());
    assertEquals(0, metrics.count("enrich.comments.failed"));
    assertEquals(1, upstream.requests().size());
  }

  @Test
  void advertisedLinkIsTriedFirst() throws Exception {
    upstream.onJson("GET /v2/notes/12/thread", "{\"items\":[{\"id\":\"t\",\"text\":\"via link\"}]}");

    List<SourcedItem> out = enricher.attachComments("7",
        items("{\"id\":12,\"_links\":{\"comments\":{\"href\":\"/notes/12/thread\"}}}"), AuthorDirectory.empty());

    assertEquals("via link", out.get(0).item().comments().get(0).body());
    assertEquals(1, upstream.requests().size());
  }

  @Test
  void emailsAndAnonymousNotesAreLeftAlone() throws Exception {
    List<SourcedItem> input = new ArrayList<>(items("{\"text\":\"no id\"}"));
    SourcedItem email = normalizer.normalizeAll(List.of(raw("{\"id\":5}", 1)), ItemKind.EMAIL).get(0);
    input.add(email);

    List<SourcedItem> out = enricher.attachComments("7", input, AuthorDirectory.empty());

    assertSame(email, out.get(1));
    assertTrue(out.get(0).item().comments().isEmpty());
    assertEquals(0, upstream.requests().size());
  }

  private List<SourcedItem> items(String... bodies) {
    List<RawRecord> raws = new ArrayList<>();
    for (int i = 0; i < bodies.length; i++) {
      raws.add(raw(bodies[i], i));
    }
    return normalizer.normalizeAll(raws, ItemKind.NOTE);
  }

  private RawRecord raw(String body, int ordinal) {
    return RawRecord.of(json.parse(body), ordinal);
  }
}
