package ca.gc.cra.docket.application.author;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.docket.application.fetch.StrategyCatalog;
import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.domain.record.RawRecord;
import ca.gc.cra.docket.testutil.RecordingMetricsPort;
import ca.gc.cra.docket.testutil.ScriptedUpstream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AuthorResolverTest {
  private final ScriptedUpstream upstream = new ScriptedUpstream();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonSupport json = new JsonSupport();
  private final AuthorResolver resolver = new AuthorResolver(
      upstream, new StrategyCatalog("https://api.example.test", "/v2"), json, metrics,
      new Credentials("tok", "u1", "o1"));

  @Test
  void inlineNameWinsWithoutRemoteCalls() throws Exception {
    String author = resolver.resolveAuthor(raw("{\"createdBy\":{\"name\":\"Pat Doe\",\"id\":9}}"),
        AuthorDirectory.empty());

    assertEquals("Pat Doe", author);
    assertEquals(1, metrics.count("author.resolved.inline"));
    assertEquals(0, upstream.requests().size());
  }

  @Test
  void inlinePersonComposesFirstAndLastName() throws Exception {
    String author = resolver.resolveAuthor(raw("{\"author\":{\"firstName\":\"Raj\",\"lastName\":\"Patel\"}}"),
        AuthorDirectory.empty());
    assertEquals("Raj Patel", author);
  }

  @Test
  void directoryHitMakesNoRemoteCall() throws Exception {
    AuthorDirectory directory = new AuthorDirectory(Map.of("1001", "Jane Smith"));

    String author = resolver.resolveAuthor(raw("{\"createdById\":{\"native\":1001}}"), directory);

    assertEquals("Jane Smith", author);
    assertEquals(1, metrics.count("author.resolved.directory"));
    assertEquals(0, metrics.count("author.remote.calls"));
    assertEquals(0, upstream.requests().size());
  }

  @Test
  void numericPlainCreatorIsTreatedAsId() throws Exception {
    AuthorDirectory directory = new AuthorDirectory(Map.of("77", "Lee Wong"));
    assertEquals("Lee Wong", resolver.resolveAuthor(raw("{\"createdBy\":\"77\"}"), directory));
  }

  @Test
  void followsCreatorLinkOncePerTarget() throws Exception {
    upstream.onJson("GET /v2/users/5", "{\"user\":{\"displayName\":\"Sam Roe\"}}");
    AuthorDirectory directory = AuthorDirectory.empty();
    RawRecord record = raw("{\"_links\":{\"createdBy\":{\"href\":\"/users/5\"}}}");

    assertEquals("Sam Roe", resolver.resolveAuthor(record, directory));
    assertEquals("Sam Roe", resolver.resolveAuthor(record, directory));

    assertEquals(1, upstream.count("GET /v2/users/5"));
    assertEquals(2, metrics.count("author.resolved.link"));
    assertEquals("Bearer tok", upstream.requests().get(0).headers().get("Authorization"));
  }

  @Test
  void fallsThroughToUserLookup() throws Exception {
    upstream.onJson("GET /v2/users/404-link", "{}");
    upstream.onJson("GET /v2/users/31", "{\"firstName\":\"Ida\",\"lastName\":\"Chen\"}");

    String author = resolver.resolveAuthor(
        raw("{\"createdById\":31,\"links\":{\"createdBy\":\"/users/404-link\"}}"), AuthorDirectory.empty());

    assertEquals("Ida Chen", author);
    assertEquals(1, metrics.count("author.resolved.lookup"));
    assertEquals(2, metrics.count("author.remote.calls"));
  }

  @Test
  void remoteFailuresLeaveAuthorEmptyAndAreCachedForTheRun() throws Exception {
    upstream.on("GET /v2/users/8", request -> {
      throw new IOException("timeout");
    });
    AuthorDirectory directory = AuthorDirectory.empty();

    assertEquals("", resolver.resolveAuthor(raw("{\"authorId\":8}"), directory));
    assertEquals("", resolver.resolveAuthor(raw("{\"authorId\":8}"), directory));

    assertEquals(1, upstream.count("GET /v2/users/8"));
    assertEquals(2, metrics.count("author.unresolved"));
  }

  @Test
  void recordWithoutAnyAuthorHintIsUnresolvedWithoutCalls() throws Exception {
    assertEquals("", resolver.resolveAuthor(raw("{\"text\":\"hi\"}"), AuthorDirectory.empty()));
    assertEquals(0, upstream.requests().size());
  }

  @Test
  void concurrentLookupsForSameIdShareOneCall() throws Exception {
    upstream.on("GET /v2/users/12", request -> {
      Thread.sleep(100);
      return ScriptedUpstream.ok("{\"displayName\":\"Kim Park\"}");
    });
    AuthorDirectory directory = AuthorDirectory.empty();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(pool.submit(() -> resolver.resolveAuthor(raw("{\"userId\":12}"), directory)));
      }
      for (Future<String> future : futures) {
        assertEquals("Kim Park", future.get(5, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, upstream.count("GET /v2/users/12"));
    assertEquals(1, metrics.count("author.remote.calls"));
  }

  private RawRecord raw(String body) {
    return RawRecord.of(json.parse(body), 0);
  }
}
