package ca.gc.cra.docket.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docket.application.json.JsonSupport;
import ca.gc.cra.docket.application.port.ExportedTimeline;
import ca.gc.cra.docket.domain.record.CanonicalComment;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.CreatedAt;
import ca.gc.cra.docket.domain.record.EmailHeaders;
import ca.gc.cra.docket.domain.record.ItemKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonTimelineWriterTest {
  private static final Instant GENERATED = Instant.parse("2025-02-01T08:00:00Z");
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path tempDir;

  private final JsonSupport json = new JsonSupport();

  @Test
  void writesHeaderThenOneLinePerItem() throws Exception {
    CanonicalItem note = new CanonicalItem(ItemKind.NOTE, "note:1", "1", CreatedAt.observed(T0), "Ann Lee",
        "Call", "Line one\nLine two", EmailHeaders.EMPTY,
        List.of(new CanonicalComment("comment:c1", CreatedAt.synthesized(GENERATED), "", "Thanks")));
    CanonicalItem email = new CanonicalItem(ItemKind.EMAIL, "email:9", "9", CreatedAt.observed(T0.plusSeconds(60)),
        "ann@x.test", "Status", "<p>Hello</p>",
        new EmailHeaders("ann@x.test", List.of("case@x.test"), List.of()), List.of());
    Path out = tempDir.resolve("out");

    String artifact = new NdjsonTimelineWriter(out).render(new ExportedTimeline("7", GENERATED, List.of(note, email)));

    Path file = out.resolve("project-7-notes-emails-2025-02-01.ndjson");
    assertTrue(Files.isSameFile(file, Path.of(artifact)));
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());

    Map<?, ?> header = (Map<?, ?>) json.parse(lines.get(0));
    assertEquals("timeline", header.get("type"));
    assertEquals("7", header.get("projectId"));
    assertEquals("2025-02-01T08:00:00Z", header.get("generatedAt"));
    assertEquals(2, header.get("itemCount"));

    Map<?, ?> first = (Map<?, ?>) json.parse(lines.get(1));
    assertEquals("Note", first.get("type"));
    assertEquals("Line one\nLine two", first.get("body"));
    assertFalse(first.containsKey("headers"));
    assertFalse(first.containsKey("createdAtSynthesized"));
    Map<?, ?> comment = (Map<?, ?>) ((List<?>) first.get("comments")).get(0);
    assertEquals("comment:c1", comment.get("id"));
    assertEquals(Boolean.TRUE, comment.get("createdAtSynthesized"));

    Map<?, ?> second = (Map<?, ?>) json.parse(lines.get(2));
    assertEquals("Email", second.get("type"));
    assertEquals("2024-05-01T10:01:00Z", second.get("createdAt"));
    Map<?, ?> headers = (Map<?, ?>) second.get("headers");
    assertEquals(List.of("case@x.test"), headers.get("to"));
    assertEquals(List.of(), headers.get("cc"));
  }

  @Test
  void emptyTimelineStillWritesHeaderAndLeavesNoTempFiles() throws Exception {
    new NdjsonTimelineWriter(tempDir).render(new ExportedTimeline("A/B", GENERATED, List.of()));

    try (Stream<Path> files = Files.list(tempDir)) {
      List<Path> names = files.map(Path::getFileName).toList();
      assertEquals(List.of(Path.of("project-A_B-notes-emails-2025-02-01.ndjson")), names);
    }
  }

  @Test
  void unusableOutputDirectoryIsAnIoFailure() throws Exception {
    Path blocker = tempDir.resolve("file.txt");
    Files.writeString(blocker, "x");
    assertThrows(IOException.class,
        () -> new NdjsonTimelineWriter(blocker).render(new ExportedTimeline("7", GENERATED, List.of())));
    assertTrue(Files.isRegularFile(blocker));
  }
}
