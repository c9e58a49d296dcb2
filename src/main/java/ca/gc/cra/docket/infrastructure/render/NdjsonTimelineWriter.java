package ca.gc.cra.docket.infrastructure.render;

import ca.gc.cra.docket.application.port.ExportedTimeline;
import ca.gc.cra.docket.application.port.TimelineRendererPort;
import ca.gc.cra.docket.domain.record.CanonicalComment;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.CreatedAt;
import ca.gc.cra.docket.domain.record.EmailHeaders;
import ca.gc.cra.docket.validation.Paths;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TimelineRendererPort} writing the ordered timeline as newline-delimited JSON.
 * <p><strong>Format:</strong> one header line ({@code type=timeline}, project, generation time, item count), then
 * one line per item in timeline order with its comments nested. Synthesized timestamps carry
 * {@code createdAtSynthesized=true}.</p>
 * <p><strong>Output:</strong> {@code project-{id}-notes-emails-{yyyy-MM-dd}.ndjson} in the output directory,
 * written to a temporary sibling and moved into place.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonTimelineWriter implements TimelineRendererPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonTimelineWriter.class);
  private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

  private final Path outDir;
  private final JsonFactory factory = new JsonFactory();

  /**
   * Creates a writer.
   *
   * @param outDir output directory; created when missing
   */
  public NdjsonTimelineWriter(Path outDir) {
    this.outDir = Objects.requireNonNull(outDir, "outDir");
  }

  @Override
  public String render(ExportedTimeline timeline) throws IOException {
    Path dir;
    try {
      dir = Paths.validateWritableDir(outDir, true);
    } catch (IllegalArgumentException ex) {
      throw new IOException("output directory unusable: " + ex.getMessage(), ex);
    }
    Path target = dir.resolve(fileName(timeline));
    Path temp = Files.createTempFile(dir, ".timeline-", ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
        generator.setRootValueSeparator(null);
        writeHeader(generator, timeline);
        for (CanonicalItem item : timeline.items()) {
          writeItem(generator, item);
        }
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.info("Wrote {} timeline items to {}", timeline.items().size(), target);
    return target.toString();
  }

  static String fileName(ExportedTimeline timeline) {
    String safeId = timeline.projectId().replaceAll("[^A-Za-z0-9_-]", "_");
    return "project-" + safeId + "-notes-emails-" + DAY.format(timeline.generatedAt()) + ".ndjson";
  }

  private static void writeHeader(JsonGenerator generator, ExportedTimeline timeline) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("type", "timeline");
    generator.writeStringField("projectId", timeline.projectId());
    generator.writeStringField("generatedAt", timeline.generatedAt().toString());
    generator.writeNumberField("itemCount", timeline.items().size());
    generator.writeEndObject();
    generator.writeRaw('\n');
  }

  private static void writeItem(JsonGenerator generator, CanonicalItem item) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("type", item.kind().label());
    generator.writeStringField("id", item.id());
    writeCreatedAt(generator, item.createdAt());
    generator.writeStringField("author", item.author());
    generator.writeStringField("title", item.title());
    generator.writeStringField("body", item.body());
    EmailHeaders headers = item.headers();
    if (!headers.isEmpty()) {
      generator.writeObjectFieldStart("headers");
      generator.writeStringField("from", headers.from());
      writeStrings(generator, "to", headers.to());
      writeStrings(generator, "cc", headers.cc());
      generator.writeEndObject();
    }
    generator.writeArrayFieldStart("comments");
    for (CanonicalComment comment : item.comments()) {
      generator.writeStartObject();
      generator.writeStringField("id", comment.id());
      writeCreatedAt(generator, comment.createdAt());
      generator.writeStringField("author", comment.author());
      generator.writeStringField("body", comment.body());
      generator.writeEndObject();
    }
    generator.writeEndArray();
    generator.writeEndObject();
    generator.writeRaw('\n');
  }

  private static void writeCreatedAt(JsonGenerator generator, CreatedAt createdAt) throws IOException {
    generator.writeStringField("createdAt", createdAt.instant().toString());
    if (createdAt.synthesized()) {
      generator.writeBooleanField("createdAtSynthesized", true);
    }
  }

  private static void writeStrings(JsonGenerator generator, String field, List<String> values) throws IOException {
    generator.writeArrayFieldStart(field);
    for (String value : values) {
      generator.writeString(value);
    }
    generator.writeEndArray();
  }
}
