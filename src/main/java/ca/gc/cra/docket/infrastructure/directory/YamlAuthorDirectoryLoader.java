package ca.gc.cra.docket.infrastructure.directory;

import ca.gc.cra.docket.application.author.NameExtractor;
import ca.gc.cra.docket.validation.Paths;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the static id-to-name author table.
 *
 * <p>Accepted shapes: a {@code users} mapping, or a flat mapping at the root. Values are either display names or
 * person objects, which are reduced to a name the same way remote user payloads are:</p>
 *
 * <pre>
 * users:
 *   "1001": Jane Smith
 *   "1002": { firstName: Raj, lastName: Patel }
 * </pre>
 *
 * @since 0.1.0
 */
public final class YamlAuthorDirectoryLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlAuthorDirectoryLoader.class);

  private YamlAuthorDirectoryLoader() {}

  /**
   * Reads the table at {@code path}.
   *
   * @param path YAML file
   * @return unmodifiable id-to-name map in file order; entries without a usable name are skipped
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the file is missing or not a YAML mapping
   */
  public static Map<String, String> load(Path path) throws IOException {
    Path file = Paths.requireReadableFile(path);
    Object document;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse author directory at " + file, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("author directory " + file + " must be a mapping");
    }
    Object users = root.get("users");
    Map<?, ?> entries;
    if (users == null) {
      entries = root;
    } else if (users instanceof Map<?, ?> nested) {
      entries = nested;
    } else {
      throw new IllegalArgumentException("users section of " + file + " must be a mapping");
    }

    Map<String, String> table = new LinkedHashMap<>();
    int skipped = 0;
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String id = entry.getKey() == null ? "" : entry.getKey().toString().trim();
      Optional<String> name = nameOf(entry.getValue());
      if (id.isEmpty() || name.isEmpty()) {
        skipped++;
        continue;
      }
      table.put(id, name.get());
    }
    if (skipped > 0) {
      log.warn("Skipped {} author directory entries without an id or name in {}", skipped, file);
    }
    log.info("Loaded {} authors from {}", table.size(), file);
    return Collections.unmodifiableMap(table);
  }

  private static Optional<String> nameOf(Object value) {
    if (value instanceof Map<?, ?>) {
      return NameExtractor.fromPerson(value).or(() -> NameExtractor.fromUserPayload(value));
    }
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }
}
