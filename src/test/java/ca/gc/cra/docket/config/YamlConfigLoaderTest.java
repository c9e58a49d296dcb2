package ca.gc.cra.docket.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws Exception {
    Map<String, String> map = YamlConfigLoader.load(fixture("fixtures/export.yaml"), "export").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("/v2", map.get("apiPrefix"));
    assertEquals("25", map.get("pageLimit"));
    assertEquals("notes", map.get("requiredCollections"));
    assertEquals("staging", map.get("upstream.label"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("docket.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          retries: 1
        export:
          retries: 4
          requiredCollections:
            - notes
            - emails
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "export").orElseThrow();
    assertEquals("4", map.get("retries"));
    assertEquals("notes,emails", map.get("requiredCollections"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "export");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentIsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertTrue(YamlConfigLoader.load(yaml, "export").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path rootList = tempDir.resolve("list.yaml");
    Files.writeString(rootList, "- export\n");
    Path nestedList = tempDir.resolve("nested.yaml");
    Files.writeString(nestedList, """
        export:
          requiredCollections:
            - [notes]
        """);
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "export: [\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(rootList, "export"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "export"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "export"));
  }

  private static Path fixture(String name) throws URISyntaxException {
    return Path.of(YamlConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
  }
}
