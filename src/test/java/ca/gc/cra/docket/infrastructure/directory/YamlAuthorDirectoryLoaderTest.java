package ca.gc.cra.docket.infrastructure.directory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlAuthorDirectoryLoaderTest {
  @TempDir Path tempDir;

  @Test
  void loadsUsersSectionWithNamesAndPersonObjects() throws Exception {
    Map<String, String> table = YamlAuthorDirectoryLoader.load(fixture("fixtures/authors.yaml"));

    assertEquals(Map.of("1001", "Jane Smith", "1002", "Raj Patel", "1003", "Case Bot"), table);
    assertEquals(List.of("1001", "1002", "1003"), List.copyOf(table.keySet()));
  }

  @Test
  void acceptsFlatRootMappingWithNumericKeys() throws Exception {
    Path file = tempDir.resolve("flat.yaml");
    Files.writeString(file, "42: Lee Wong\n43:\n  fullName: Ida Chen\n");

    assertEquals(Map.of("42", "Lee Wong", "43", "Ida Chen"), YamlAuthorDirectoryLoader.load(file));
  }

  @Test
  void emptyDocumentYieldsEmptyTable() throws Exception {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "");
    assertTrue(YamlAuthorDirectoryLoader.load(file).isEmpty());
  }

  @Test
  void rejectsNonMappingDocuments() throws Exception {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, "- a\n- b\n");
    Path badUsers = tempDir.resolve("users.yaml");
    Files.writeString(badUsers, "users: nobody\n");
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "users: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlAuthorDirectoryLoader.load(list));
    assertThrows(IllegalArgumentException.class, () -> YamlAuthorDirectoryLoader.load(badUsers));
    assertThrows(IllegalArgumentException.class, () -> YamlAuthorDirectoryLoader.load(broken));
  }

  @Test
  void missingFileIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlAuthorDirectoryLoader.load(tempDir.resolve("absent.yaml")));
  }

  private static Path fixture(String name) throws URISyntaxException {
    return Path.of(YamlAuthorDirectoryLoaderTest.class.getClassLoader().getResource(name).toURI());
  }
}
