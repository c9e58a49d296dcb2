package ca.gc.cra.docket.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docket.application.port.MetricsPort;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final Map<String, String> ENV = Map.of(
      ExportConfig.ENV_ACCESS_TOKEN, "t",
      ExportConfig.ENV_USER_ID, "u",
      ExportConfig.ENV_ORG_ID, "o");

  @Test
  void loadsConfiguredAuthorDirectory() throws Exception {
    Path authors = Path.of(getClass().getClassLoader().getResource("fixtures/authors.yaml").toURI());
    ExportConfig config = ExportConfig.fromMap(Map.of("projectId", "7", "directory", authors.toString()), ENV);

    CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP);

    assertEquals("Jane Smith", root.preloadedAuthors().get("1001"));
    assertNotNull(root.exportUseCase());
  }

  @Test
  void noDirectoryMeansEmptyTable() throws Exception {
    ExportConfig config = ExportConfig.fromMap(Map.of("projectId", "7"), ENV);

    assertTrue(new CompositionRoot(config, null).preloadedAuthors().isEmpty());
  }

  @Test
  void missingDirectoryFileFailsBeforeExport() {
    ExportConfig config = ExportConfig.fromMap(
        Map.of("projectId", "7", "directory", "/nonexistent/docket/authors.yaml"), ENV);

    assertThrows(IllegalArgumentException.class, () -> new CompositionRoot(config, MetricsPort.NO_OP).exportUseCase());
  }
}
