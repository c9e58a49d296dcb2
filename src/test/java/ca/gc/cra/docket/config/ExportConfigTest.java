package ca.gc.cra.docket.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docket.application.fetch.CollectionKind;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExportConfigTest {
  private static final Map<String, String> ENV = Map.of(
      ExportConfig.ENV_ACCESS_TOKEN, "env-token",
      ExportConfig.ENV_USER_ID, "env-user",
      ExportConfig.ENV_ORG_ID, "env-org");

  @Test
  void defaultsApplyWhenOnlyProjectIsGiven() {
    ExportConfig config = ExportConfig.fromMap(Map.of("projectId", "7"), ENV);

    assertEquals("7", config.projectId());
    assertEquals("https://api.filevineapp.com", config.apiBase());
    assertEquals("/fv-app/v2", config.apiPrefix());
    assertEquals("env-token", config.credentials().accessToken());
    assertEquals(50, config.pageLimit());
    assertEquals(Duration.ofSeconds(30), config.requestTimeout());
    assertEquals(Path.of("./out").toAbsolutePath().normalize(), config.outputDirectory());
    assertTrue(config.directory().isEmpty());
    assertTrue(config.requiredCollections().isEmpty());
    assertEquals("none", config.metricsExporter());
    assertFalse(config.dryRun());
  }

  @Test
  void explicitValuesOverrideEnvironment() {
    Map<String, String> kv = new HashMap<>();
    kv.put("projectId", "7");
    kv.put("accessToken", "cli-token");
    kv.put("apiBase", "https://api.example.test/");
    kv.put("apiPrefix", "v2/");
    kv.put("pageLimit", "100");
    kv.put("requiredCollections", "notes, EMAILS");
    kv.put("directory", "authors.yaml");
    kv.put("metricsExporter", "OTLP");
    kv.put("dryRun", "true");

    ExportConfig config = ExportConfig.fromMap(kv, ENV);

    assertEquals("cli-token", config.credentials().accessToken());
    assertEquals("env-user", config.credentials().userId());
    assertEquals("https://api.example.test", config.apiBase());
    assertEquals("/v2", config.apiPrefix());
    assertEquals(Set.of(CollectionKind.NOTES, CollectionKind.EMAILS), config.requiredCollections());
    assertEquals(Path.of("authors.yaml").toAbsolutePath().normalize(), config.directory().orElseThrow());
    assertEquals("otlp", config.metricsExporter());
    assertTrue(config.dryRun());
    assertEquals(100, config.toSettings().pageLimit());
  }

  @Test
  void missingCredentialNamesTheEnvironmentVariable() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("projectId", "7", "accessToken", "t", "userId", "u"), Map.of()));
    assertEquals("orgId is required (or set DOCKET_ORG_ID)", ex.getMessage());
  }

  @Test
  void rejectsOutOfRangeAndMalformedValues() {
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("projectId", "7", "pageLimit", "0"), ENV));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("projectId", "7", "retries", "many"), ENV));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("projectId", "7", "apiBase", "ftp://host"), ENV));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("projectId", "7", "requiredCollections", "comments"), ENV));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("projectId", "7", "requiredCollections", "tasks"), ENV));
    assertThrows(IllegalArgumentException.class, () -> ExportConfig.fromMap(Map.of(), ENV));
  }

  @Test
  void toStringRedactsToken() {
    ExportConfig config = ExportConfig.fromMap(Map.of("projectId", "7"), ENV);
    assertFalse(config.toString().contains("env-token"));
    assertTrue(config.toString().contains("userId=env-user"));
  }
}
