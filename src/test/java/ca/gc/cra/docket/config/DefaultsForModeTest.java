package ca.gc.cra.docket.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void exportDefaultsIncludeCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Export ");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("https://api.filevineapp.com", defaults.get("apiBase"));
    assertEquals("/fv-app/v2", defaults.get("apiPrefix"));
    assertEquals("50", defaults.get("pageLimit"));
    assertEquals("2", defaults.get("retries"));
    assertEquals("./out", defaults.get("out"));
    assertEquals("", defaults.get("requiredCollections"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
