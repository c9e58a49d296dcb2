package ca.gc.cra.docket.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");

    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(result);
    assertFalse(adapter.isActive());
    adapter.increment("fetch.page.requested");
    adapter.flush();
    adapter.close();
  }

  @Test
  void parsesResourceAttributesSkippingMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, broken, =x, team = cases ,");
    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("cases", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
  }
}
