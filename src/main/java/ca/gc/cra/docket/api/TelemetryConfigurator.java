package ca.gc.cra.docket.api;

import ca.gc.cra.docket.config.ExportConfig;
import ca.gc.cra.docket.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the metrics settings of an {@link ExportConfig} as the {@code otel.*} system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static void configureMetrics(ExportConfig config) {
    log.debug("Configuring OpenTelemetry metrics exporter: {}", config.metricsExporter());
    System.setProperty("otel.metrics.exporter", config.metricsExporter());

    config.otelEndpoint().ifPresent(endpoint -> {
      String validated = Strings.requireHttpBase("otelEndpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", validated);
      System.setProperty("otel.exporter.otlp.endpoint", validated);
    });

    config.otelResourceAttributes().ifPresent(attributes -> {
      String validated =
          Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", validated);
    });
  }
}
