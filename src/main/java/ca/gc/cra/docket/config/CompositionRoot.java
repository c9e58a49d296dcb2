package ca.gc.cra.docket.config;

import ca.gc.cra.docket.application.fetch.StrategyCatalog;
import ca.gc.cra.docket.application.pipeline.TimelineExportUseCase;
import ca.gc.cra.docket.application.port.ClockPort;
import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.application.port.Sleeper;
import ca.gc.cra.docket.application.port.TimelineRendererPort;
import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.infrastructure.directory.YamlAuthorDirectoryLoader;
import ca.gc.cra.docket.infrastructure.http.JdkHttpUpstreamAdapter;
import ca.gc.cra.docket.infrastructure.http.RetryingUpstreamAdapter;
import ca.gc.cra.docket.infrastructure.render.NdjsonTimelineWriter;
import ca.gc.cra.docket.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Wires the export use case from validated configuration.
 * <p><strong>Role:</strong> The only place that picks concrete adapters for the ports.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ExportConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root over the system clock.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(ExportConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter());
  }

  CompositionRoot(ExportConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the transport: JDK HTTP client wrapped with the configured retry budget.
   *
   * @return upstream port
   */
  public UpstreamPort upstream() {
    return new RetryingUpstreamAdapter(
        new JdkHttpUpstreamAdapter(config.requestTimeout()),
        config.retries(),
        config.retryBackoffMillis(),
        Sleeper.SYSTEM,
        metrics);
  }

  /**
   * Builds the route catalog for the configured upstream.
   *
   * @return strategy catalog
   */
  public StrategyCatalog catalog() {
    return new StrategyCatalog(config.apiBase(), config.apiPrefix());
  }

  /**
   * Builds the renderer writing into the configured output directory.
   *
   * @return renderer
   */
  public TimelineRendererPort renderer() {
    return new NdjsonTimelineWriter(config.outputDirectory());
  }

  /**
   * Loads the static author table when one is configured.
   *
   * @return id-to-name table, empty when none is configured
   * @throws IOException if the configured file cannot be read
   */
  public Map<String, String> preloadedAuthors() throws IOException {
    Optional<Path> directory = config.directory();
    return directory.isPresent() ? YamlAuthorDirectoryLoader.load(directory.get()) : Map.of();
  }

  /**
   * Builds the export use case.
   *
   * @return use case ready to run
   * @throws IOException if the author directory cannot be read
   */
  public TimelineExportUseCase exportUseCase() throws IOException {
    return new TimelineExportUseCase(
        upstream(), catalog(), renderer(), clock, metrics, preloadedAuthors(), config.toSettings());
  }
}
