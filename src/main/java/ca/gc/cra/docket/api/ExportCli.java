package ca.gc.cra.docket.api;

import ca.gc.cra.docket.application.fetch.CollectionKind;
import ca.gc.cra.docket.application.fetch.CollectionScope;
import ca.gc.cra.docket.application.fetch.FetchStrategy;
import ca.gc.cra.docket.application.fetch.StrategyAttempt;
import ca.gc.cra.docket.application.fetch.StrategyCatalog;
import ca.gc.cra.docket.application.pipeline.ExportAbortedException;
import ca.gc.cra.docket.application.pipeline.ExportReport;
import ca.gc.cra.docket.application.pipeline.TimelineExportUseCase;
import ca.gc.cra.docket.config.CompositionRoot;
import ca.gc.cra.docket.config.ConfigMerger;
import ca.gc.cra.docket.config.DefaultsForMode;
import ca.gc.cra.docket.config.ExportConfig;
import ca.gc.cra.docket.config.YamlConfigLoader;
import ca.gc.cra.docket.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.docket.logging.LoggingConfigurator;
import ca.gc.cra.docket.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> CLI entry point for the {@code export} command.
 * <p><strong>Flow:</strong> parse {@code key=value} arguments, merge them with the YAML file and the defaults,
 * validate into {@link ExportConfig}, then either print the plan ({@code --dry-run}) or run
 * {@link TimelineExportUseCase} and report where the timeline was written.</p>
 * <p><strong>Exit codes:</strong> see {@link ExitCode}; an aborted export maps to {@link ExitCode#EXPORT_ABORTED}.</p>
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String MODE = "export";
  private static final String SUMMARY_USAGE =
      "usage: export projectId=ID [accessToken=TOKEN userId=ID orgId=ID] [apiBase=URL] [apiPrefix=PATH] "
          + "[out=DIR] [directory=FILE] [requiredCollections=notes,emails] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      docket export

      Usage:
        export projectId=ID [options] [flags]

      Required:
        projectId=ID                 Project whose notes and e-mails are exported
        accessToken=TOKEN            Bearer token (or DOCKET_ACCESS_TOKEN)
        userId=ID                    Caller user id (or DOCKET_USER_ID)
        orgId=ID                     Caller organisation id (or DOCKET_ORG_ID)

      Upstream:
        apiBase=URL                  Default https://api.filevineapp.com
        apiPrefix=PATH               Default /fv-app/v2
        pageLimit=N                  Items per page, 1..500 (default 50)
        maxPages=N                   Page cap per collection, 1..100000 (default 1000)
        retries=N                    Extra attempts on 5xx or network failure, 0..10 (default 2)
        retryBackoffMillis=MS        Base pause between attempts (default 250)
        requestTimeoutMillis=MS      Per-request timeout, 1000..600000 (default 30000)

      Pipeline:
        enrichWorkers=N              Concurrent comment fetches, 1..32 (default 4)
        directory=FILE               YAML id-to-name author table
        requiredCollections=LIST     Abort when these collections have no route (notes,emails)
        out=DIR                      Output directory (default ./out)

      Telemetry:
        metricsExporter=otlp|none    Default none
        otelEndpoint=URL             OTLP gRPC endpoint
        otelResourceAttributes=K=V   Extra resource attributes

      Flags:
        config=FILE                  YAML file with common/export sections
        --dry-run                    Validate and print the plan without contacting the upstream
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private ExportCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.getenv());
  }

  static ExitCode run(String[] args, Map<String, String> env) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for export CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    ExportConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, ConfigCliUtils.withFlags(kv, input), DefaultsForMode.asFlatMap(MODE), log::warn);
      if (ConfigCliUtils.isTrue(effective, "verbose") && !input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      config = ExportConfig.fromMap(effective, env);
      TelemetryConfigurator.configureMetrics(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      log.info("Configured export: {}", config);
      TimelineExportUseCase useCase = new CompositionRoot(config, metrics).exportUseCase();
      ExportReport report = useCase.run(config.projectId(), config.credentials());
      printSummary(report);
      metrics.flush();
      return ExitCode.SUCCESS;
    } catch (ExportAbortedException ex) {
      log.error("Export aborted: {}", ex.getMessage());
      for (StrategyAttempt attempt : ex.noRoute().attempts()) {
        log.error("  tried {}", attempt);
      }
      return ExitCode.EXPORT_ABORTED;
    } catch (IllegalArgumentException ex) {
      log.error("Export configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Export I/O failure for project {}", config.projectId(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Export interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in export", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(ExportConfig config) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Project", config.projectId());
    rows.put("Upstream", config.apiBase() + config.apiPrefix());
    rows.put("Access token", Logs.redact(config.credentials().accessToken()));
    rows.put("User / org", config.credentials().userId() + " / " + config.credentials().orgId());
    rows.put("Page limit / cap", config.pageLimit() + " / " + config.maxPages());
    rows.put("Retries / backoff", config.retries() + " / " + config.retryBackoffMillis() + " ms");
    rows.put("Enrich workers", Integer.toString(config.enrichWorkers()));
    rows.put("Author directory", config.directory().map(Path::toString).orElse("<none>"));
    rows.put("Required", config.requiredCollections().isEmpty()
        ? "<none>" : config.requiredCollections().toString());
    rows.put("Output directory", config.outputDirectory().toString());
    rows.put("Metrics exporter", config.metricsExporter());
    CliPrinter.printSection("Export dry-run: no requests will be sent.", rows);

    StrategyCatalog catalog = new StrategyCatalog(config.apiBase(), config.apiPrefix());
    for (CollectionKind kind : List.of(CollectionKind.NOTES, CollectionKind.EMAILS)) {
      CliPrinter.println(" " + kind.plural() + " candidates:");
      for (FetchStrategy strategy : catalog.candidates(CollectionScope.project(kind, config.projectId()))) {
        CliPrinter.println("   " + strategy.label());
      }
    }
    CliPrinter.println("Re-run without --dry-run to export.");
  }

  private static void printSummary(ExportReport report) {
    Map<String, String> rows = new LinkedHashMap<>();
    report.fetched().forEach((kind, count) -> rows.put(kind.plural() + " fetched", Integer.toString(count)));
    rows.put("Timeline items", Integer.toString(report.items().size()));
    rows.put("Duplicates", Integer.toString(report.duplicatesDropped()));
    if (report.degraded()) {
      rows.put("Missing", report.exhaustedCollections() + " (no usable route)");
    }
    rows.put("Written to", String.valueOf(report.artifact()));
    CliPrinter.printSection("Export " + report.runId() + " of project " + report.projectId() + " complete.", rows);
  }
}
