package ca.gc.cra.docket.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each docket CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys; {@link ExportConfig} re-validates
 * every value after merging.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code export})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "export" -> buildExportDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildExportDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("apiBase", ExportConfig.DEFAULT_API_BASE);
    map.put("apiPrefix", ExportConfig.DEFAULT_API_PREFIX);
    map.put("pageLimit", Integer.toString(ExportConfig.DEFAULT_PAGE_LIMIT));
    map.put("maxPages", Integer.toString(ExportConfig.DEFAULT_MAX_PAGES));
    map.put("retries", Integer.toString(ExportConfig.DEFAULT_RETRIES));
    map.put("retryBackoffMillis", Long.toString(ExportConfig.DEFAULT_RETRY_BACKOFF_MILLIS));
    map.put("requestTimeoutMillis", Long.toString(ExportConfig.DEFAULT_REQUEST_TIMEOUT_MILLIS));
    map.put("enrichWorkers", Integer.toString(ExportConfig.DEFAULT_ENRICH_WORKERS));
    map.put("directory", "");
    map.put("out", ExportConfig.DEFAULT_OUT);
    map.put("requiredCollections", "");
    map.put("dryRun", "false");
    return map;
  }
}
