package ca.gc.cra.docket.config;

import ca.gc.cra.docket.application.fetch.CollectionKind;
import ca.gc.cra.docket.application.pipeline.ExportSettings;
import ca.gc.cra.docket.domain.auth.Credentials;
import ca.gc.cra.docket.logging.Logs;
import ca.gc.cra.docket.validation.Numbers;
import ca.gc.cra.docket.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Validated configuration of one export run.
 * <p><strong>Why:</strong> Consolidates CLI keys, YAML sections, and environment credentials so the composition
 * root receives typed, range-checked values.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate for the export CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 * <p><strong>Security:</strong> {@link #toString()} never prints the access token.</p>
 *
 * @param projectId project to export
 * @param apiBase upstream base URL without trailing slash
 * @param apiPrefix versioned path prefix, or empty
 * @param credentials caller identity sent on every request
 * @param pageLimit page size requested from the upstream
 * @param maxPages page cap per collection
 * @param retries extra attempts per request on 5xx or transport failure
 * @param retryBackoffMillis base pause between attempts
 * @param requestTimeoutMillis per-request timeout
 * @param enrichWorkers comment enrichment pool size
 * @param directory optional YAML author table
 * @param outputDirectory directory receiving the rendered timeline
 * @param requiredCollections collections whose absence aborts the run
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint optional OTLP endpoint override
 * @param otelResourceAttributes optional extra resource attributes ({@code k=v,k2=v2})
 * @param dryRun print the plan and exit without contacting the upstream
 * @since 0.1.0
 */
public record ExportConfig(
    String projectId,
    String apiBase,
    String apiPrefix,
    Credentials credentials,
    int pageLimit,
    int maxPages,
    int retries,
    long retryBackoffMillis,
    long requestTimeoutMillis,
    int enrichWorkers,
    Optional<Path> directory,
    Path outputDirectory,
    Set<CollectionKind> requiredCollections,
    String metricsExporter,
    Optional<String> otelEndpoint,
    Optional<String> otelResourceAttributes,
    boolean dryRun) {

  static final String DEFAULT_API_BASE = "https://api.filevineapp.com";
  static final String DEFAULT_API_PREFIX = "/fv-app/v2";
  static final int DEFAULT_PAGE_LIMIT = 50;
  static final int DEFAULT_MAX_PAGES = 1000;
  static final int DEFAULT_RETRIES = 2;
  static final long DEFAULT_RETRY_BACKOFF_MILLIS = 250L;
  static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = 30_000L;
  static final int DEFAULT_ENRICH_WORKERS = 4;
  static final String DEFAULT_OUT = "./out";

  /** Environment variable consulted when {@code accessToken} is not configured. */
  public static final String ENV_ACCESS_TOKEN = "DOCKET_ACCESS_TOKEN";
  /** Environment variable consulted when {@code userId} is not configured. */
  public static final String ENV_USER_ID = "DOCKET_USER_ID";
  /** Environment variable consulted when {@code orgId} is not configured. */
  public static final String ENV_ORG_ID = "DOCKET_ORG_ID";

  /**
   * Normalizes values and enforces ranges.
   *
   * @throws IllegalArgumentException if any value is out of range
   */
  public ExportConfig {
    projectId = Strings.requireNonBlank("projectId", projectId);
    apiBase = Strings.requireHttpBase("apiBase", apiBase);
    apiPrefix = Strings.requirePathPrefix("apiPrefix", apiPrefix);
    Objects.requireNonNull(credentials, "credentials");
    Numbers.requireRange("pageLimit", pageLimit, 1, 500);
    Numbers.requireRange("maxPages", maxPages, 1, 100_000);
    Numbers.requireRange("retries", retries, 0, 10);
    Numbers.requireRange("retryBackoffMillis", retryBackoffMillis, 0, 60_000);
    Numbers.requireRange("requestTimeoutMillis", requestTimeoutMillis, 1_000, 600_000);
    Numbers.requireRange("enrichWorkers", enrichWorkers, 1, 32);
    directory = directory == null ? Optional.empty() : directory;
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    requiredCollections = requiredCollections == null || requiredCollections.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(requiredCollections));
    metricsExporter = metricsExporter == null || metricsExporter.isBlank()
        ? "none"
        : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("otlp") && !metricsExporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none");
    }
    otelEndpoint = otelEndpoint == null ? Optional.empty() : otelEndpoint;
    otelResourceAttributes = otelResourceAttributes == null ? Optional.empty() : otelResourceAttributes;
  }

  /**
   * Builds configuration from a flat key/value map, falling back to {@code DOCKET_*} environment variables for
   * credentials.
   *
   * @param kv merged configuration
   * @param env environment variables, usually {@link System#getenv()}
   * @return validated configuration
   * @throws IllegalArgumentException if a required key is missing or a value is invalid
   */
  public static ExportConfig fromMap(Map<String, String> kv, Map<String, String> env) {
    Objects.requireNonNull(kv, "kv");
    Map<String, String> environment = env == null ? Map.of() : env;
    Credentials credentials = new Credentials(
        required("accessToken", kv, environment, ENV_ACCESS_TOKEN),
        required("userId", kv, environment, ENV_USER_ID),
        required("orgId", kv, environment, ENV_ORG_ID));

    return new ExportConfig(
        kv.get("projectId") == null ? "" : kv.get("projectId"),
        valueOr(kv, "apiBase", DEFAULT_API_BASE),
        valueOr(kv, "apiPrefix", DEFAULT_API_PREFIX),
        credentials,
        parseInt(kv, "pageLimit", DEFAULT_PAGE_LIMIT),
        parseInt(kv, "maxPages", DEFAULT_MAX_PAGES),
        parseInt(kv, "retries", DEFAULT_RETRIES),
        parseLong(kv, "retryBackoffMillis", DEFAULT_RETRY_BACKOFF_MILLIS),
        parseLong(kv, "requestTimeoutMillis", DEFAULT_REQUEST_TIMEOUT_MILLIS),
        parseInt(kv, "enrichWorkers", DEFAULT_ENRICH_WORKERS),
        optional(kv.get("directory")).map(value -> parsePath("directory", value)),
        parsePath("out", valueOr(kv, "out", DEFAULT_OUT)),
        parseCollections(kv.get("requiredCollections")),
        kv.get("metricsExporter"),
        optional(kv.get("otelEndpoint")),
        optional(kv.get("otelResourceAttributes")),
        parseBoolean(kv.get("dryRun")));
  }

  /**
   * Projects the pipeline tuning knobs.
   *
   * @return settings for the export use case
   */
  public ExportSettings toSettings() {
    return new ExportSettings(pageLimit, maxPages, enrichWorkers, requiredCollections);
  }

  /** Per-request timeout as a duration. */
  public Duration requestTimeout() {
    return Duration.ofMillis(requestTimeoutMillis);
  }

  @Override
  public String toString() {
    return "ExportConfig{projectId=" + projectId
        + ", apiBase=" + apiBase
        + ", apiPrefix=" + apiPrefix
        + ", accessToken=" + Logs.redact(credentials.accessToken())
        + ", userId=" + credentials.userId()
        + ", orgId=" + credentials.orgId()
        + ", pageLimit=" + pageLimit
        + ", maxPages=" + maxPages
        + ", retries=" + retries
        + ", retryBackoffMillis=" + retryBackoffMillis
        + ", requestTimeoutMillis=" + requestTimeoutMillis
        + ", enrichWorkers=" + enrichWorkers
        + ", directory=" + directory.map(Path::toString).orElse("<none>")
        + ", out=" + outputDirectory
        + ", requiredCollections=" + requiredCollections
        + ", metricsExporter=" + metricsExporter
        + ", dryRun=" + dryRun
        + '}';
  }

  private static String required(String key, Map<String, String> kv, Map<String, String> env, String envName) {
    String value = optional(kv.get(key)).or(() -> optional(env.get(envName))).orElse(null);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required (or set " + envName + ")");
    }
    return Strings.requireNonBlank(key, value);
  }

  private static String valueOr(Map<String, String> kv, String key, String fallback) {
    return optional(kv.get(key)).orElse(fallback);
  }

  private static Optional<String> optional(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static int parseInt(Map<String, String> kv, String key, int defaultValue) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer", ex);
    }
  }

  private static long parseLong(Map<String, String> kv, String key, long defaultValue) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer", ex);
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Set<CollectionKind> parseCollections(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    EnumSet<CollectionKind> kinds = EnumSet.noneOf(CollectionKind.class);
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      CollectionKind kind;
      try {
        kind = CollectionKind.fromLabel(token);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("requiredCollections: " + ex.getMessage(), ex);
      }
      if (kind == CollectionKind.COMMENTS) {
        throw new IllegalArgumentException("requiredCollections accepts only notes and emails");
      }
      kinds.add(kind);
    }
    return kinds;
  }
}
