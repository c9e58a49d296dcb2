package ca.gc.cra.docket.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the export pipeline.
 * <p><strong>Why:</strong> Fetch, enrichment, and merge stages record counters without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} serves tests and
 * runs without an exporter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from fetch and
 * enrichment workers.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code fetch.strategy.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., milliseconds, item counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
