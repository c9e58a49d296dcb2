package ca.gc.cra.docket.infrastructure.http;

import ca.gc.cra.docket.application.port.MetricsPort;
import ca.gc.cra.docket.application.port.Sleeper;
import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.application.port.UpstreamRequest;
import ca.gc.cra.docket.application.port.UpstreamResponse;
import ca.gc.cra.docket.validation.Numbers;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a delegate {@link UpstreamPort} on 5xx responses and transport failures.
 *
 * <p>Attempt {@code n} (1-based) that fails waits {@code backoffMillis * n} before the next one. A 5xx response
 * that survives the budget is returned as-is so the caller can treat it as a candidate failure; a transport failure
 * that survives it becomes {@link TransientNetworkException}. Other statuses are returned immediately.</p>
 *
 * @since 0.1.0
 */
public final class RetryingUpstreamAdapter implements UpstreamPort {
  private static final Logger log = LoggerFactory.getLogger(RetryingUpstreamAdapter.class);

  private final UpstreamPort delegate;
  private final int retries;
  private final long backoffMillis;
  private final Sleeper sleeper;
  private final MetricsPort metrics;

  /**
   * Creates the adapter.
   *
   * @param delegate transport doing the real work
   * @param retries extra attempts after the first (0 disables retrying)
   * @param backoffMillis base pause between attempts
   * @param sleeper pause implementation
   * @param metrics metrics sink for {@code upstream.retry}
   */
  public RetryingUpstreamAdapter(
      UpstreamPort delegate, int retries, long backoffMillis, Sleeper sleeper, MetricsPort metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.retries = (int) Numbers.requireRange("retries", retries, 0, 10);
    if (backoffMillis < 0) {
      throw new IllegalArgumentException("retryBackoffMillis must be >= 0");
    }
    this.backoffMillis = backoffMillis;
    this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public UpstreamResponse send(UpstreamRequest request) throws IOException, InterruptedException {
    int attempts = retries + 1;
    for (int attempt = 1; ; attempt++) {
      boolean last = attempt == attempts;
      try {
        UpstreamResponse response = delegate.send(request);
        if (!response.isServerError() || last) {
          return response;
        }
        log.debug("{} answered {} (attempt {}/{}); retrying", request, response.status(), attempt, attempts);
      } catch (IOException ex) {
        if (last) {
          throw new TransientNetworkException(request.toString(), attempts, ex);
        }
        log.debug("{} failed (attempt {}/{}): {}; retrying", request, attempt, attempts, ex.getMessage());
      }
      metrics.increment("upstream.retry");
      sleeper.sleep(backoffMillis * attempt);
    }
  }
}
