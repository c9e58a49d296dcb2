package ca.gc.cra.docket.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port for issuing requests against the paginated upstream record API.
 * <p><strong>Why:</strong> The fetcher and the author resolver stay independent of the HTTP client so their
 * cascades can be exercised against scripted fakes.</p>
 * <p><strong>Role:</strong> Implemented by {@code JdkHttpUpstreamAdapter}, usually wrapped in
 * {@code RetryingUpstreamAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from the collection tasks and
 * the enrichment workers.</p>
 *
 * @since 0.1.0
 */
public interface UpstreamPort {
  /**
   * Sends one request and returns whatever status the upstream answered with.
   *
   * <p>Non-success statuses are returned, not thrown; only transport failures raise.</p>
   *
   * @param request outbound request
   * @return upstream response
   * @throws IOException when the request could not be completed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  UpstreamResponse send(UpstreamRequest request) throws IOException, InterruptedException;
}
