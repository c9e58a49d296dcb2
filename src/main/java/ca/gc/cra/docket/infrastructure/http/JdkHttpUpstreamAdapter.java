package ca.gc.cra.docket.infrastructure.http;

import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.application.port.UpstreamRequest;
import ca.gc.cra.docket.application.port.UpstreamResponse;
import ca.gc.cra.docket.logging.Logs;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link UpstreamPort} over the JDK {@link HttpClient}.
 * <p><strong>Behaviour:</strong> every status is returned as an {@link UpstreamResponse}; only transport failures
 * and timeouts raise {@link IOException}. Redirects are followed for GET links.</p>
 * <p><strong>Thread-safety:</strong> the underlying client is shared and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpUpstreamAdapter implements UpstreamPort {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpUpstreamAdapter.class);
  private static final int ERROR_BODY_LOG_BYTES = 600;

  private final HttpClient client;
  private final Duration requestTimeout;

  /**
   * Creates an adapter with its own client.
   *
   * @param requestTimeout per-request timeout, also used as the connect timeout
   */
  public JdkHttpUpstreamAdapter(Duration requestTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(requestTimeout, "requestTimeout"))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), requestTimeout);
  }

  JdkHttpUpstreamAdapter(HttpClient client, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  public UpstreamResponse send(UpstreamRequest request) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri()).timeout(requestTimeout);
    request.headers().forEach(builder::header);
    HttpRequest.BodyPublisher publisher = request.body()
        .map(json -> HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
        .orElseGet(HttpRequest.BodyPublishers::noBody);
    if (request.body().isPresent()) {
      builder.header("Content-Type", "application/json");
    }
    builder.method(request.method(), publisher);

    HttpResponse<String> response =
        client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    int status = response.statusCode();
    String body = response.body();
    if (status >= 200 && status < 300) {
      log.debug("{} -> {}", request, status);
    } else if (log.isDebugEnabled()) {
      log.debug("{} -> {} body={}", request, status, Logs.snippet(body, ERROR_BODY_LOG_BYTES));
    }
    return new UpstreamResponse(status, body);
  }
}
