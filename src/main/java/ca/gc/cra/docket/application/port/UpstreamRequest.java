package ca.gc.cra.docket.application.port;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One outbound call to the upstream record API.
 *
 * @param method HTTP method, upper case
 * @param uri absolute target URI including any query parameters
 * @param headers request headers in insertion order
 * @param body optional JSON body
 * @since 0.1.0
 */
public record UpstreamRequest(String method, URI uri, Map<String, String> headers, Optional<String> body) {

  public UpstreamRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(uri, "uri");
    headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    body = body == null ? Optional.empty() : body;
  }

  /**
   * Builds a bodiless GET request.
   *
   * @param uri absolute target
   * @param headers request headers
   * @return request
   */
  public static UpstreamRequest get(URI uri, Map<String, String> headers) {
    return new UpstreamRequest("GET", uri, headers, Optional.empty());
  }

  /**
   * Builds a POST request carrying a JSON body.
   *
   * @param uri absolute target
   * @param headers request headers
   * @param json serialized JSON body
   * @return request
   */
  public static UpstreamRequest post(URI uri, Map<String, String> headers, String json) {
    return new UpstreamRequest("POST", uri, headers, Optional.of(json));
  }

  @Override
  public String toString() {
    return method + " " + uri;
  }
}
