package ca.gc.cra.docket.application.port;

/**
 * Status and body of an upstream reply.
 *
 * @param status HTTP status code
 * @param body response body decoded as UTF-8; empty when the upstream sent none
 * @since 0.1.0
 */
public record UpstreamResponse(int status, String body) {

  public UpstreamResponse {
    body = body == null ? "" : body;
  }

  /**
   * Reports whether the status is in the 2xx range.
   *
   * @return {@code true} for success statuses
   */
  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  /**
   * Reports whether the status is a server error worth retrying.
   *
   * @return {@code true} for 5xx statuses
   */
  public boolean isServerError() {
    return status >= 500 && status < 600;
  }
}
