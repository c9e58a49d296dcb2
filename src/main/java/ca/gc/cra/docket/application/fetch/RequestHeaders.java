package ca.gc.cra.docket.application.fetch;

import ca.gc.cra.docket.domain.auth.Credentials;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the header set every upstream call carries.
 *
 * @since 0.1.0
 */
public final class RequestHeaders {
  private RequestHeaders() {
    // Utility
  }

  /**
   * Headers for an authenticated JSON call.
   *
   * @param credentials caller identity
   * @return ordered header map
   */
  public static Map<String, String> forCredentials(Credentials credentials) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Authorization", "Bearer " + credentials.accessToken());
    headers.put("x-fv-userid", credentials.userId());
    headers.put("x-fv-orgid", credentials.orgId());
    headers.put("Accept", "application/json");
    return headers;
  }
}
