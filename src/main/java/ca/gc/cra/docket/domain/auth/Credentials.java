package ca.gc.cra.docket.domain.auth;

import ca.gc.cra.docket.logging.Logs;
import ca.gc.cra.docket.validation.Strings;

/**
 * Opaque caller identity attached to every outbound request.
 *
 * <p>Token acquisition happens outside this system; the values are received ready to use.</p>
 *
 * @param accessToken bearer token
 * @param userId upstream user identifier sent as {@code x-fv-userid}
 * @param orgId upstream organization identifier sent as {@code x-fv-orgid}
 * @since 0.1.0
 */
public record Credentials(String accessToken, String userId, String orgId) {

  public Credentials {
    accessToken = Strings.requireNonBlank("accessToken", accessToken);
    userId = Strings.requireNonBlank("userId", userId);
    orgId = Strings.requireNonBlank("orgId", orgId);
  }

  @Override
  public String toString() {
    return "Credentials[accessToken=" + Logs.redact(accessToken) + ", userId=" + userId + ", orgId=" + orgId + "]";
  }
}
