package ca.gc.cra.docket.infrastructure.http;

import java.io.IOException;

/**
 * Raised when every attempt at an upstream request failed at the transport level.
 *
 * @since 0.1.0
 */
public final class TransientNetworkException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int attempts;

  /**
   * Creates the exception.
   *
   * @param request printable request line
   * @param attempts number of attempts made
   * @param cause last transport failure
   */
  public TransientNetworkException(String request, int attempts, IOException cause) {
    super(request + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
