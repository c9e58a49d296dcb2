package ca.gc.cra.docket.application.pipeline;

import ca.gc.cra.docket.application.fetch.NoRouteAvailableException;

/**
 * Raised when a collection the run was configured to require had no usable route.
 *
 * @since 0.1.0
 */
public class ExportAbortedException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception from the collection failure.
   *
   * @param cause exhausted-routes failure of the required collection
   */
  public ExportAbortedException(NoRouteAvailableException cause) {
    super("Export aborted: required collection " + cause.collection() + " unavailable. " + cause.getMessage(), cause);
  }

  /** The underlying exhausted-routes failure. */
  public NoRouteAvailableException noRoute() {
    return (NoRouteAvailableException) getCause();
  }
}
