package ca.gc.cra.docket.application.fetch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when every candidate strategy of a collection failed or returned an empty first page.
 *
 * @since 0.1.0
 */
public class NoRouteAvailableException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String collection;
  private final transient List<StrategyAttempt> attempts;

  /**
   * Creates the exception.
   *
   * @param collection collection label, e.g. {@code notes}
   * @param attempts every strategy tried, in order
   */
  public NoRouteAvailableException(String collection, List<StrategyAttempt> attempts) {
    super(buildMessage(collection, attempts));
    this.collection = collection;
    this.attempts = List.copyOf(attempts);
  }

  public String collection() {
    return collection;
  }

  /** Strategies tried, in order. */
  public List<StrategyAttempt> attempts() {
    return attempts;
  }

  /**
   * Reports whether the upstream refused every route, as opposed to answering some of them with no data.
   *
   * @return {@code true} when no strategy answered with a 2xx status
   */
  public boolean allRejected() {
    return attempts.stream().noneMatch(StrategyAttempt::answered);
  }

  private static String buildMessage(String collection, List<StrategyAttempt> attempts) {
    String tried = attempts.stream().map(StrategyAttempt::toString).collect(Collectors.joining("; "));
    return "No route available for " + collection + " after " + attempts.size() + " strategies"
        + (tried.isEmpty() ? "" : ": " + tried);
  }
}
