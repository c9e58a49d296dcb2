package ca.gc.cra.docket.application.fetch;

import java.util.OptionalInt;

/**
 * Diagnostic record of one strategy that did not yield data.
 *
 * @param strategy strategy label
 * @param status HTTP status when the upstream answered; empty for transport failures
 * @param outcome short description such as {@code HTTP 404}, {@code empty}, or an exception message
 * @since 0.1.0
 */
public record StrategyAttempt(String strategy, OptionalInt status, String outcome) {

  public StrategyAttempt {
    strategy = strategy == null ? "" : strategy;
    status = status == null ? OptionalInt.empty() : status;
    outcome = outcome == null ? "" : outcome;
  }

  /** Whether the upstream answered this route with a 2xx status. */
  public boolean answered() {
    return status.isPresent() && status.getAsInt() >= 200 && status.getAsInt() < 300;
  }

  @Override
  public String toString() {
    return strategy + " -> " + outcome;
  }
}
