package ca.gc.cra.docket.application.cascade;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Evaluates an ordered list of candidates and stops at the first accepted one.
 * <p><strong>Why:</strong> Collection fetching, comment fetching, and author resolution all walk a ranked list of
 * fallbacks; one evaluator keeps the "try in order" rule identical at every call site.</p>
 * <p><strong>Failure model:</strong> {@link IOException}s and unchecked exceptions raised by an attempt are recorded
 * as rejections and the next candidate is tried. {@link InterruptedException} aborts immediately.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call owns its own bookkeeping.</p>
 *
 * @since 0.1.0
 */
public final class Cascade {
  private static final Logger log = LoggerFactory.getLogger(Cascade.class);

  private Cascade() {
    // Utility
  }

  /**
   * Tries each candidate in order until one is accepted.
   *
   * @param name label used in debug logs (e.g., {@code "notes"})
   * @param candidates candidates in priority order
   * @param attempt evaluator applied to each candidate
   * @param <C> candidate type
   * @param <R> value type
   * @return outcome holding the winner (if any) and all rejections in order
   * @throws InterruptedException if an attempt is interrupted
   */
  public static <C, R> CascadeOutcome<C, R> firstSuccess(
      String name, List<? extends C> candidates, Attempt<? super C, ? extends R> attempt)
      throws InterruptedException {
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(attempt, "attempt");
    List<Rejection<C>> rejections = new ArrayList<>();
    for (C candidate : candidates) {
      Verdict<? extends R> verdict;
      try {
        verdict = attempt.apply(candidate);
      } catch (IOException | RuntimeException ex) {
        log.debug("{}: candidate {} failed: {}", name, candidate, ex.toString());
        rejections.add(new Rejection<>(candidate, describe(ex), ex));
        continue;
      }
      if (verdict != null && verdict.accepted()) {
        R value = verdict.value().orElseThrow();
        return new CascadeOutcome<>(candidate, value, rejections);
      }
      String reason = verdict == null ? "rejected" : verdict.reason();
      log.debug("{}: candidate {} rejected: {}", name, candidate, reason);
      rejections.add(new Rejection<>(candidate, reason, null));
    }
    return new CascadeOutcome<>(null, null, rejections);
  }

  private static String describe(Throwable ex) {
    String message = ex.getMessage();
    String type = ex.getClass().getSimpleName();
    return message == null || message.isBlank() ? type : type + ": " + message;
  }
}
