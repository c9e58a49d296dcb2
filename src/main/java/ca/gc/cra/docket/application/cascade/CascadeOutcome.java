package ca.gc.cra.docket.application.cascade;

import java.util.List;
import java.util.Optional;

/**
 * Result of running a cascade: the winning candidate and its value, if any, plus every rejection seen
 * before it.
 *
 * @param <C> candidate type
 * @param <R> value type
 * @since 0.1.0
 */
public final class CascadeOutcome<C, R> {
  private final C winner;
  private final R result;
  private final List<Rejection<C>> rejections;

  CascadeOutcome(C winner, R result, List<Rejection<C>> rejections) {
    this.winner = winner;
    this.result = result;
    this.rejections = List.copyOf(rejections);
  }

  public boolean succeeded() {
    return winner != null;
  }

  public Optional<C> winner() {
    return Optional.ofNullable(winner);
  }

  public Optional<R> result() {
    return Optional.ofNullable(result);
  }

  /** Rejections in candidate order. */
  public List<Rejection<C>> rejections() {
    return rejections;
  }
}
