package ca.gc.cra.docket.application.cascade;

import java.io.IOException;

/**
 * Tries one candidate of a cascade.
 *
 * @param <C> candidate type
 * @param <R> value produced by an accepted candidate
 * @since 0.1.0
 */
@FunctionalInterface
public interface Attempt<C, R> {
  /**
   * Evaluates a candidate.
   *
   * @param candidate candidate under test
   * @return accepting or rejecting verdict
   * @throws IOException when the candidate failed on transport; recorded as a rejection
   * @throws InterruptedException if the thread is interrupted; aborts the whole cascade
   */
  Verdict<R> apply(C candidate) throws IOException, InterruptedException;
}
