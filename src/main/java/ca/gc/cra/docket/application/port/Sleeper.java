package ca.gc.cra.docket.application.port;

/**
 * Pauses the calling thread between retry attempts; replaced by a recording fake in tests.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks for the given duration.
   *
   * @param millis pause length in milliseconds; non-positive values return immediately
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(long millis) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = millis -> {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };
}
