package ca.gc.cra.docket.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time.
 * <p><strong>Why:</strong> Synthesized timestamps and generation times must be reproducible in tests.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current wall-clock time in epoch milliseconds.
   *
   * @return milliseconds since the Unix epoch
   */
  long nowMillis();

  /**
   * Returns the current wall-clock time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
