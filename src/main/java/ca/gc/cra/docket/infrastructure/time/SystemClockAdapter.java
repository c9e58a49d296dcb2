package ca.gc.cra.docket.infrastructure.time;

import ca.gc.cra.docket.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link ClockPort} backed by a {@link java.time.Clock}.
 * <p><strong>Role:</strong> Supplies generation times and the fallback for records without a parseable date.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable clock.</p>
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /** Creates an adapter over the UTC system clock. */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over the supplied clock; tests pass {@link Clock#fixed}.
   *
   * @param clock time source
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
