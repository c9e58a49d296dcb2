package ca.gc.cra.docket.domain.record;

import java.time.Instant;
import java.util.Objects;

/**
 * Creation instant of a timeline entry together with its provenance.
 *
 * <p>When no parseable source date exists the normalizer substitutes the wall-clock time and marks the
 * value as synthesized so downstream consumers and tests can tell it apart from upstream data.</p>
 *
 * @param instant resolved instant; never {@code null}
 * @param synthesized {@code true} when the instant was supplied by the clock instead of the record
 * @since 0.1.0
 */
public record CreatedAt(Instant instant, boolean synthesized) implements Comparable<CreatedAt> {

  public CreatedAt {
    Objects.requireNonNull(instant, "instant");
  }

  /**
   * Creates a value parsed from upstream data.
   *
   * @param instant parsed instant
   * @return observed creation time
   */
  public static CreatedAt observed(Instant instant) {
    return new CreatedAt(instant, false);
  }

  /**
   * Creates a clock-supplied fallback value.
   *
   * @param now current wall-clock instant
   * @return synthesized creation time
   */
  public static CreatedAt synthesized(Instant now) {
    return new CreatedAt(now, true);
  }

  /**
   * Returns the epoch minute the instant falls into.
   *
   * @return floor of epoch milliseconds divided by one minute
   */
  public long epochMinute() {
    return Math.floorDiv(instant.getEpochSecond(), 60L);
  }

  @Override
  public int compareTo(CreatedAt other) {
    return instant.compareTo(other.instant);
  }
}
