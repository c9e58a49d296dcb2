package ca.gc.cra.docket.application.cascade;

import java.util.Objects;
import java.util.Optional;

/**
 * Record of a candidate that did not produce a value.
 *
 * @param candidate rejected candidate
 * @param reason diagnostic reason (status, {@code empty}, or exception message)
 * @param cause exception raised by the attempt; {@code null} for plain rejections
 * @param <C> candidate type
 * @since 0.1.0
 */
public record Rejection<C>(C candidate, String reason, Throwable cause) {

  public Rejection {
    Objects.requireNonNull(candidate, "candidate");
    reason = reason == null ? "" : reason;
  }

  public Optional<Throwable> failure() {
    return Optional.ofNullable(cause);
  }
}
