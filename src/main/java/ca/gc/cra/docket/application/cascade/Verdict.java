package ca.gc.cra.docket.application.cascade;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of trying one cascade candidate: either an accepted value or a rejection reason.
 *
 * @param <R> accepted value type
 * @since 0.1.0
 */
public final class Verdict<R> {
  private final R value;
  private final String reason;

  private Verdict(R value, String reason) {
    this.value = value;
    this.reason = reason;
  }

  /**
   * Accepts the candidate; the cascade stops here.
   *
   * @param value produced value; must not be {@code null}
   * @param <R> value type
   * @return accepting verdict
   */
  public static <R> Verdict<R> accept(R value) {
    return new Verdict<>(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Rejects the candidate; the cascade moves on.
   *
   * @param reason short diagnostic such as {@code "HTTP 404"} or {@code "empty"}
   * @param <R> value type
   * @return rejecting verdict
   */
  public static <R> Verdict<R> reject(String reason) {
    return new Verdict<>(null, reason == null || reason.isBlank() ? "rejected" : reason);
  }

  public boolean accepted() {
    return value != null;
  }

  public Optional<R> value() {
    return Optional.ofNullable(value);
  }

  public String reason() {
    return reason == null ? "" : reason;
  }
}
