package ca.gc.cra.docket.application.normalize;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Parsers for opaque identifiers, which upstream payloads carry as strings or numbers.
 *
 * @since 0.1.0
 */
public final class Identifiers {
  private Identifiers() {
    // Utility
  }

  /**
   * Parses a scalar identifier. Integral floating-point numbers lose their fraction ({@code 42.0 -> "42"}).
   *
   * @param value raw field value
   * @return identifier text, or empty for blanks, non-finite numbers, maps, lists, and booleans
   */
  public static Optional<String> scalar(Object value) {
    if (value instanceof String text) {
      String trimmed = text.trim();
      return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
    if (value instanceof Integer || value instanceof Long) {
      return Optional.of(String.valueOf(value));
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Optional.empty();
      }
    }
    if (value instanceof Number number) {
      try {
        BigDecimal decimal = new BigDecimal(number.toString()).stripTrailingZeros();
        return Optional.of(decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString());
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Whether an identifier looks numeric (all digits); used to tell ids apart from names in plain string fields.
   *
   * @param value candidate
   * @return {@code true} for non-empty digit strings
   */
  public static boolean isNumeric(String value) {
    return value != null && !value.isEmpty() && value.chars().allMatch(Character::isDigit);
  }
}
