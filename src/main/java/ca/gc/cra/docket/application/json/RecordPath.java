package ca.gc.cra.docket.application.json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dotted field path with optional array indices (e.g., {@code message.body.text}, {@code to[0].email}) evaluated
 * against parsed upstream payloads.
 *
 * <p>Evaluation never throws: a missing key, a type mismatch, or an index out of range yields empty.</p>
 *
 * @since 0.1.0
 */
public final class RecordPath {
  private final String expression;
  private final List<PathToken> tokens;

  private RecordPath(String expression, List<PathToken> tokens) {
    this.expression = expression;
    this.tokens = tokens;
  }

  /**
   * Compiles a dotted path.
   *
   * @param expression path such as {@code _links.createdBy.href} or {@code items[0]}
   * @return compiled path
   * @throws IllegalArgumentException if the expression is empty or malformed
   */
  public static RecordPath compile(String expression) {
    Objects.requireNonNull(expression, "expression");
    String trimmed = expression.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    List<PathToken> tokens = new ArrayList<>();
    int i = 0;
    while (i < trimmed.length()) {
      char c = trimmed.charAt(i);
      if (c == '.') {
        i++;
        continue;
      }
      if (c == '[') {
        int close = trimmed.indexOf(']', i);
        if (close < 0) {
          throw new IllegalArgumentException("Unterminated bracket in path: " + expression);
        }
        String digits = trimmed.substring(i + 1, close).trim();
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
          throw new IllegalArgumentException("Invalid array index in path: " + expression);
        }
        tokens.add(new IndexToken(Integer.parseInt(digits)));
        i = close + 1;
        continue;
      }
      int start = i;
      while (i < trimmed.length() && trimmed.charAt(i) != '.' && trimmed.charAt(i) != '[') {
        i++;
      }
      tokens.add(new FieldToken(trimmed.substring(start, i)));
    }
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("path has no segments: " + expression);
    }
    return new RecordPath(trimmed, List.copyOf(tokens));
  }

  /**
   * Evaluates the path against the provided root.
   *
   * @param root parsed JSON root (map/list/primitives)
   * @return value at the path, empty when absent or {@code null}
   */
  public Optional<Object> read(Object root) {
    Object current = root;
    for (PathToken token : tokens) {
      if (current == null) {
        return Optional.empty();
      }
      current = token.resolve(current);
      if (current == PathToken.MISSING) {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(current);
  }

  @Override
  public String toString() {
    return expression;
  }

  private sealed interface PathToken permits FieldToken, IndexToken {
    Object MISSING = new Object();

    Object resolve(Object current);
  }

  private static final class FieldToken implements PathToken {
    private final String name;

    FieldToken(String name) {
      this.name = name;
    }

    @Override
    public Object resolve(Object current) {
      if (current instanceof Map<?, ?> map) {
        return map.containsKey(name) ? map.get(name) : MISSING;
      }
      return MISSING;
    }
  }

  private static final class IndexToken implements PathToken {
    private final int index;

    IndexToken(int index) {
      this.index = index;
    }

    @Override
    public Object resolve(Object current) {
      if (current instanceof List<?> list && index < list.size()) {
        return list.get(index);
      }
      return MISSING;
    }
  }
}
