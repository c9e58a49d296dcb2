package ca.gc.cra.docket.application.normalize;

import ca.gc.cra.docket.application.json.RecordPath;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One {@code (fieldPath, parser)} pair: reads a path from an upstream payload and parses the value found there.
 *
 * @param path compiled field path
 * @param parser value parser; returns empty when the value is unusable
 * @param <T> parsed type
 * @since 0.1.0
 */
public record FieldProbe<T>(RecordPath path, Function<Object, Optional<T>> parser) {

  public FieldProbe {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(parser, "parser");
  }

  /**
   * Creates a probe from a dotted path.
   *
   * @param path dotted path, e.g. {@code body.text}
   * @param parser value parser
   * @param <T> parsed type
   * @return probe
   */
  public static <T> FieldProbe<T> of(String path, Function<Object, Optional<T>> parser) {
    return new FieldProbe<>(RecordPath.compile(path), parser);
  }

  /**
   * Reads and parses the value at this probe's path.
   *
   * @param root upstream payload
   * @return parsed value, or empty when absent or unusable
   */
  public Optional<T> probe(Object root) {
    Optional<Object> raw = path.read(root);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    Optional<T> parsed = parser.apply(raw.get());
    return parsed == null ? Optional.empty() : parsed;
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
