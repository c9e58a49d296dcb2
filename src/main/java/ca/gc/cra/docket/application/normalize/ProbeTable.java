package ca.gc.cra.docket.application.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Declarative priority table for one concept (timestamp, body, id, author ...); the first probe whose field is
 * present and parses wins.
 *
 * @param <T> parsed type
 * @since 0.1.0
 */
public final class ProbeTable<T> {
  private final String concept;
  private final List<FieldProbe<T>> probes;

  private ProbeTable(String concept, List<FieldProbe<T>> probes) {
    this.concept = concept;
    this.probes = List.copyOf(probes);
  }

  /**
   * Builds a table sharing one parser across several paths.
   *
   * @param concept label for diagnostics
   * @param parser value parser
   * @param paths dotted paths in priority order
   * @param <T> parsed type
   * @return table
   */
  public static <T> ProbeTable<T> of(String concept, Function<Object, Optional<T>> parser, String... paths) {
    List<FieldProbe<T>> probes = new ArrayList<>(paths.length);
    for (String path : paths) {
      probes.add(FieldProbe.of(path, parser));
    }
    return new ProbeTable<>(concept, probes);
  }

  /**
   * Returns a table that tries this table's probes, then {@code next}'s.
   *
   * @param next lower-priority table
   * @return combined table
   */
  public ProbeTable<T> then(ProbeTable<T> next) {
    List<FieldProbe<T>> combined = new ArrayList<>(probes);
    combined.addAll(next.probes);
    return new ProbeTable<>(concept, combined);
  }

  /**
   * Evaluates probes in order.
   *
   * @param root upstream payload
   * @return first parsed value, or empty when no probe matched
   */
  public Optional<T> firstMatch(Object root) {
    for (FieldProbe<T> probe : probes) {
      Optional<T> value = probe.probe(root);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }

  public String concept() {
    return concept;
  }

  @Override
  public String toString() {
    return concept + probes;
  }
}
