package ca.gc.cra.docket.application.author;

import ca.gc.cra.docket.application.json.RecordPath;
import ca.gc.cra.docket.application.normalize.TextNormalizer;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls a display name out of a person-shaped object.
 *
 * @since 0.1.0
 */
public final class NameExtractor {
  private static final List<RecordPath> USER_ROOTS = List.of(
      RecordPath.compile("user"), RecordPath.compile("data"), RecordPath.compile("data.user"));

  private NameExtractor() {
    // Utility
  }

  /**
   * Extracts a name from a user lookup payload, searching the root and then the {@code user}/{@code data} wrappers.
   *
   * @param payload parsed response body
   * @return display name, or empty when the payload carries none
   */
  public static Optional<String> fromUserPayload(Object payload) {
    Optional<String> direct = fromUser(payload);
    if (direct.isPresent()) {
      return direct;
    }
    for (RecordPath root : USER_ROOTS) {
      Optional<String> nested = root.read(payload).flatMap(NameExtractor::fromUser);
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  /**
   * Composes a name from an inline person object: first+last, given+surname, then displayName, fullName, name.
   *
   * @param value person-shaped map
   * @return name, or empty
   */
  public static Optional<String> fromPerson(Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      return Optional.empty();
    }
    Optional<String> composed = join(map.get("firstName"), map.get("lastName"))
        .or(() -> join(map.get("givenName"), map.get("surname")));
    if (composed.isPresent()) {
      return composed;
    }
    return text(map.get("displayName"))
        .or(() -> text(map.get("fullName")))
        .or(() -> text(map.get("name")));
  }

  private static Optional<String> fromUser(Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      return Optional.empty();
    }
    return text(map.get("displayName"))
        .or(() -> join(map.get("firstName"), map.get("lastName")))
        .or(() -> text(map.get("fullName")))
        .or(() -> text(map.get("name")))
        .or(() -> text(map.get("username")));
  }

  private static Optional<String> join(Object first, Object last) {
    String a = text(first).orElse("");
    String b = text(last).orElse("");
    String joined = (a + " " + b).trim();
    return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
  }

  private static Optional<String> text(Object value) {
    return TextNormalizer.text(value);
  }
}
