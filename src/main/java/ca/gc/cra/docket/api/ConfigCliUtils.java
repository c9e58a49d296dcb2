package ca.gc.cra.docket.api;

import java.util.LinkedHashMap;
import java.util.Map;

/** Glue between raw CLI input and the flat configuration map. */
final class ConfigCliUtils {
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--dry-run", "dryRun",
      "--verbose", "verbose");

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config} path so it is not treated as a configuration key. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Copies {@code args} and turns boolean flags such as {@code --dry-run} into their configuration keys, so a flag
   * takes the same CLI-over-YAML precedence as {@code dryRun=true}.
   */
  static Map<String, String> withFlags(Map<String, String> args, CliInput input) {
    Map<String, String> merged = new LinkedHashMap<>(args);
    FLAG_KEYS.forEach((flag, key) -> {
      if (input.hasFlag(flag)) {
        merged.put(key, "true");
      }
    });
    return merged;
  }

  static boolean isTrue(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
