package ca.gc.cra.docket.application.author;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Run-scoped id-to-name directory: a static preloaded table plus compute-once caches for
 * link traversals and single-user lookups.
 * <p><strong>Ownership:</strong> one instance per export run, created at the top of the run and passed to every
 * resolution. Nothing is persisted across runs.</p>
 * <p><strong>Thread-safety:</strong> the preloaded table is immutable; the caches are {@link OnceCache}s.</p>
 *
 * @since 0.1.0
 */
public final class AuthorDirectory {
  private final Map<String, String> preloaded;
  private final OnceCache<String, Optional<String>> links = new OnceCache<>();
  private final OnceCache<String, Optional<String>> users = new OnceCache<>();

  /**
   * Creates a directory.
   *
   * @param preloaded static id-to-name table; blank names are ignored
   */
  public AuthorDirectory(Map<String, String> preloaded) {
    Map<String, String> copy = new LinkedHashMap<>();
    if (preloaded != null) {
      preloaded.forEach((id, name) -> {
        if (id != null && name != null && !id.isBlank() && !name.isBlank()) {
          copy.put(id.trim(), name.trim());
        }
      });
    }
    this.preloaded = Collections.unmodifiableMap(copy);
  }

  /** Directory without a static table. */
  public static AuthorDirectory empty() {
    return new AuthorDirectory(Map.of());
  }

  /**
   * Looks an id up in the static table.
   *
   * @param userId opaque user id
   * @return name, or empty when the table does not know the id
   */
  public Optional<String> preloaded(String userId) {
    return userId == null ? Optional.empty() : Optional.ofNullable(preloaded.get(userId.trim()));
  }

  /**
   * Resolves a creator link once per run.
   *
   * @param uri absolute link target
   * @param loader remote fetch, run at most once per target
   * @return cached or loaded name
   * @throws InterruptedException if interrupted while loading or waiting
   */
  public Optional<String> byLink(String uri, OnceCache.Loader<Optional<String>> loader) throws InterruptedException {
    return links.get(uri, loader);
  }

  /**
   * Resolves a user id remotely once per run.
   *
   * @param userId opaque user id
   * @param loader remote lookup, run at most once per id
   * @return cached or loaded name
   * @throws InterruptedException if interrupted while loading or waiting
   */
  public Optional<String> byLookup(String userId, OnceCache.Loader<Optional<String>> loader)
      throws InterruptedException {
    return users.get(userId, loader);
  }

  public int preloadedSize() {
    return preloaded.size();
  }
}
