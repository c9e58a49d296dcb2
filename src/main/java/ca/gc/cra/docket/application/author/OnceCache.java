package ca.gc.cra.docket.application.author;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Compute-once memo: the first caller for a key runs the loader, concurrent callers for the same key wait for and
 * share that result, later callers read it.
 *
 * <p>Loader failures are not cached; an interrupted loader releases its key so a later caller can retry.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @since 0.1.0
 */
public final class OnceCache<K, V> {
  /**
   * Produces the value for a key.
   *
   * @param <V> value type
   */
  @FunctionalInterface
  public interface Loader<V> {
    V load() throws InterruptedException;
  }

  private final ConcurrentMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();

  /**
   * Returns the value for {@code key}, running {@code loader} only if no other caller has.
   *
   * @param key cache key
   * @param loader value producer
   * @return cached or freshly loaded value
   * @throws InterruptedException if interrupted while loading or waiting
   */
  public V get(K key, Loader<V> loader) throws InterruptedException {
    while (true) {
      CompletableFuture<V> mine = new CompletableFuture<>();
      CompletableFuture<V> existing = entries.putIfAbsent(key, mine);
      if (existing == null) {
        return load(key, mine, loader);
      }
      try {
        return existing.get();
      } catch (CancellationException ex) {
        // the owning loader was interrupted and released the key; compete again
        continue;
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
          throw runtime;
        }
        if (cause instanceof Error error) {
          throw error;
        }
        throw new IllegalStateException(cause);
      }
    }
  }

  /** Number of keys computed or in flight. */
  public int size() {
    return entries.size();
  }

  private V load(K key, CompletableFuture<V> mine, Loader<V> loader) throws InterruptedException {
    try {
      V value = loader.load();
      mine.complete(value);
      return value;
    } catch (InterruptedException ex) {
      entries.remove(key, mine);
      mine.cancel(false);
      throw ex;
    } catch (RuntimeException | Error ex) {
      entries.remove(key, mine);
      mine.completeExceptionally(ex);
      throw ex;
    }
  }
}
