package ca.gc.cra.docket.domain.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Opaque key/value payload exactly as delivered by the upstream API.
 * <p><strong>Why:</strong> Upstream shapes differ per tenant and version, so nothing about the payload is trusted.</p>
 * <p><strong>Role:</strong> Domain value produced by the fetcher and consumed by the normalizer.</p>
 * <p><strong>Thread-safety:</strong> Fields are copied into an unmodifiable map; nested values are shared and must
 * be treated as read-only.</p>
 *
 * @param fields top-level fields of the upstream object; never {@code null}
 * @param ordinal zero-based position of the record within the collection it was fetched from
 * @since 0.1.0
 */
public record RawRecord(Map<String, Object> fields, int ordinal) {

  /**
   * Copies the supplied fields.
   */
  public RawRecord {
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Wraps an arbitrary parsed JSON node. Anything other than an object becomes an empty record.
   *
   * @param node parsed JSON node (map, list, scalar or {@code null})
   * @param ordinal position of the node within its page sequence
   * @return raw record view of the node
   */
  public static RawRecord of(Object node, int ordinal) {
    if (node instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() != null) {
          copy.put(entry.getKey().toString(), entry.getValue());
        }
      }
      return new RawRecord(copy, ordinal);
    }
    return new RawRecord(Map.of(), ordinal);
  }

  /**
   * Indicates whether the upstream object carried no fields at all.
   *
   * @return {@code true} when no fields are present
   */
  public boolean isEmpty() {
    return fields.isEmpty();
  }
}
