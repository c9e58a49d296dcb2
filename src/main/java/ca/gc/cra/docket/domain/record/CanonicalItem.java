package ca.gc.cra.docket.domain.record;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Upstream-independent representation of one timeline entry.
 * <p><strong>Role:</strong> Domain value created by the normalizer, completed by the author resolver and the
 * comment enricher, and handed unchanged to the merger and renderer.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the {@code with*} methods return copies.</p>
 *
 * @param kind entry kind
 * @param id canonical identifier, unique within the run
 * @param sourceId upstream identifier used for sub-collection routes; empty when the upstream omitted it
 * @param createdAt creation time, possibly synthesized
 * @param author resolved author; empty when unknown
 * @param title note title or e-mail subject
 * @param body note text or e-mail body
 * @param headers e-mail addressing headers; {@link EmailHeaders#EMPTY} for notes
 * @param comments comments attached to the entry in upstream order
 * @since 0.1.0
 */
public record CanonicalItem(
    ItemKind kind,
    String id,
    String sourceId,
    CreatedAt createdAt,
    String author,
    String title,
    String body,
    EmailHeaders headers,
    List<CanonicalComment> comments) {

  public CanonicalItem {
    Objects.requireNonNull(kind, "kind");
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("item id must not be blank");
    }
    Objects.requireNonNull(createdAt, "createdAt");
    sourceId = sourceId == null ? "" : sourceId;
    author = author == null ? "" : author;
    title = title == null ? "" : title;
    body = body == null ? "" : body;
    headers = headers == null ? EmailHeaders.EMPTY : headers;
    comments = comments == null ? List.of() : List.copyOf(comments);
  }

  /**
   * Returns a copy carrying the resolved author.
   *
   * @param resolvedAuthor author name; {@code null} is treated as empty
   * @return updated item
   */
  public CanonicalItem withAuthor(String resolvedAuthor) {
    return new CanonicalItem(kind, id, sourceId, createdAt, resolvedAuthor, title, body, headers, comments);
  }

  /**
   * Returns a copy carrying the supplied comments.
   *
   * @param attached comments in display order
   * @return updated item
   */
  public CanonicalItem withComments(List<CanonicalComment> attached) {
    return new CanonicalItem(kind, id, sourceId, createdAt, author, title, body, headers, attached);
  }

  /**
   * Returns a copy with a different canonical identifier.
   *
   * @param newId replacement identifier
   * @return updated item
   */
  public CanonicalItem withId(String newId) {
    return new CanonicalItem(kind, newId, sourceId, createdAt, author, title, body, headers, comments);
  }
}
