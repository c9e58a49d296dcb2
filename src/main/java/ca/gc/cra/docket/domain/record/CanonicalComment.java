package ca.gc.cra.docket.domain.record;

import java.util.Objects;

/**
 * Normalized comment owned by exactly one note.
 *
 * @param id identifier unique within the run
 * @param createdAt creation time, possibly synthesized
 * @param author resolved author name; empty when unknown
 * @param body comment text
 * @since 0.1.0
 */
public record CanonicalComment(String id, CreatedAt createdAt, String author, String body) {

  public CanonicalComment {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("comment id must not be blank");
    }
    Objects.requireNonNull(createdAt, "createdAt");
    author = author == null ? "" : author;
    body = body == null ? "" : body;
  }

  /**
   * Returns a copy with the supplied author.
   *
   * @param resolvedAuthor author name; {@code null} is treated as empty
   * @return comment carrying the author
   */
  public CanonicalComment withAuthor(String resolvedAuthor) {
    return new CanonicalComment(id, createdAt, resolvedAuthor, body);
  }
}
