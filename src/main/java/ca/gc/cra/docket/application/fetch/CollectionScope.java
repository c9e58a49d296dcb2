package ca.gc.cra.docket.application.fetch;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies one logical collection instance: a project's notes or emails, or one note's comments.
 *
 * @param kind collection kind
 * @param projectId owning project
 * @param parentId parent note id for comments; empty for top-level collections
 * @param link comments link advertised by the parent record, tried before the catalog routes
 * @since 0.1.0
 */
public record CollectionScope(CollectionKind kind, String projectId, String parentId, Optional<String> link) {

  public CollectionScope {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(projectId, "projectId");
    parentId = parentId == null ? "" : parentId;
    link = link == null ? Optional.empty() : link;
    if (kind == CollectionKind.COMMENTS && parentId.isBlank()) {
      throw new IllegalArgumentException("comments scope requires a parent id");
    }
  }

  /**
   * Top-level collection of a project.
   *
   * @param kind {@link CollectionKind#NOTES} or {@link CollectionKind#EMAILS}
   * @param projectId project id
   * @return scope
   */
  public static CollectionScope project(CollectionKind kind, String projectId) {
    if (kind == CollectionKind.COMMENTS) {
      throw new IllegalArgumentException("comments are scoped to a note");
    }
    return new CollectionScope(kind, projectId, "", Optional.empty());
  }

  /**
   * Comments of one note.
   *
   * @param projectId project id
   * @param noteId upstream note id
   * @param link optional comments link found on the note record
   * @return scope
   */
  public static CollectionScope comments(String projectId, String noteId, Optional<String> link) {
    return new CollectionScope(CollectionKind.COMMENTS, projectId, noteId, link);
  }

  /** Label used in logs and MDC, e.g. {@code notes} or {@code comments[note:42]}. */
  public String label() {
    return kind == CollectionKind.COMMENTS ? "comments[note:" + parentId + "]" : kind.plural();
  }
}
