package ca.gc.cra.docket.application.fetch;

/**
 * Logical upstream collections the fetcher knows how to locate.
 *
 * @since 0.1.0
 */
public enum CollectionKind {
  NOTES("notes", "note", false),
  EMAILS("emails", "email", false),
  COMMENTS("comments", "comment", true);

  private final String plural;
  private final String singular;
  private final boolean emptyFirstPageAccepted;

  CollectionKind(String plural, String singular, boolean emptyFirstPageAccepted) {
    this.plural = plural;
    this.singular = singular;
    this.emptyFirstPageAccepted = emptyFirstPageAccepted;
  }

  /** Route segment and configuration label, e.g. {@code notes}. */
  public String plural() {
    return plural;
  }

  /** Activity type filter value, e.g. {@code note}. */
  public String singular() {
    return singular;
  }

  /**
   * Whether a successful but empty first page ends the cascade. A note without comments is normal, so the
   * comment cascade stops on the first route that answers; top-level collections keep looking.
   *
   * @return {@code true} when an empty first page is an accepted answer
   */
  public boolean emptyFirstPageAccepted() {
    return emptyFirstPageAccepted;
  }

  /**
   * Parses a configuration label.
   *
   * @param label {@code notes}, {@code emails}, or {@code comments} (case-insensitive)
   * @return matching kind
   * @throws IllegalArgumentException for unknown labels
   */
  public static CollectionKind fromLabel(String label) {
    if (label != null) {
      String normalized = label.trim();
      for (CollectionKind kind : values()) {
        if (kind.plural.equalsIgnoreCase(normalized)) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException("Unknown collection: " + label);
  }
}
