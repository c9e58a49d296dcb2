package ca.gc.cra.docket.domain.record;

import java.util.Locale;

/**
 * Timeline entry kinds produced by the upstream record API.
 *
 * @since 0.1.0
 */
public enum ItemKind {
  /** Free-text note attached to a project. */
  NOTE("Note"),
  /** E-mail message filed against a project. */
  EMAIL("Email");

  private final String label;

  ItemKind(String label) {
    this.label = label;
  }

  /**
   * Returns the display label used by renderers and logs.
   *
   * @return human-readable label ({@code Note} or {@code Email})
   */
  public String label() {
    return label;
  }

  /**
   * Returns the prefix used when composing canonical identifiers.
   *
   * @return lowercase prefix such as {@code note}
   */
  public String idPrefix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
