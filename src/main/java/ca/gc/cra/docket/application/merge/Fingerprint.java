package ca.gc.cra.docket.application.merge;

import ca.gc.cra.docket.domain.record.ItemKind;
import java.util.Objects;

/**
 * Content identity of a timeline item, used only for duplicate detection.
 *
 * @param kind kind of the fingerprinted item
 * @param content digest over title, body prefix, and creation minute
 * @param headers digest over e-mail addressing; empty for notes
 * @since 0.1.0
 */
public record Fingerprint(ItemKind kind, String content, String headers) {

  public Fingerprint {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(content, "content");
    headers = headers == null ? "" : headers;
  }

  /**
   * Two items collide when their content digests match and either one is a note (notes carry no addressing) or
   * both carry the same addressing.
   *
   * @param other fingerprint to compare with
   * @return {@code true} when the two items represent the same entry
   */
  public boolean collidesWith(Fingerprint other) {
    if (!content.equals(other.content)) {
      return false;
    }
    if (kind == ItemKind.NOTE || other.kind == ItemKind.NOTE) {
      return true;
    }
    return headers.equals(other.headers);
  }
}
