package ca.gc.cra.docket.domain.record;

import java.util.List;

/**
 * Addressing headers of an e-mail entry. Notes carry {@link #EMPTY}.
 *
 * @param from sender display name or address; empty when unknown
 * @param to primary recipients in upstream order
 * @param cc carbon-copy recipients in upstream order
 * @since 0.1.0
 */
public record EmailHeaders(String from, List<String> to, List<String> cc) {
  /** Headers of an entry that is not an e-mail. */
  public static final EmailHeaders EMPTY = new EmailHeaders("", List.of(), List.of());

  public EmailHeaders {
    from = from == null ? "" : from;
    to = to == null ? List.of() : List.copyOf(to);
    cc = cc == null ? List.of() : List.copyOf(cc);
  }

  /**
   * Indicates whether any header value is present.
   *
   * @return {@code true} when sender and recipients are all empty
   */
  public boolean isEmpty() {
    return from.isEmpty() && to.isEmpty() && cc.isEmpty();
  }
}
