package ca.gc.cra.docket.application.merge;

import ca.gc.cra.docket.application.normalize.TextNormalizer;
import ca.gc.cra.docket.domain.record.CanonicalItem;
import ca.gc.cra.docket.domain.record.EmailHeaders;
import ca.gc.cra.docket.domain.record.ItemKind;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Computes {@link Fingerprint}s.
 *
 * <p>Content digest: SHA-1 over {@code lower(title) | lower(bodyText)[0..4000) | epochMinute}. For e-mails the
 * title is the subject and the body text is the body without markup. For notes the title is the explicit title
 * when present, otherwise the first body line, and the body text is what remains. Header digest (e-mails only):
 * SHA-1 over the lower-cased from, to, and cc values.</p>
 *
 * @since 0.1.0
 */
public final class Fingerprinter {
  static final int BODY_PREFIX_CHARS = 4000;
  private static final char SEPARATOR = '|';

  /**
   * Fingerprints one item.
   *
   * @param item canonical item
   * @return fingerprint
   */
  public Fingerprint fingerprint(CanonicalItem item) {
    String text = TextNormalizer.stripHtml(item.body());
    String title = item.title();
    String bodyText = text;
    if (item.kind() == ItemKind.NOTE && title.isEmpty()) {
      int newline = text.indexOf('\n');
      title = newline < 0 ? text : text.substring(0, newline);
      bodyText = newline < 0 ? "" : text.substring(newline + 1);
    }
    String body = lower(bodyText.trim());
    if (body.length() > BODY_PREFIX_CHARS) {
      body = body.substring(0, BODY_PREFIX_CHARS);
    }
    String content = sha1(lower(title.trim()) + SEPARATOR + body + SEPARATOR + item.createdAt().epochMinute());
    String headers = item.kind() == ItemKind.EMAIL ? headerDigest(item.headers()) : "";
    return new Fingerprint(item.kind(), content, headers);
  }

  private static String headerDigest(EmailHeaders headers) {
    return sha1(lower(headers.from()) + SEPARATOR
        + lower(String.join(",", headers.to())) + SEPARATOR
        + lower(String.join(",", headers.cc())));
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }

  private static String sha1(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-1");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-1 unavailable", ex);
    }
  }
}
