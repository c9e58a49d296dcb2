package ca.gc.cra.docket.application.normalize;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Whitespace and markup clean-up applied to every text field taken from upstream payloads.
 *
 * @since 0.1.0
 */
public final class TextNormalizer {
  private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");
  private static final Pattern HORIZONTAL_RUNS = Pattern.compile("[ \\t\\u00A0]+");
  private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\n ?");
  private static final Pattern BLOCK_TAGS = Pattern.compile("(?i)<\\s*(br|/p|/div|/li|/tr|/h[1-6])\\s*/?>");
  private static final Pattern TAGS = Pattern.compile("<[^>]*>");
  private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\n{3,}");

  private TextNormalizer() {
    // Utility
  }

  /**
   * Normalizes line endings, drops stray control characters, collapses horizontal whitespace, and trims.
   *
   * @param text raw text; {@code null} yields empty
   * @return normalized text
   */
  public static String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String out = text.replace("\r\n", "\n").replace('\r', '\n');
    out = CONTROL.matcher(out).replaceAll("");
    out = HORIZONTAL_RUNS.matcher(out).replaceAll(" ");
    out = SPACE_AROUND_NEWLINE.matcher(out).replaceAll("\n");
    return out.trim();
  }

  /**
   * Removes HTML markup, turning block-level breaks into newlines and decoding the common entities.
   *
   * @param html markup or plain text
   * @return normalized plain text
   */
  public static String stripHtml(String html) {
    if (html == null || html.isEmpty()) {
      return "";
    }
    String out = BLOCK_TAGS.matcher(html).replaceAll("\n");
    out = TAGS.matcher(out).replaceAll("");
    out = out.replace("&nbsp;", " ")
        .replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&quot;", "\"")
        .replace("&#39;", "'")
        .replace("&amp;", "&");
    out = normalize(out);
    return EXTRA_BLANK_LINES.matcher(out).replaceAll("\n\n");
  }

  /**
   * Parser for probe tables: accepts strings (and numbers) that are non-blank after normalization.
   *
   * @param value raw field value
   * @return normalized text, or empty
   */
  public static Optional<String> text(Object value) {
    String raw;
    if (value instanceof String s) {
      raw = s;
    } else if (value instanceof Number || value instanceof Boolean) {
      raw = String.valueOf(value);
    } else {
      return Optional.empty();
    }
    String normalized = normalize(raw);
    return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized);
  }
}
