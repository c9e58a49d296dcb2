package ca.gc.cra.docket.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep upstream payloads and secrets out of operator logs.
 * <p><strong>Why:</strong> Upstream error bodies can be large HTML pages and requests carry bearer tokens.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Condenses an upstream response body for a single log line: whitespace runs (including the newlines of an HTML
   * error page) collapse to one space before the result is truncated to {@code maxBytes}.
   *
   * @param body response body; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of UTF-8 bytes to retain; must be positive
   * @return one-line snippet, or {@code "<empty>"} for a blank body
   */
  public static String snippet(String body, int maxBytes) {
    if (body == null) {
      return NULL_PLACEHOLDER;
    }
    String condensed = WHITESPACE_RUN.matcher(body).replaceAll(" ").trim();
    return condensed.isEmpty() ? "<empty>" : truncate(condensed, maxBytes);
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent call sites
   * @return the redacted placeholder string, or {@code "<null>"} when nothing was supplied
   */
  public static String redact(String value) {
    return value == null ? NULL_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
