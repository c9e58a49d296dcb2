package ca.gc.cra.docket.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied to the export CLI and configuration layers.
 * <p><strong>Why:</strong> Credentials, project identifiers, and endpoint prefixes end up in request headers and
 * URLs; rejecting malformed values early keeps the fetch stage from issuing undefined requests.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)} so header values never carry
 * CR/LF sequences.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates an absolute {@code http}/{@code https} base URL and strips any trailing slash.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate URL text
   * @return normalized base URL without a trailing {@code /}
   * @throws IllegalArgumentException if the value is blank, unparsable, relative, or uses another scheme
   */
  public static String requireHttpBase(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(message(name, "is not a valid URL: " + ex.getMessage()), ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException(message(name, "must use http or https"));
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(message(name, "must include a host"));
    }
    return stripTrailingSlash(sanitized);
  }

  /**
   * Validates a URL path prefix such as {@code /fv-app/v2}; a leading slash is added when missing.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate prefix; blank means "no prefix"
   * @return prefix starting with {@code /} and without trailing slash, or an empty string
   * @throws IllegalArgumentException if the prefix contains whitespace, control characters, or a query
   */
  public static String requirePathPrefix(String name, String value) {
    if (value == null || value.isBlank()) {
      return "";
    }
    String trimmed = value.trim();
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c) || c == '?' || c == '#') {
        throw new IllegalArgumentException(message(name, "must be a plain URL path"));
      }
    }
    String prefixed = trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    return stripTrailingSlash(prefixed);
  }

  /**
   * Validates a short printable-ASCII value such as an OpenTelemetry resource attribute list.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum accepted length after trimming
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static String stripTrailingSlash(String value) {
    String out = value;
    while (out.length() > 1 && out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return "/".equals(out) ? "" : out;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
