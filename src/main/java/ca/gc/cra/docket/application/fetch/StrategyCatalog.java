package ca.gc.cra.docket.application.fetch;

import ca.gc.cra.docket.validation.Strings;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Ranked candidate routes for every collection the export reads.
 * <p><strong>Why:</strong> Upstream tenants expose notes, emails, and comments under different routes and verbs;
 * the order below runs from the route most tenants answer to the rarest.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class StrategyCatalog {
  private final String apiBase;
  private final String apiPrefix;

  /**
   * Creates a catalog.
   *
   * @param apiBase scheme and host, e.g. {@code https://api.example.com}
   * @param apiPrefix versioned path prefix, e.g. {@code /fv-app/v2}; may be empty
   */
  public StrategyCatalog(String apiBase, String apiPrefix) {
    this.apiBase = Strings.requireHttpBase("apiBase", apiBase);
    this.apiPrefix = Strings.requirePathPrefix("apiPrefix", apiPrefix);
  }

  /**
   * Lists the candidate strategies for a scope in priority order.
   *
   * @param scope collection to fetch
   * @return ordered candidates; never empty
   */
  public List<FetchStrategy> candidates(CollectionScope scope) {
    return switch (scope.kind()) {
      case NOTES, EMAILS -> topLevel(scope.kind(), scope.projectId());
      case COMMENTS -> comments(scope.projectId(), scope.parentId(), scope.link());
    };
  }

  /**
   * URI of the single-user lookup route.
   *
   * @param userId opaque user id
   * @return absolute URI of {@code /users/{id}}
   */
  public URI userLookup(String userId) {
    return URI.create(apiRoot() + "/users/" + segment(userId));
  }

  /**
   * Absolutizes an href advertised by the upstream.
   *
   * <p>Absolute {@code http(s)} links are returned unchanged; root-relative links are placed under the API base
   * and prefix; other relative links are resolved against {@code relativeTo}.</p>
   *
   * @param href link text
   * @param relativeTo base used for relative links without a leading slash
   * @return absolute URI, or empty if the link is blank or malformed
   */
  public Optional<URI> absolutize(String href, String relativeTo) {
    if (href == null || href.isBlank()) {
      return Optional.empty();
    }
    String trimmed = href.trim();
    String candidate;
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      candidate = trimmed;
    } else if (trimmed.startsWith("/")) {
      candidate = apiBase + (apiPrefix.isEmpty() || trimmed.startsWith(apiPrefix + "/") ? "" : apiPrefix) + trimmed;
    } else {
      candidate = relativeTo + "/" + trimmed;
    }
    try {
      return Optional.of(URI.create(candidate));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  /** Base URL plus prefix, e.g. {@code https://api.example.com/fv-app/v2}. */
  public String apiRoot() {
    return apiBase + apiPrefix;
  }

  /**
   * Project-scoped root, e.g. {@code https://api.example.com/fv-app/v2/projects/7}.
   *
   * @param projectId project id
   * @return project root URL
   */
  public String projectRoot(String projectId) {
    return apiRoot() + "/projects/" + segment(projectId);
  }

  private List<FetchStrategy> topLevel(CollectionKind kind, String projectId) {
    String p = projectRoot(projectId);
    String name = kind.plural();
    List<FetchStrategy> out = new ArrayList<>();
    out.add(FetchStrategy.get(URI.create(p + "/" + name)));
    out.add(FetchStrategy.get(URI.create(p + "/activity/" + name)));
    out.add(FetchStrategy.get(URI.create(p + "/activity?types=" + kind.singular())));
    out.add(FetchStrategy.get(URI.create(p + "/" + name + "/list")));
    out.add(FetchStrategy.post(URI.create(p + "/" + name), Map.of()));
    out.add(FetchStrategy.post(URI.create(p + "/" + name + "/list"), Map.of()));
    return List.copyOf(out);
  }

  private List<FetchStrategy> comments(String projectId, String noteId, Optional<String> link) {
    String p = projectRoot(projectId);
    String n = segment(noteId);
    String parentQuery = "parentType=note&parentId=" + n;
    Map<String, Object> parentBody = new LinkedHashMap<>();
    parentBody.put("parentType", "note");
    parentBody.put("parentId", noteId);

    List<FetchStrategy> out = new ArrayList<>();
    link.flatMap(href -> absolutize(href, p)).ifPresent(uri -> out.add(FetchStrategy.get(uri)));
    out.add(FetchStrategy.get(URI.create(apiBase + "/notes/" + n + "/comments")));
    out.add(FetchStrategy.get(URI.create(apiRoot() + "/notes/" + n + "/comments")));
    out.add(FetchStrategy.get(URI.create(p + "/notes/" + n + "/comments")));
    out.add(FetchStrategy.get(URI.create(p + "/notes/" + n + "/replies")));
    out.add(FetchStrategy.post(URI.create(p + "/notes/" + n + "/comments"), Map.of()));
    out.add(FetchStrategy.get(URI.create(p + "/comments?" + parentQuery)));
    out.add(FetchStrategy.get(URI.create(p + "/comments/list?" + parentQuery)));
    out.add(FetchStrategy.post(URI.create(p + "/comments"), parentBody));
    out.add(FetchStrategy.post(URI.create(p + "/comments/list"), parentBody));
    out.add(FetchStrategy.get(URI.create(p + "/activity?types=comment&" + parentQuery)));
    return List.copyOf(out);
  }

  private static String segment(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
