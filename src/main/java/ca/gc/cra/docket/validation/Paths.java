package ca.gc.cra.docket.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the export CLI.
 * <p><strong>Why:</strong> The timeline writer and the author directory loader touch the filesystem; both should
 * fail with a readable message before any network traffic is generated.
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} when resolving the output directory so a symlinked
 * target is reported instead of silently followed.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output directory, optionally creating it (and parents) when absent.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory when it does not exist
   * @return real path of the directory when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          return requireWritableParent(normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that a file exists and is readable.
   *
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path requireWritableParent(Path normalized) throws IOException {
    Path current = normalized.getParent();
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + normalized);
    }
    Path real = current.toRealPath(LinkOption.NOFOLLOW_LINKS);
    if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS) || !Files.isWritable(real)) {
      throw new IllegalArgumentException("nearest existing ancestor is not a writable directory: " + real);
    }
    return normalized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
