package ca.gc.cra.scribe.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for SCRIBE CLI and configuration flows.
 * <p><strong>Why:</strong> Outputs must not silently overwrite an earlier run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths and reject control characters.</li>
 *   <li>Guard against reusing populated output directories unless explicitly approved.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Observability:</strong> Emits nothing; callers surface the {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates (and optionally creates) a writable output directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing create the directory when absent
   * @param allowReuse accept a non-empty existing directory
   * @return real path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException when the directory is unusable
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath();
        ensureWritableDirectory(real, allowReuse);
        return real;
      }
      Path parent = nearestExistingAncestor(normalized);
      if (!Files.isDirectory(parent) || !Files.isWritable(parent)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parent);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        return normalized.toRealPath();
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureWritableDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start.getParent();
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}
