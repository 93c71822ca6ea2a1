package ca.gc.cra.ftrace.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks run before the import opens its input and output.
 * <p><strong>Why:</strong> Failing before a long import starts gives operators a precise message instead of a
 * half-written output directory.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require the trace input to be a readable regular file.</li>
 *   <li>Require the output directory to be writable, creating it on request, and refuse to reuse a populated
 *   directory unless allowed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the filesystem at call time.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked output directory is resolved explicitly.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {}

  /**
   * Validates a readable regular file.
   *
   * @param name parameter name used in error messages
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output directory.
   *
   * @param path candidate directory
   * @param createIfMissing whether to create the directory and its parents when absent
   * @param allowReuse whether an existing non-empty directory is acceptable
   * @return real path of the directory when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the directory cannot be used
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize("out", path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          requireWritableAncestor(normalized);
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      if (!allowReuse && !isEmpty(real)) {
        throw new IllegalArgumentException(
            "directory " + real + " is not empty; re-run with --allow-overwrite to reuse");
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static void requireWritableAncestor(Path path) {
    Path current = path.getParent();
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null || !Files.isDirectory(current) || !Files.isWritable(current)) {
      throw new IllegalArgumentException("no writable parent directory for " + path);
    }
  }

  private static boolean isEmpty(Path dir) throws IOException {
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      return !entries.iterator().hasNext();
    }
  }
}
