package ca.gc.cra.pglo.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * File guards for the import and export commands.
 *
 * @since PGLO 0.1-doc
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} names an existing, readable regular file.
   *
   * @param path candidate input file
   * @return normalized absolute path
   * @throws IllegalArgumentException if the file is missing, unreadable or not a regular file
   */
  public static Path requireReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures {@code path} can be written: the parent directory exists and is writable, and an existing file is only
   * accepted when {@code allowOverwrite} is set.
   *
   * @param path candidate output file
   * @param allowOverwrite whether an existing file may be replaced
   * @return normalized absolute path
   * @throws IllegalArgumentException if the target cannot be written
   */
  public static Path requireWritableFile(Path path, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
