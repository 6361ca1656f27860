package ca.gc.cra.warden.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for WARDEN CLI and configuration flows.
 * <p><strong>Why:</strong> Report files are written only to writable locations and never silently
 * replace an earlier report.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to absolute, canonical form.</li>
 *   <li>Confirm inputs exist and are readable regular files.</li>
 *   <li>Guard against overwriting existing report files unless explicitly approved.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked report target is refused.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing readable regular file.
   *
   * @param name parameter name for diagnostics
   * @param path candidate file
   * @return canonical path
   * @throws IllegalArgumentException when the file is missing or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    checkSyntax(name, path);
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " must be an existing file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates an output file location.
   *
   * @param name parameter name for diagnostics
   * @param path candidate output file
   * @param createParents whether missing parent directories are created
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the target is a directory or symlink, the parent is not writable,
   *     or the file exists and overwriting is not allowed
   */
  public static Path validateWritableFile(String name, Path path, boolean createParents, boolean allowOverwrite) {
    checkSyntax(name, path);
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException(name + " must be a regular file: " + normalized);
        }
        if (!allowOverwrite) {
          throw new IllegalArgumentException(
              name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
        }
        if (!Files.isWritable(normalized)) {
          throw new IllegalArgumentException(name + " is not writable: " + normalized);
        }
        return normalized;
      }

      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException(name + " has no parent to validate: " + normalized);
      }
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        if (!createParents) {
          Path ancestor = nearestExistingAncestor(parent);
          if (!Files.isWritable(ancestor)) {
            throw new IllegalArgumentException("directory is not writable: " + ancestor);
          }
          return normalized;
        }
        Files.createDirectories(parent);
      }
      if (!Files.isDirectory(parent)) {
        throw new IllegalArgumentException("parent is not a directory: " + parent);
      }
      if (!Files.isWritable(parent)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parent);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void checkSyntax(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}
