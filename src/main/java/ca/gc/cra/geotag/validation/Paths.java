package ca.gc.cra.geotag.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File system checks applied to configured paths before a run starts.
 * <p>All methods normalize to absolute paths and throw {@link IllegalArgumentException} describing the
 * offending path; the CLI maps those to a configuration error.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {}

  /**
   * Requires an existing directory, optionally writable.
   *
   * @param name configuration key for messages
   * @param path candidate directory
   * @param writable whether write access is required
   * @return normalized absolute path
   */
  public static Path requireDirectory(String name, Path path, boolean writable) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (writable && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Requires an existing readable regular file.
   *
   * @param name configuration key for messages
   * @param path candidate file
   * @return normalized absolute path
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Requires a file path whose parent directory exists and is writable; the file itself may be absent.
   *
   * @param name configuration key for messages
   * @param path candidate output file
   * @return normalized absolute path
   */
  public static Path requireWritableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " points at a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + normalized);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    if (Files.exists(normalized) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " file is not writable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
