package ca.gc.cra.pdfhasher.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for configured directories.
 * <p><strong>Why:</strong> The ingest pipeline writes tables, blobs and lock files under configured
 * locations; rejecting unusable paths before the first scan keeps partial state off disk.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may still change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a configured path, rejecting null bytes and control characters.
   *
   * @param name logical key name for diagnostics
   * @param raw textual path
   * @return parsed path, not yet resolved against any base
   * @throws IllegalArgumentException if the text is blank or unusable as a path
   */
  public static Path parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    if (text.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(text);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a writable directory, creating it and its parents when absent.
   *
   * @param path candidate directory; must not be {@code null}
   * @return absolute normalized path of the directory
   * @throws IllegalArgumentException if the path exists but is not a writable directory, or creation fails
   */
  public static Path validateWritableDir(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a file location can be created: its parent must be, or become, a writable directory,
   * and the path itself must not be a directory.
   *
   * @param path candidate file path
   * @return absolute normalized path
   * @throws IllegalArgumentException if the location is unusable
   */
  public static Path validateWritableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is a directory, expected a file: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    validateWritableDir(parent);
    if (Files.exists(normalized) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("file is not writable: " + normalized);
    }
    return normalized;
  }
}
