package ca.gc.cra.pdfhasher.infrastructure.tools;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves tool names against the {@code PATH} the way a shell would.
 *
 * @since 0.1.0
 */
public final class ToolLocator {
  private final List<Path> searchPath;
  private final List<String> suffixes;

  /**
   * Creates a locator over an explicit search path.
   *
   * @param pathVariable value in {@code PATH} syntax; {@code null} searches nothing
   * @param windows whether Windows executable suffixes apply
   */
  public ToolLocator(String pathVariable, boolean windows) {
    List<Path> dirs = new ArrayList<>();
    if (pathVariable != null) {
      for (String entry : pathVariable.split(File.pathSeparator)) {
        if (!entry.isBlank()) {
          dirs.add(Path.of(entry.strip()));
        }
      }
    }
    this.searchPath = List.copyOf(dirs);
    this.suffixes = windows ? List.of("", ".exe", ".bat", ".cmd") : List.of("");
  }

  /**
   * Creates a locator over the process environment.
   *
   * @return locator using {@code PATH}
   */
  public static ToolLocator fromEnvironment() {
    boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    return new ToolLocator(System.getenv("PATH"), windows);
  }

  /**
   * Finds an executable.
   *
   * @param command bare tool name or explicit path
   * @return the executable, or empty when not installed
   */
  public Optional<Path> locate(String command) {
    if (command == null || command.isBlank()) {
      return Optional.empty();
    }
    String name = command.strip();
    if (name.contains("/") || name.contains(File.separator)) {
      Path explicit = Path.of(name);
      return isExecutable(explicit) ? Optional.of(explicit.toAbsolutePath()) : Optional.empty();
    }
    for (Path dir : searchPath) {
      for (String suffix : suffixes) {
        Path candidate = dir.resolve(name + suffix);
        if (isExecutable(candidate)) {
          return Optional.of(candidate);
        }
      }
    }
    return Optional.empty();
  }

  private static boolean isExecutable(Path candidate) {
    return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
  }
}
