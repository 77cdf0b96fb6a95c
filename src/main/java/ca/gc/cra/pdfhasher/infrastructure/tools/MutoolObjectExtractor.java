package ca.gc.cra.pdfhasher.infrastructure.tools;

import ca.gc.cra.pdfhasher.application.port.ExtractionException;
import ca.gc.cra.pdfhasher.application.port.ObjectExtractor;
import ca.gc.cra.pdfhasher.application.port.StampPort;
import ca.gc.cra.pdfhasher.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ObjectExtractor} running {@code mutool extract <document>} inside the destination.
 * <p><strong>Contract:</strong> {@code mutool} writes images and fonts into its working directory. A non-zero exit
 * that still produced files is logged and the files are used; a run that produced nothing, timed out or could
 * not start raises {@link ExtractionException}.</p>
 *
 * @since 0.1.0
 */
public final class MutoolObjectExtractor implements ObjectExtractor {
  private static final Logger log = LoggerFactory.getLogger(MutoolObjectExtractor.class);
  private static final int MAX_LOGGED_STDERR_BYTES = 2048;

  private final String executable;
  private final CommandRunner runner;

  /**
   * Creates the extractor.
   *
   * @param executable resolved {@code mutool} path or name
   * @param runner command runner
   */
  public MutoolObjectExtractor(String executable, CommandRunner runner) {
    this.executable = Objects.requireNonNull(executable, "executable");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public List<Path> extract(Path document, Path destination)
      throws ExtractionException, InterruptedException {
    CommandResult result;
    try {
      result = runner.run(
          List.of(executable, "extract", document.toAbsolutePath().toString()), destination);
    } catch (IOException ex) {
      throw new ExtractionException("could not run mutool: " + ex.getMessage(), ex);
    }
    if (result.timedOut()) {
      throw new ExtractionException(
          "mutool timed out after " + runner.timeout().toSeconds() + "s");
    }
    List<Path> files;
    try {
      files = listFiles(destination);
    } catch (IOException ex) {
      throw new ExtractionException("could not list extracted objects: " + ex.getMessage(), ex);
    }
    if (result.exitCode() != 0) {
      String stderr = Logs.truncate(Logs.oneLine(result.stderr()), MAX_LOGGED_STDERR_BYTES);
      if (files.isEmpty()) {
        throw new ExtractionException("mutool exited with " + result.exitCode() + ": " + stderr);
      }
      log.warn("mutool exited with {} after extracting {} objects; keeping partial output: {}",
          result.exitCode(), files.size(), stderr);
    }
    return files;
  }

  private static List<Path> listFiles(Path destination) throws IOException {
    try (Stream<Path> walk = Files.walk(destination)) {
      return walk.filter(Files::isRegularFile)
          .filter(p -> !p.getFileName().toString().equals(StampPort.STAMP_FILE_NAME))
          .sorted()
          .collect(Collectors.toList());
    }
  }
}
