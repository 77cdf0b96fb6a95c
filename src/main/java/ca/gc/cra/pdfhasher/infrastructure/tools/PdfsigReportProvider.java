package ca.gc.cra.pdfhasher.infrastructure.tools;

import ca.gc.cra.pdfhasher.application.port.SignatureReportProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SignatureReportProvider} returning the standard output of poppler's {@code pdfsig}.
 *
 * <p>{@code pdfsig} exits non-zero for unsigned documents, so the output is used whatever the exit code.</p>
 *
 * @since 0.1.0
 */
public final class PdfsigReportProvider implements SignatureReportProvider {
  private static final Logger log = LoggerFactory.getLogger(PdfsigReportProvider.class);

  private final String executable;
  private final CommandRunner runner;

  /**
   * Creates the provider.
   *
   * @param executable resolved {@code pdfsig} path or name
   * @param runner command runner
   */
  public PdfsigReportProvider(String executable, CommandRunner runner) {
    this.executable = Objects.requireNonNull(executable, "executable");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public String report(Path document) {
    try {
      CommandResult result = runner.run(List.of(executable, document.toAbsolutePath().toString()), null);
      return result.timedOut() ? "" : result.stdout();
    } catch (IOException ex) {
      log.warn("pdfsig failed for {}: {}", document.getFileName(), ex.toString());
      return "";
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return "";
    }
  }
}
