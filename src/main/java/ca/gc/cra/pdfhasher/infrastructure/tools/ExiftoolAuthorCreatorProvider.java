package ca.gc.cra.pdfhasher.infrastructure.tools;

import ca.gc.cra.pdfhasher.application.port.AuthorCreatorProvider;
import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuthorCreatorProvider} backed by {@code exiftool -s -s -s -<Tag>}.
 *
 * <p>Each tag is queried separately because exiftool prints nothing for a missing tag, which would make a
 * combined query ambiguous.</p>
 *
 * @since 0.1.0
 */
public final class ExiftoolAuthorCreatorProvider implements AuthorCreatorProvider {
  private static final Logger log = LoggerFactory.getLogger(ExiftoolAuthorCreatorProvider.class);

  private final String executable;
  private final CommandRunner runner;

  /**
   * Creates the provider.
   *
   * @param executable resolved {@code exiftool} path or name
   * @param runner command runner
   */
  public ExiftoolAuthorCreatorProvider(String executable, CommandRunner runner) {
    this.executable = Objects.requireNonNull(executable, "executable");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public AuthorCreator authorCreator(Path document) {
    String path = document.toAbsolutePath().toString();
    try {
      return new AuthorCreator(tag("-Author", path), tag("-Creator", path));
    } catch (IOException ex) {
      log.warn("exiftool failed for {}: {}", document.getFileName(), ex.toString());
      return AuthorCreator.empty();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return AuthorCreator.empty();
    }
  }

  private String tag(String tag, String path) throws IOException, InterruptedException {
    CommandResult result = runner.run(List.of(executable, "-s", "-s", "-s", tag, path), null);
    return result.timedOut() ? "" : FirstLine.of(result.stdout());
  }
}
