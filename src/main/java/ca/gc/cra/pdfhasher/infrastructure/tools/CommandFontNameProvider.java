package ca.gc.cra.pdfhasher.infrastructure.tools;

import ca.gc.cra.pdfhasher.application.port.FontNameProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FontNameProvider} asking {@code otfinfo -i} for the {@code Full name:} line, then
 * {@code fc-scan --format %{family}} when otfinfo is missing or reports nothing.
 *
 * @since 0.1.0
 */
public final class CommandFontNameProvider implements FontNameProvider {
  private static final Logger log = LoggerFactory.getLogger(CommandFontNameProvider.class);
  private static final String FULL_NAME_LABEL = "Full name:";

  private final String otfinfo;
  private final String fcScan;
  private final CommandRunner runner;

  /**
   * Creates the provider; at least one tool should be present.
   *
   * @param otfinfo resolved {@code otfinfo}, or {@code null} when missing
   * @param fcScan resolved {@code fc-scan}, or {@code null} when missing
   * @param runner command runner
   */
  public CommandFontNameProvider(String otfinfo, String fcScan, CommandRunner runner) {
    this.otfinfo = otfinfo;
    this.fcScan = fcScan;
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public String fontName(Path fontFile) {
    String path = fontFile.toAbsolutePath().toString();
    try {
      if (otfinfo != null) {
        CommandResult result = runner.run(List.of(otfinfo, "-i", path), null);
        String name = result.timedOut() ? "" : FirstLine.afterLabel(result.stdout(), FULL_NAME_LABEL);
        if (!name.isEmpty()) {
          return name;
        }
      }
      if (fcScan != null) {
        CommandResult result = runner.run(List.of(fcScan, "--format", "%{family}\n", path), null);
        return result.timedOut() ? "" : FirstLine.of(result.stdout());
      }
    } catch (IOException ex) {
      log.warn("Font name lookup failed for {}: {}", fontFile.getFileName(), ex.toString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    return "";
  }
}
