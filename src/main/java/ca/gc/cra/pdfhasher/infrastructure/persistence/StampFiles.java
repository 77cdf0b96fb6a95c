package ca.gc.cra.pdfhasher.infrastructure.persistence;

import ca.gc.cra.pdfhasher.application.port.StampPort;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamp files named {@value StampPort#STAMP_FILE_NAME} holding the document hash and a newline.
 *
 * @since 0.1.0
 */
public final class StampFiles implements StampPort {
  private static final Logger log = LoggerFactory.getLogger(StampFiles.class);

  @Override
  public boolean matches(Path destination, String sha256) {
    Objects.requireNonNull(sha256, "sha256");
    Path stamp = destination.resolve(STAMP_FILE_NAME);
    if (!Files.isRegularFile(stamp)) {
      return false;
    }
    try (BufferedReader reader = Files.newBufferedReader(stamp, StandardCharsets.UTF_8)) {
      String first = reader.readLine();
      return first != null && first.strip().equals(sha256);
    } catch (IOException ex) {
      log.warn("Unreadable stamp {}; treating as absent: {}", stamp, ex.toString());
      return false;
    }
  }

  @Override
  public void write(Path destination, String sha256) throws IOException {
    Objects.requireNonNull(sha256, "sha256");
    Files.createDirectories(destination);
    TsvFiles.replaceAtomically(destination.resolve(STAMP_FILE_NAME), List.of(sha256));
  }
}
