package ca.gc.cra.pdfhasher.application.port;

import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port that explodes a document into its embedded objects on disk.
 * <p><strong>Role:</strong> Mandatory external collaborator; {@code MutoolObjectExtractor} is the production
 * adapter.</p>
 * <p><strong>Contract:</strong> Best effort. Partial output after an internal tool failure is returned as-is;
 * only a run that leaves no usable file is reported as {@link ExtractionException}.</p>
 *
 * @since 0.1.0
 */
public interface ObjectExtractor {
  /**
   * Extracts the document's objects into {@code destination}.
   *
   * @param document absolute path of the document
   * @param destination existing, empty directory receiving the objects
   * @return regular files produced, in any order
   * @throws ExtractionException if the extractor could not run or produced no files
   * @throws InterruptedException if the calling thread is interrupted while waiting for the extractor
   */
  List<Path> extract(Path document, Path destination) throws ExtractionException, InterruptedException;
}
