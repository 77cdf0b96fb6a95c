package ca.gc.cra.pdfhasher.application.port;

import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import java.nio.file.Path;

/**
 * Reads the author and creator recorded in a document's information dictionary.
 *
 * <p>Implementations return {@link AuthorCreator#empty()} when the metadata or the tool is unavailable.</p>
 *
 * @since 0.1.0
 */
public interface AuthorCreatorProvider {
  /**
   * Returns author and creator for a document.
   *
   * @param document document path
   * @return metadata; never {@code null}
   */
  AuthorCreator authorCreator(Path document);

  /** Provider that always answers blank values. */
  AuthorCreatorProvider BLANK = document -> AuthorCreator.empty();
}
