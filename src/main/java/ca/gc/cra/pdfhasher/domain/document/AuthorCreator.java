package ca.gc.cra.pdfhasher.domain.document;

/**
 * Author and creator strings from a document's information dictionary.
 *
 * @param author document author; empty when unavailable
 * @param creator creating application; empty when unavailable
 * @since 0.1.0
 */
public record AuthorCreator(String author, String creator) {
  private static final AuthorCreator EMPTY = new AuthorCreator("", "");

  public AuthorCreator {
    author = author == null ? "" : author.strip();
    creator = creator == null ? "" : creator.strip();
  }

  /**
   * Returns blank author and creator.
   *
   * @return shared empty value
   */
  public static AuthorCreator empty() {
    return EMPTY;
  }
}
