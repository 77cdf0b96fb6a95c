package ca.gc.cra.pdfhasher.application.port;

import ca.gc.cra.pdfhasher.domain.table.ObjectRow;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Append-only store of object rows.
 * <p><strong>Role:</strong> Application port implemented by {@code TsvObjectTable}.</p>
 * <p><strong>Thread-safety:</strong> Appends are serialized across threads and processes by the table lock.</p>
 *
 * @since 0.1.0
 */
public interface ObjectTablePort {
  /**
   * Creates the table with the current header, or migrates a legacy table, before any append.
   *
   * @throws IOException if the table cannot be created or rewritten
   */
  void ensureLayout() throws IOException;

  /**
   * Appends rows as one locked batch, in order.
   *
   * @param rows rows for one document
   * @throws IOException if the write fails
   */
  void append(List<ObjectRow> rows) throws IOException;

  /**
   * Counts data rows recorded for a document name.
   *
   * @param documentName document base name as written in the name column
   * @return number of matching rows
   * @throws IOException if the table cannot be read
   */
  long countRowsFor(String documentName) throws IOException;

  /**
   * Runs {@code reader} over a snapshot of the data rows while holding the table lock.
   *
   * @param reader callback receiving the data rows (header excluded)
   * @param <T> callback result type
   * @return the callback result
   * @throws IOException if the table cannot be read or the callback fails
   */
  <T> T readDataRows(DataRowsReader<T> reader) throws IOException;

  /**
   * Callback for {@link #readDataRows(DataRowsReader)}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface DataRowsReader<T> {
    /**
     * Consumes the data rows.
     *
     * @param dataRows raw lines after the header
     * @return result
     * @throws IOException if the callback performs failing I/O
     */
    T read(List<String> dataRows) throws IOException;
  }
}
