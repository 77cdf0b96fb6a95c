package ca.gc.cra.pdfhasher.infrastructure.persistence;

import ca.gc.cra.pdfhasher.application.port.ObjectTablePort;
import ca.gc.cra.pdfhasher.domain.table.ObjectRow;
import ca.gc.cra.pdfhasher.domain.table.ObjectsSchema;
import ca.gc.cra.pdfhasher.domain.table.TsvFields;
import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tab-separated object table with a fixed header.
 * <p><strong>Layout:</strong> One header line followed by one line per extracted object in
 * {@link ObjectsSchema#CURRENT_HEADER} column order.</p>
 * <p><strong>Migration:</strong> A table still carrying the legacy five-column header is rewritten once, through
 * a temp file and rename, before any append. Custom headers are left untouched.</p>
 * <p><strong>Thread-safety:</strong> Every operation runs under the objects lock.</p>
 *
 * @since 0.1.0
 */
public final class TsvObjectTable implements ObjectTablePort {
  private static final Logger log = LoggerFactory.getLogger(TsvObjectTable.class);

  private final Path table;
  private final NamedFileLock lock;

  /**
   * Creates the adapter.
   *
   * @param table table file
   * @param lock objects lock
   */
  public TsvObjectTable(Path table, NamedFileLock lock) {
    this.table = Objects.requireNonNull(table, "table");
    this.lock = Objects.requireNonNull(lock, "lock");
  }

  @Override
  public void ensureLayout() throws IOException {
    lock.withLock(() -> {
      TsvFiles.createIfMissing(table);
      String first = TsvFiles.firstLine(table);
      switch (ObjectsSchema.classify(first)) {
        case EMPTY -> {
          TsvFiles.replaceAtomically(table, List.of(ObjectsSchema.CURRENT_HEADER));
          log.info("Created object table {}", table);
        }
        case LEGACY_FIVE_COLUMN -> migrateLegacy();
        case CUSTOM -> log.warn(
            "Object table {} has an unrecognized header; leaving it untouched and appending current-schema rows",
            table);
        case CURRENT -> log.debug("Object table {} already uses the current schema", table);
      }
      return null;
    });
  }

  private void migrateLegacy() throws IOException {
    List<String> lines = TsvFiles.readLines(table);
    List<String> migrated = new ArrayList<>(lines.size());
    migrated.add(ObjectsSchema.CURRENT_HEADER);
    for (int i = 1; i < lines.size(); i++) {
      migrated.add(ObjectsSchema.migrateLegacyRow(lines.get(i)));
    }
    TsvFiles.replaceAtomically(table, migrated);
    log.info("Migrated {} rows of {} from the five-column layout", migrated.size() - 1, table);
  }

  @Override
  public void append(List<ObjectRow> rows) throws IOException {
    Objects.requireNonNull(rows, "rows");
    if (rows.isEmpty()) {
      return;
    }
    List<String> lines = new ArrayList<>(rows.size());
    for (ObjectRow row : rows) {
      lines.add(row.toTsvLine());
    }
    lock.withLock(() -> {
      TsvFiles.appendLines(table, lines);
      return null;
    });
  }

  @Override
  public long countRowsFor(String documentName) throws IOException {
    Objects.requireNonNull(documentName, "documentName");
    return readDataRows(rows -> {
      long count = 0;
      for (String row : rows) {
        String[] fields = TsvFields.split(row);
        if (fields.length > ObjectsSchema.DOCUMENT_NAME_COLUMN
            && fields[ObjectsSchema.DOCUMENT_NAME_COLUMN].equals(documentName)) {
          count++;
        }
      }
      return count;
    });
  }

  @Override
  public <T> T readDataRows(DataRowsReader<T> reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    return lock.withLock(() -> {
      List<String> lines = Files.exists(table) ? TsvFiles.readLines(table) : List.of();
      List<String> dataRows = lines.size() <= 1 ? List.of() : lines.subList(1, lines.size());
      return reader.read(dataRows);
    });
  }
}
