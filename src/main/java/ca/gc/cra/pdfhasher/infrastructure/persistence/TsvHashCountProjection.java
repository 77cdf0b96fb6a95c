package ca.gc.cra.pdfhasher.infrastructure.persistence;

import ca.gc.cra.pdfhasher.application.port.HashCountPort;
import ca.gc.cra.pdfhasher.application.port.ObjectTablePort;
import ca.gc.cra.pdfhasher.domain.table.HashCount;
import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hash-count projection rebuilt in full from the object table.
 *
 * <p>The objects lock is held while reading and the counts lock is taken inside it, so concurrent rebuilds
 * finish in table order and never publish an older snapshot over a newer one.</p>
 *
 * @since 0.1.0
 */
public final class TsvHashCountProjection implements HashCountPort {
  private final Path projection;
  private final NamedFileLock countsLock;
  private final ObjectTablePort objectTable;

  /**
   * Creates the adapter.
   *
   * @param projection projection file
   * @param countsLock counts lock
   * @param objectTable source table
   */
  public TsvHashCountProjection(Path projection, NamedFileLock countsLock, ObjectTablePort objectTable) {
    this.projection = Objects.requireNonNull(projection, "projection");
    this.countsLock = Objects.requireNonNull(countsLock, "countsLock");
    this.objectTable = Objects.requireNonNull(objectTable, "objectTable");
  }

  @Override
  public void ensureExists() throws IOException {
    countsLock.withLock(() -> {
      TsvFiles.createIfMissing(projection);
      return null;
    });
  }

  @Override
  public int rebuild() throws IOException {
    return objectTable.readDataRows(rows -> {
      List<HashCount> counts = HashCount.project(rows);
      List<String> lines = new ArrayList<>(counts.size());
      for (HashCount count : counts) {
        lines.add(count.toTsvLine());
      }
      return countsLock.withLock(() -> {
        TsvFiles.replaceAtomically(projection, lines);
        return counts.size();
      });
    });
  }
}
