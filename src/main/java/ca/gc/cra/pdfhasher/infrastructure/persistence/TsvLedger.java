package ca.gc.cra.pdfhasher.infrastructure.persistence;

import ca.gc.cra.pdfhasher.application.port.LedgerPort;
import ca.gc.cra.pdfhasher.domain.table.LedgerEntry;
import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only ledger of completed documents, one header-less line per document.
 *
 * <p>Every read validates all lines, so a corrupt ledger is reported on the first lookup rather than when the
 * bad line happens to be reached.</p>
 *
 * @since 0.1.0
 */
public final class TsvLedger implements LedgerPort {
  private static final Logger log = LoggerFactory.getLogger(TsvLedger.class);

  private final Path ledger;
  private final NamedFileLock lock;

  /**
   * Creates the adapter.
   *
   * @param ledger ledger file
   * @param lock processed lock
   */
  public TsvLedger(Path ledger, NamedFileLock lock) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.lock = Objects.requireNonNull(lock, "lock");
  }

  @Override
  public void ensureExists() throws IOException {
    lock.withLock(() -> {
      TsvFiles.createIfMissing(ledger);
      return null;
    });
  }

  @Override
  public boolean contains(String sha256) throws IOException {
    Objects.requireNonNull(sha256, "sha256");
    return lock.withLock(() -> containsUnlocked(sha256));
  }

  @Override
  public boolean appendIfAbsent(LedgerEntry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    return lock.withLock(() -> {
      if (containsUnlocked(entry.sha256())) {
        log.debug("Ledger already records {}", entry.sha256());
        return false;
      }
      TsvFiles.appendLines(ledger, List.of(entry.toTsvLine()));
      return true;
    });
  }

  private boolean containsUnlocked(String sha256) throws IOException {
    List<String> lines = TsvFiles.readLines(ledger);
    boolean found = false;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (line.isBlank()) {
        continue;
      }
      if (LedgerEntry.hashOf(line, i + 1L).equals(sha256)) {
        found = true;
      }
    }
    return found;
  }
}
