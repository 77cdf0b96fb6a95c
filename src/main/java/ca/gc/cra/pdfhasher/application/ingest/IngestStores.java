package ca.gc.cra.pdfhasher.application.ingest;

import ca.gc.cra.pdfhasher.application.port.DedupStorePort;
import ca.gc.cra.pdfhasher.application.port.HashCountPort;
import ca.gc.cra.pdfhasher.application.port.InFlightGuardPort;
import ca.gc.cra.pdfhasher.application.port.LedgerPort;
import ca.gc.cra.pdfhasher.application.port.ObjectTablePort;
import ca.gc.cra.pdfhasher.application.port.StampPort;
import java.io.IOException;
import java.util.Objects;

/**
 * Durable state touched while processing a document.
 *
 * @param objectTable main object table
 * @param ledger completion ledger
 * @param hashCounts hash frequency projection
 * @param dedupStore content-addressed blob store
 * @param guards in-flight guards
 * @param stamps per-destination completion stamps
 * @since 0.1.0
 */
public record IngestStores(
    ObjectTablePort objectTable,
    LedgerPort ledger,
    HashCountPort hashCounts,
    DedupStorePort dedupStore,
    InFlightGuardPort guards,
    StampPort stamps) {
  public IngestStores {
    Objects.requireNonNull(objectTable, "objectTable");
    Objects.requireNonNull(ledger, "ledger");
    Objects.requireNonNull(hashCounts, "hashCounts");
    Objects.requireNonNull(dedupStore, "dedupStore");
    Objects.requireNonNull(guards, "guards");
    Objects.requireNonNull(stamps, "stamps");
  }

  /**
   * Creates missing tables and runs the object table migration.
   *
   * @throws IOException if any table cannot be prepared
   */
  public void ensureLayout() throws IOException {
    objectTable.ensureLayout();
    ledger.ensureExists();
    hashCounts.ensureExists();
  }
}
