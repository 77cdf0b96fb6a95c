package ca.gc.cra.pdfhasher.application.ingest;

import ca.gc.cra.pdfhasher.application.port.ClockPort;
import ca.gc.cra.pdfhasher.application.port.ContentHasher;
import ca.gc.cra.pdfhasher.application.port.DedupStorePort;
import ca.gc.cra.pdfhasher.application.port.ExtractionException;
import ca.gc.cra.pdfhasher.application.port.FontNameProvider;
import ca.gc.cra.pdfhasher.application.port.InFlightGuardPort.Guard;
import ca.gc.cra.pdfhasher.application.port.MetricsPort;
import ca.gc.cra.pdfhasher.application.port.ObjectExtractor;
import ca.gc.cra.pdfhasher.application.port.StampPort;
import ca.gc.cra.pdfhasher.domain.document.DocumentFingerprint;
import ca.gc.cra.pdfhasher.domain.document.ExtractedObject;
import ca.gc.cra.pdfhasher.domain.document.SafeNames;
import ca.gc.cra.pdfhasher.domain.ingest.DocumentState;
import ca.gc.cra.pdfhasher.domain.ingest.ProcessingResult;
import ca.gc.cra.pdfhasher.domain.table.LedgerEntry;
import ca.gc.cra.pdfhasher.domain.table.ObjectRow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Processes one document exactly once across crashes, restarts and concurrent workers.
 * <p><strong>Why:</strong> The same content may be dropped repeatedly, under different names, while several
 * invocations run; rows must be recorded once per distinct content.</p>
 * <p><strong>Role:</strong> Application service invoked by the catch-up and watch use cases.</p>
 * <p><strong>Protocol:</strong>
 * <ol>
 *   <li>Wait for the file to stop growing, then hash it.</li>
 *   <li>Skip when a live guard, a ledger entry or a matching stamp exists; a stamp without an entry is
 *   reconciled into the ledger without re-extracting.</li>
 *   <li>Acquire the guard (create-new), re-check the ledger, extract into a clean destination.</li>
 *   <li>Hash every object, store new blobs, append the rows as one batch.</li>
 *   <li>Write the stamp, then the ledger entry, then rebuild the hash-count projection.</li>
 * </ol>
 * <p><strong>Error model:</strong> Extraction, object read and metadata failures end in
 * {@link DocumentState#FAILED} and the document is retried next scan. {@link IOException} from the tables or
 * the dedup store propagates and ends the invocation.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; documents may be processed concurrently.</p>
 * <p><strong>Observability:</strong> Puts the document name under MDC key {@value #MDC_DOCUMENT}; counts
 * outcomes as {@code ingest.document.<state>}.</p>
 *
 * @since 0.1.0
 */
public final class ProcessingCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ProcessingCoordinator.class);

  /** MDC key holding the document name while it is processed. */
  public static final String MDC_DOCUMENT = "document";

  static final String METRIC_LATENCY = "ingest.document.latencyMillis";
  static final String METRIC_ROWS = "ingest.objects.rows";
  static final String METRIC_DEDUP_STORED = "ingest.dedup.stored";
  static final String METRIC_DEDUP_DUPLICATE = "ingest.dedup.duplicate";
  static final String METRIC_PROJECTION_REBUILT = "ingest.projection.rebuilt";

  private final Path objectsDir;
  private final QuiescenceProbe quiescence;
  private final ContentHasher hasher;
  private final ObjectExtractor extractor;
  private final DocumentMetadataReader metadataReader;
  private final FontNameProvider fonts;
  private final IngestStores stores;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a coordinator.
   *
   * @param objectsDir root directory holding one extraction destination per document
   * @param quiescence probe used before hashing
   * @param hasher content hasher for documents and objects
   * @param extractor object extractor
   * @param metadataReader per-document metadata source
   * @param fonts font display-name source
   * @param stores durable tables, store, guards and stamps
   * @param metrics metrics sink
   * @param clock time source for ledger timestamps and latencies
   */
  public ProcessingCoordinator(
      Path objectsDir,
      QuiescenceProbe quiescence,
      ContentHasher hasher,
      ObjectExtractor extractor,
      DocumentMetadataReader metadataReader,
      FontNameProvider fonts,
      IngestStores stores,
      MetricsPort metrics,
      ClockPort clock) {
    this.objectsDir = Objects.requireNonNull(objectsDir, "objectsDir").toAbsolutePath().normalize();
    this.quiescence = Objects.requireNonNull(quiescence, "quiescence");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.metadataReader = Objects.requireNonNull(metadataReader, "metadataReader");
    this.fonts = Objects.requireNonNull(fonts, "fonts");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Offers one document to the pipeline.
   *
   * @param document candidate document path
   * @return outcome of this attempt
   * @throws IOException if a table, the ledger or the dedup store cannot be written
   * @throws InterruptedException if interrupted while waiting for the file or the extractor
   */
  public ProcessingResult process(Path document) throws IOException, InterruptedException {
    Objects.requireNonNull(document, "document");
    Path absolute = document.toAbsolutePath().normalize();
    String fileName = absolute.getFileName().toString();
    String previous = MDC.get(MDC_DOCUMENT);
    MDC.put(MDC_DOCUMENT, fileName);
    long startedMillis = clock.nowMillis();
    try {
      ProcessingResult result = admit(absolute, fileName);
      metrics.increment(result.state().metricKey());
      if (result.state() == DocumentState.LEDGERED) {
        metrics.observe(METRIC_LATENCY, Math.max(0L, clock.nowMillis() - startedMillis));
      }
      return result;
    } finally {
      if (previous == null) {
        MDC.remove(MDC_DOCUMENT);
      } else {
        MDC.put(MDC_DOCUMENT, previous);
      }
    }
  }

  private ProcessingResult admit(Path document, String fileName)
      throws IOException, InterruptedException {
    DocumentState state = advance(DocumentState.UNSEEN, DocumentState.QUIESCING);
    if (!quiescence.awaitQuiet(document)) {
      log.warn("Skipping (vanished before hashing): {}", fileName);
      return finish(document, state, DocumentState.SKIPPED_VANISHED, null, "vanished");
    }

    DocumentFingerprint fingerprint;
    try {
      fingerprint = fingerprint(document, fileName);
    } catch (NoSuchFileException ex) {
      log.warn("Skipping (vanished while hashing): {}", fileName);
      return finish(document, state, DocumentState.SKIPPED_VANISHED, null, "vanished");
    } catch (IOException ex) {
      log.warn("Skipping (unreadable, retried next scan): {}: {}", fileName, ex.toString());
      return finish(document, state, DocumentState.SKIPPED_VANISHED, null, "unreadable");
    }
    String sha = fingerprint.sha256();

    if (stores.guards().isHeld(sha)) {
      log.info("Skipping (in-flight): {}", fileName);
      return finish(document, state, DocumentState.SKIPPED_INFLIGHT, sha, "in-flight");
    }
    if (stores.ledger().contains(sha)) {
      log.info("Skipping (already processed): {}", fileName);
      return finish(document, state, DocumentState.SKIPPED_PROCESSED, sha, "ledgered");
    }
    Path destination = objectsDir.resolve(SafeNames.forDocument(fileName));
    if (stores.stamps().matches(destination, sha)) {
      boolean appended = stores.ledger().appendIfAbsent(LedgerEntry.of(fingerprint, now()));
      if (appended) {
        log.info("Reconciled missing ledger entry from stamp: {}", fileName);
      }
      log.info("Skipping (stamp says processed): {}", fileName);
      return finish(document, state, DocumentState.SKIPPED_STAMPED_RECONCILED, sha, "stamp");
    }

    Optional<Guard> acquired = stores.guards().tryAcquire(sha);
    if (acquired.isEmpty()) {
      log.info("Skipping (in-flight, lost guard race): {}", fileName);
      return finish(document, state, DocumentState.SKIPPED_INFLIGHT, sha, "in-flight");
    }
    try (Guard guard = acquired.get()) {
      if (stores.ledger().contains(guard.sha256())) {
        log.info("Skipping (completed by another worker): {}", fileName);
        return finish(document, state, DocumentState.SKIPPED_PROCESSED, sha, "ledgered");
      }
      return extractAndRecord(document, fingerprint, destination, state);
    }
  }

  private ProcessingResult extractAndRecord(
      Path document, DocumentFingerprint fingerprint, Path destination, DocumentState quiescing)
      throws IOException, InterruptedException {
    String fileName = fingerprint.fileName();
    String sha = fingerprint.sha256();
    DocumentState state = advance(quiescing, DocumentState.EXTRACTING);

    List<Path> objectFiles;
    List<ObjectRow> rows;
    try {
      prepareDestination(destination);
      log.info("Extracting objects from: {}", fileName);
      objectFiles = objectFiles(extractor.extract(document, destination), destination);
      DocumentMetadata metadata = metadataReader.read(document, fileName);
      rows = buildRows(fileName, objectFiles, metadata);
    } catch (ExtractionException ex) {
      log.error("Extraction failed for {}: {}", fileName, ex.getMessage());
      return finish(document, state, DocumentState.FAILED, sha, ex.getMessage());
    } catch (IOException ex) {
      log.error("Reading extracted objects failed for {}", fileName, ex);
      return finish(document, state, DocumentState.FAILED, sha, ex.toString());
    } catch (RuntimeException ex) {
      log.error("Processing failed for {}", fileName, ex);
      return finish(document, state, DocumentState.FAILED, sha, ex.toString());
    }

    for (int i = 0; i < rows.size(); i++) {
      ExtractedObject object = rows.get(i).object();
      DedupStorePort.Outcome outcome =
          stores.dedupStore().store(objectFiles.get(i), object.sha256(), object.extension());
      metrics.increment(
          outcome == DedupStorePort.Outcome.STORED ? METRIC_DEDUP_STORED : METRIC_DEDUP_DUPLICATE);
    }
    stores.objectTable().append(rows);
    metrics.observe(METRIC_ROWS, rows.size());
    state = advance(state, DocumentState.ROWS_EMITTED);

    stores.stamps().write(destination, sha);
    state = advance(state, DocumentState.STAMPED);

    stores.ledger().appendIfAbsent(LedgerEntry.of(fingerprint, now()));
    state = advance(state, DocumentState.LEDGERED);

    int distinct = stores.hashCounts().rebuild();
    metrics.increment(METRIC_PROJECTION_REBUILT);
    log.debug("Hash-count projection rebuilt with {} distinct hashes", distinct);

    long recorded = stores.objectTable().countRowsFor(fileName);
    log.info("Processed {} -> {} object-rows now recorded for this document", fileName, recorded);
    return ProcessingResult.ledgered(document, sha, rows.size());
  }

  private DocumentFingerprint fingerprint(Path document, String fileName) throws IOException {
    String sha = hasher.hash(document);
    BasicFileAttributes attributes = Files.readAttributes(document, BasicFileAttributes.class);
    return new DocumentFingerprint(
        sha, fileName, attributes.size(), attributes.lastModifiedTime().toMillis() / 1000L);
  }

  private List<ObjectRow> buildRows(
      String fileName, List<Path> objectFiles, DocumentMetadata metadata) throws IOException {
    List<ObjectRow> rows = new ArrayList<>(objectFiles.size());
    for (Path file : objectFiles) {
      String extension = ExtractedObject.extensionOf(file.getFileName().toString());
      String fontName = ExtractedObject.isFontExtension(extension) ? fonts.fontName(file) : "";
      ExtractedObject object =
          new ExtractedObject(relativePath(file), hasher.hash(file), extension, fontName);
      rows.add(new ObjectRow(
          metadata.filing(), fileName, object, metadata.signatures(), metadata.authorCreator()));
    }
    return rows;
  }

  private List<Path> objectFiles(List<Path> extracted, Path destination) {
    List<Path> files = new ArrayList<>(extracted.size());
    for (Path path : extracted) {
      Path absolute = destination.resolve(path).toAbsolutePath().normalize();
      if (!absolute.startsWith(destination) || !Files.isRegularFile(absolute)) {
        continue;
      }
      if (absolute.getFileName().toString().equals(StampPort.STAMP_FILE_NAME)) {
        continue;
      }
      files.add(absolute);
    }
    files.sort(Comparator.naturalOrder());
    return files;
  }

  private String relativePath(Path file) {
    return objectsDir.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
  }

  private static void prepareDestination(Path destination) throws IOException {
    if (Files.isDirectory(destination)) {
      try (Stream<Path> walk = Files.walk(destination)) {
        List<Path> stale = walk.filter(p -> !p.equals(destination))
            .sorted(Comparator.reverseOrder())
            .toList();
        if (!stale.isEmpty()) {
          log.info("Clearing {} stale entries from {}", stale.size(), destination.getFileName());
        }
        for (Path path : stale) {
          Files.deleteIfExists(path);
        }
      }
    } else {
      Files.createDirectories(destination);
    }
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.nowMillis());
  }

  private static DocumentState advance(DocumentState from, DocumentState to) {
    if (!from.canTransitionTo(to)) {
      throw new IllegalStateException("illegal document transition " + from + " -> " + to);
    }
    log.debug("{} -> {}", from, to);
    return to;
  }

  private static ProcessingResult finish(
      Path document, DocumentState from, DocumentState outcome, String sha, String detail) {
    advance(from, outcome);
    return ProcessingResult.of(document, outcome, sha, detail);
  }
}
