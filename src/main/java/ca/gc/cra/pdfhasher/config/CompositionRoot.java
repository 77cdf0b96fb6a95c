package ca.gc.cra.pdfhasher.config;

import ca.gc.cra.pdfhasher.application.ingest.DocumentMetadataReader;
import ca.gc.cra.pdfhasher.application.ingest.IngestStores;
import ca.gc.cra.pdfhasher.application.ingest.ProcessingCoordinator;
import ca.gc.cra.pdfhasher.application.ingest.QuiescenceProbe;
import ca.gc.cra.pdfhasher.application.pipeline.CatchUpUseCase;
import ca.gc.cra.pdfhasher.application.pipeline.WatchUseCase;
import ca.gc.cra.pdfhasher.application.port.AuthorCreatorProvider;
import ca.gc.cra.pdfhasher.application.port.ClockPort;
import ca.gc.cra.pdfhasher.application.port.DocumentWatcher;
import ca.gc.cra.pdfhasher.application.port.FontNameProvider;
import ca.gc.cra.pdfhasher.application.port.MetricsPort;
import ca.gc.cra.pdfhasher.application.port.ObjectExtractor;
import ca.gc.cra.pdfhasher.application.port.SignatureReportProvider;
import ca.gc.cra.pdfhasher.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.pdfhasher.infrastructure.hash.Sha256ContentHasher;
import ca.gc.cra.pdfhasher.infrastructure.pdf.PdfBoxAuthorCreatorProvider;
import ca.gc.cra.pdfhasher.infrastructure.persistence.FileInFlightGuards;
import ca.gc.cra.pdfhasher.infrastructure.persistence.HashedObjectStore;
import ca.gc.cra.pdfhasher.infrastructure.persistence.StampFiles;
import ca.gc.cra.pdfhasher.infrastructure.persistence.TsvHashCountProjection;
import ca.gc.cra.pdfhasher.infrastructure.persistence.TsvLedger;
import ca.gc.cra.pdfhasher.infrastructure.persistence.TsvObjectTable;
import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import ca.gc.cra.pdfhasher.infrastructure.tools.CommandFontNameProvider;
import ca.gc.cra.pdfhasher.infrastructure.tools.CommandRunner;
import ca.gc.cra.pdfhasher.infrastructure.tools.ExiftoolAuthorCreatorProvider;
import ca.gc.cra.pdfhasher.infrastructure.tools.MutoolObjectExtractor;
import ca.gc.cra.pdfhasher.infrastructure.tools.PdfsigReportProvider;
import ca.gc.cra.pdfhasher.infrastructure.watch.NioDocumentWatcher;
import ca.gc.cra.pdfhasher.infrastructure.watch.PollingDocumentWatcher;
import ca.gc.cra.pdfhasher.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the ingest use cases to concrete adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the persisted layout and the table, store and guard adapters over it.</li>
 *   <li>Select tool adapters from the {@link ToolInventory}, substituting blank adapters for missing tools.</li>
 *   <li>Build the catch-up and watch use cases.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI bootstrap thread.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.pdfhasher.application.pipeline.CatchUpUseCase
 * @see ca.gc.cra.pdfhasher.application.pipeline.WatchUseCase
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final String WORKER_PREFIX = "pdfhasher-ingest";

  private final IngestConfig config;
  private final ToolInventory tools;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private ProcessingCoordinator coordinator;

  /**
   * Creates a composition root.
   *
   * @param config validated configuration
   * @param tools resolved external tools; {@code mutool} must be present
   * @param metrics metrics adapter shared by the use cases
   * @param clock time source
   * @throws IllegalStateException if the mandatory extractor is missing
   */
  public CompositionRoot(IngestConfig config, ToolInventory tools, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.tools = Objects.requireNonNull(tools, "tools");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    if (tools.mutool().isEmpty()) {
      throw new IllegalStateException("mandatory tool not found: " + tools.commands().mutool());
    }
  }

  /**
   * Creates the directories of the persisted layout and prepares the tables.
   *
   * @return the stores over the layout
   * @throws IOException if a table cannot be created or migrated
   * @throws IllegalArgumentException if a directory is unusable
   */
  public IngestStores prepareStores() throws IOException {
    for (Path dir : List.of(
        config.pdfDir(), config.objectsDir(), config.hashedDir(), config.lockDir(), config.inflightDir())) {
      Paths.validateWritableDir(dir);
    }
    for (Path table : List.of(config.objectsTable(), config.ledgerTable(), config.hashCountTable())) {
      Paths.validateWritableFile(table);
    }
    TsvObjectTable objectTable = new TsvObjectTable(config.objectsTable(), lock("objects.lock"));
    IngestStores stores = new IngestStores(
        objectTable,
        new TsvLedger(config.ledgerTable(), lock("processed.lock")),
        new TsvHashCountProjection(config.hashCountTable(), lock("counts.lock"), objectTable),
        new HashedObjectStore(config.hashedDir(), lock("hashed.lock")),
        new FileInFlightGuards(config.inflightDir(), config.staleAfter(), clock),
        new StampFiles());
    stores.ensureLayout();
    return stores;
  }

  /**
   * Builds, once, the coordinator over freshly prepared stores.
   *
   * @return the per-document coordinator
   * @throws IOException if the stores cannot be prepared
   */
  public ProcessingCoordinator coordinator() throws IOException {
    if (coordinator == null) {
      IngestStores stores = prepareStores();
      CommandRunner runner = new CommandRunner(config.toolTimeout());
      warnMissingTools();
      coordinator = new ProcessingCoordinator(
          config.objectsDir(),
          new QuiescenceProbe(config.quietAttempts(), config.quietIntervalMillis()),
          new Sha256ContentHasher(),
          extractor(runner),
          new DocumentMetadataReader(signatureReports(runner), authorCreator(runner)),
          fontNames(runner),
          stores,
          metrics,
          clock);
    }
    return coordinator;
  }

  /**
   * Builds the one-shot scan over the input directory.
   *
   * @return catch-up use case; parallel when {@code workers > 1}
   * @throws IOException if the stores cannot be prepared
   */
  public CatchUpUseCase catchUpUseCase() throws IOException {
    if (config.workers() <= 1) {
      return new CatchUpUseCase(coordinator(), config.pdfDir());
    }
    int workers = config.workers();
    return new CatchUpUseCase(
        coordinator(),
        config.pdfDir(),
        () -> ExecutorFactories.newIngestPool(workers, WORKER_PREFIX,
            (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
  }

  /**
   * Builds the monitor: a catch-up scan followed by watching the input directory.
   *
   * @return watch use case with its watcher already registered
   * @throws IOException if the stores cannot be prepared or a native watch is required but unavailable
   */
  public WatchUseCase watchUseCase() throws IOException {
    CatchUpUseCase catchUp = catchUpUseCase();
    return new WatchUseCase(catchUp, documentWatcher(), config.pdfDir());
  }

  DocumentWatcher documentWatcher() throws IOException {
    switch (config.watchMode()) {
      case NATIVE:
        return new NioDocumentWatcher(config.pdfDir(), config.watchDebounceMillis());
      case POLL:
        return polling();
      case AUTO:
      default:
        try {
          return new NioDocumentWatcher(config.pdfDir(), config.watchDebounceMillis());
        } catch (IOException | UnsupportedOperationException ex) {
          log.warn("Native file watching unavailable ({}); polling every {}s instead",
              ex.toString(), config.pollInterval().toSeconds());
          return polling();
        }
    }
  }

  private DocumentWatcher polling() {
    return new PollingDocumentWatcher(config.pdfDir(), config.pollInterval());
  }

  private NamedFileLock lock(String name) {
    return new NamedFileLock(config.lockDir().resolve(name));
  }

  private ObjectExtractor extractor(CommandRunner runner) {
    return new MutoolObjectExtractor(tools.mutool().orElseThrow().toString(), runner);
  }

  private SignatureReportProvider signatureReports(CommandRunner runner) {
    return tools.pdfsig()
        .<SignatureReportProvider>map(exe -> new PdfsigReportProvider(exe.toString(), runner))
        .orElse(SignatureReportProvider.NONE);
  }

  private AuthorCreatorProvider authorCreator(CommandRunner runner) {
    Optional<Path> exiftool = tools.exiftool();
    switch (config.metadataProvider()) {
      case PDFBOX:
        return new PdfBoxAuthorCreatorProvider();
      case EXIFTOOL:
        return exiftool
            .<AuthorCreatorProvider>map(exe -> new ExiftoolAuthorCreatorProvider(exe.toString(), runner))
            .orElse(AuthorCreatorProvider.BLANK);
      case AUTO:
      default:
        return exiftool
            .<AuthorCreatorProvider>map(exe -> new ExiftoolAuthorCreatorProvider(exe.toString(), runner))
            .orElseGet(PdfBoxAuthorCreatorProvider::new);
    }
  }

  private FontNameProvider fontNames(CommandRunner runner) {
    String otfinfo = tools.otfinfo().map(Path::toString).orElse(null);
    String fcScan = tools.fcScan().map(Path::toString).orElse(null);
    if (otfinfo == null && fcScan == null) {
      return FontNameProvider.NONE;
    }
    return new CommandFontNameProvider(otfinfo, fcScan, runner);
  }

  private void warnMissingTools() {
    List<String> missing = tools.missingOptional();
    if (!missing.isEmpty()) {
      log.warn("Optional tools not found, falling back to PDFBox or blank columns: {}", String.join(", ", missing));
    }
  }
}
