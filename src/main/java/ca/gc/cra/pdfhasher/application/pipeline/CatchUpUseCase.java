package ca.gc.cra.pdfhasher.application.pipeline;

import ca.gc.cra.pdfhasher.application.ingest.ProcessingCoordinator;
import ca.gc.cra.pdfhasher.domain.ingest.ProcessingResult;
import ca.gc.cra.pdfhasher.domain.ingest.ScanSummary;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One pass over the input directory offering every candidate to the coordinator.
 * <p><strong>Why:</strong> Picks up documents dropped while no monitor was running.</p>
 * <p><strong>Role:</strong> Application use case behind the default CLI mode and the start of monitor mode.</p>
 * <p><strong>Concurrency:</strong> Serial by default; with a pool supplier, documents are processed by a bounded
 * worker pool that is shut down before {@link #scan()} returns.</p>
 * <p><strong>Error model:</strong> Per-document failures are part of the summary. A fatal {@link IOException}
 * cancels outstanding work and propagates.</p>
 *
 * @since 0.1.0
 */
public final class CatchUpUseCase {
  private static final Logger log = LoggerFactory.getLogger(CatchUpUseCase.class);

  private static final long SHUTDOWN_WAIT_SECONDS = 30;

  private final ProcessingCoordinator coordinator;
  private final Path inputDir;
  private final Supplier<ExecutorService> poolFactory;

  /**
   * Creates a serial scanner.
   *
   * @param coordinator document coordinator
   * @param inputDir watched input directory
   */
  public CatchUpUseCase(ProcessingCoordinator coordinator, Path inputDir) {
    this(coordinator, inputDir, null);
  }

  /**
   * Creates a scanner that uses a worker pool when {@code poolFactory} is non-null.
   *
   * @param coordinator document coordinator
   * @param inputDir watched input directory
   * @param poolFactory supplies a fresh pool per scan; {@code null} for serial processing
   */
  public CatchUpUseCase(
      ProcessingCoordinator coordinator, Path inputDir, Supplier<ExecutorService> poolFactory) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.inputDir = Objects.requireNonNull(inputDir, "inputDir");
    this.poolFactory = poolFactory;
  }

  /**
   * Processes every candidate currently in the input directory.
   *
   * @return per-state counts for this pass
   * @throws IOException if listing the directory or a durable write fails
   * @throws InterruptedException if interrupted
   */
  public ScanSummary scan() throws IOException, InterruptedException {
    log.info("Scanning for unprocessed documents in: {}", inputDir);
    List<Path> candidates = DocumentCandidates.list(inputDir);
    if (candidates.isEmpty()) {
      log.info("No documents found");
      return ScanSummary.of(List.of());
    }
    List<ProcessingResult> results = poolFactory == null || candidates.size() == 1
        ? processSerially(candidates)
        : processInParallel(candidates);
    ScanSummary summary = ScanSummary.of(results);
    log.info("Scan complete: {}", summary);
    return summary;
  }

  /**
   * Offers a batch of documents reported by a watcher, serially.
   *
   * @param documents candidate paths
   * @return results in input order
   * @throws IOException if a durable write fails
   * @throws InterruptedException if interrupted
   */
  public List<ProcessingResult> processSerially(List<Path> documents)
      throws IOException, InterruptedException {
    List<ProcessingResult> results = new ArrayList<>(documents.size());
    for (Path document : documents) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("scan interrupted");
      }
      results.add(coordinator.process(document));
    }
    return results;
  }

  private List<ProcessingResult> processInParallel(List<Path> documents)
      throws IOException, InterruptedException {
    ExecutorService pool = poolFactory.get();
    List<Future<ProcessingResult>> futures = new ArrayList<>(documents.size());
    try {
      for (Path document : documents) {
        Callable<ProcessingResult> task = () -> coordinator.process(document);
        futures.add(pool.submit(task));
      }
      List<ProcessingResult> results = new ArrayList<>(futures.size());
      for (Future<ProcessingResult> future : futures) {
        results.add(await(future));
      }
      return results;
    } catch (InterruptedException ex) {
      log.warn("Scan interrupted; cancelling documents not yet started");
      cancelPending(futures);
      throw ex;
    } catch (IOException | RuntimeException ex) {
      cancelPending(futures);
      throw ex;
    } finally {
      pool.shutdown();
      awaitWorkers(pool);
    }
  }

  // Documents already started finish their writes; only unstarted ones are cancelled.
  private static void awaitWorkers(ExecutorService pool) {
    try {
      while (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.info("Waiting for ingest workers to finish");
      }
      log.debug("Ingest worker pool shut down");
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static void cancelPending(List<Future<ProcessingResult>> futures) {
    for (Future<ProcessingResult> future : futures) {
      future.cancel(false);
    }
  }

  private static ProcessingResult await(Future<ProcessingResult> future)
      throws IOException, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      if (cause instanceof UncheckedIOException unchecked) {
        throw unchecked.getCause();
      }
      if (cause instanceof InterruptedException interrupted) {
        throw interrupted;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(cause);
    }
  }
}
