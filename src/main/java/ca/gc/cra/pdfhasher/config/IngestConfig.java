package ca.gc.cra.pdfhasher.config;

import ca.gc.cra.pdfhasher.validation.Numbers;
import ca.gc.cra.pdfhasher.validation.Paths;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable, validated configuration of the ingest pipeline.
 * <p><strong>Paths:</strong> Every location is absolute; relative values are resolved against {@code root}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class IngestConfig {
  private static final long MAX_SECONDS = 86_400L;

  private final Path root;
  private final Path pdfDir;
  private final Path objectsDir;
  private final Path hashedDir;
  private final Path objectsTable;
  private final Path ledgerTable;
  private final Path hashCountTable;
  private final Path lockDir;
  private final Duration pollInterval;
  private final int quietAttempts;
  private final long quietIntervalMillis;
  private final Duration staleAfter;
  private final int workers;
  private final WatchMode watchMode;
  private final long watchDebounceMillis;
  private final MetadataProvider metadataProvider;
  private final ToolCommands tools;
  private final Duration toolTimeout;

  private IngestConfig(Map<String, String> args) {
    this.root = Paths.parse("root", args.getOrDefault("root", ".")).toAbsolutePath().normalize();
    this.pdfDir = resolve(args, "pdfDir", "pdf");
    this.objectsDir = resolve(args, "objectsDir", "pdf-objects");
    this.hashedDir = resolve(args, "hashedDir", "hashed-objects");
    this.objectsTable = resolve(args, "objectsTable", "objects.tsv");
    this.ledgerTable = resolve(args, "ledgerTable", "processed.tsv");
    this.hashCountTable = resolve(args, "hashCountTable", "hash-count.tsv");
    this.lockDir = resolve(args, "lockDir", ".locks");
    this.pollInterval = Duration.ofSeconds(number(args, "pollSeconds", "5", 1, MAX_SECONDS));
    this.quietAttempts = (int) number(args, "quiet.attempts", "10", 1, 1_000);
    this.quietIntervalMillis = number(args, "quiet.intervalMillis", "300", 0, 60_000);
    this.staleAfter =
        Duration.ofMinutes(number(args, "inflight.staleAfterMinutes", "720", 0, 525_600));
    this.workers = (int) number(args, "workers", "1", 1, 64);
    this.watchMode = WatchMode.fromString(args.get("watch.mode"));
    this.watchDebounceMillis = number(args, "watch.debounceMillis", "500", 0, 60_000);
    this.metadataProvider = MetadataProvider.fromString(args.get("metadata.provider"));
    this.tools = ToolCommands.fromMap(args);
    this.toolTimeout = Duration.ofSeconds(number(args, "tools.timeoutSeconds", "120", 1, MAX_SECONDS));
    requireDistinct();
  }

  /**
   * Materializes a merged flat map.
   *
   * @param args effective configuration, usually from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing, malformed or out of range
   */
  public static IngestConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    return new IngestConfig(args);
  }

  /**
   * Returns the configuration built from defaults only, rooted at the working directory.
   *
   * @return default configuration
   */
  public static IngestConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap(DefaultsForMode.INGEST));
  }

  private Path resolve(Map<String, String> args, String key, String fallback) {
    Path configured = Paths.parse(key, args.getOrDefault(key, fallback));
    return root.resolve(configured).toAbsolutePath().normalize();
  }

  private static long number(Map<String, String> args, String key, String fallback, long min, long max) {
    String raw = args.get(key);
    return Numbers.parseInRange(key, raw == null || raw.isBlank() ? fallback : raw, min, max);
  }

  private void requireDistinct() {
    Map<Path, String> seen = new LinkedHashMap<>();
    for (Map.Entry<String, Path> entry : layout().entrySet()) {
      String previous = seen.putIfAbsent(entry.getValue(), entry.getKey());
      if (previous != null) {
        throw new IllegalArgumentException(
            entry.getKey() + " and " + previous + " resolve to the same path " + entry.getValue());
      }
    }
  }

  /**
   * Returns every persisted location keyed by its configuration name, in layout order.
   *
   * @return ordered map of key to absolute path
   */
  public Map<String, Path> layout() {
    Map<String, Path> map = new LinkedHashMap<>();
    map.put("pdfDir", pdfDir);
    map.put("objectsDir", objectsDir);
    map.put("hashedDir", hashedDir);
    map.put("objectsTable", objectsTable);
    map.put("ledgerTable", ledgerTable);
    map.put("hashCountTable", hashCountTable);
    map.put("lockDir", lockDir);
    return map;
  }

  public Path root() {
    return root;
  }

  public Path pdfDir() {
    return pdfDir;
  }

  public Path objectsDir() {
    return objectsDir;
  }

  public Path hashedDir() {
    return hashedDir;
  }

  public Path objectsTable() {
    return objectsTable;
  }

  public Path ledgerTable() {
    return ledgerTable;
  }

  public Path hashCountTable() {
    return hashCountTable;
  }

  public Path lockDir() {
    return lockDir;
  }

  /** Directory holding in-flight guard markers, below {@link #lockDir()}. */
  public Path inflightDir() {
    return lockDir.resolve("inflight");
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public int quietAttempts() {
    return quietAttempts;
  }

  public long quietIntervalMillis() {
    return quietIntervalMillis;
  }

  /** Age after which an in-flight guard is reclaimed; {@link Duration#ZERO} disables reclaiming. */
  public Duration staleAfter() {
    return staleAfter;
  }

  public int workers() {
    return workers;
  }

  public WatchMode watchMode() {
    return watchMode;
  }

  public long watchDebounceMillis() {
    return watchDebounceMillis;
  }

  public MetadataProvider metadataProvider() {
    return metadataProvider;
  }

  public ToolCommands tools() {
    return tools;
  }

  public Duration toolTimeout() {
    return toolTimeout;
  }
}
