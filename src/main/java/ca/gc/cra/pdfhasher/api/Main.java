package ca.gc.cra.pdfhasher.api;

import ca.gc.cra.pdfhasher.application.pipeline.WatchUseCase;
import ca.gc.cra.pdfhasher.application.port.ClockPort;
import ca.gc.cra.pdfhasher.config.CompositionRoot;
import ca.gc.cra.pdfhasher.config.ConfigMerger;
import ca.gc.cra.pdfhasher.config.DefaultsForMode;
import ca.gc.cra.pdfhasher.config.IngestConfig;
import ca.gc.cra.pdfhasher.config.ToolInventory;
import ca.gc.cra.pdfhasher.domain.ingest.ScanSummary;
import ca.gc.cra.pdfhasher.domain.table.LedgerCorruptionException;
import ca.gc.cra.pdfhasher.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pdfhasher.infrastructure.tools.ToolLocator;
import ca.gc.cra.pdfhasher.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point of the {@code pdfhasher} CLI.
 * <p><strong>Flow:</strong> parse arguments, merge configuration, resolve tools, then run either a one-shot
 * catch-up scan or, with {@code --monitor}, a catch-up scan followed by watching the input directory.</p>
 * <p><strong>Exit codes:</strong> see {@link ExitCode}. Per-document failures never change the exit code.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--help", "--verbose", "--monitor", "--dry-run");
  private static final long SHUTDOWN_GRACE_SECONDS = 30L;
  private static final String SUMMARY_USAGE =
      "usage: pdfhasher [key=value ...] [--monitor|-m] [--dry-run] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      pdfhasher: idempotent PDF object extraction and hashing

      Usage:
        pdfhasher [key=value ...] [--monitor|-m] [--dry-run] [--verbose] [--help]

      Without --monitor every PDF currently in pdfDir is processed once and the command exits.

      Flags:
        --monitor, -m   Catch up, then keep watching pdfDir for new documents
        --dry-run       Print the resolved layout and tool availability, then exit
        --verbose       Enable DEBUG logging
        --help          Show this message

      Options (key=value; CLI overrides config=PATH, which overrides defaults):
        config=PATH                    YAML file with 'common' and 'ingest' sections
        root=DIR                       Base for relative paths (default: working directory)
        pdfDir=DIR                     Input directory (default pdf)
        objectsDir=DIR                 Extraction directories (default pdf-objects)
        hashedDir=DIR                  Deduplicated objects (default hashed-objects)
        objectsTable=FILE              Object rows (default objects.tsv)
        ledgerTable=FILE               Processed documents (default processed.tsv)
        hashCountTable=FILE            Hash frequencies (default hash-count.tsv)
        lockDir=DIR                    Lock files and in-flight guards (default .locks)
        workers=N                      Documents processed in parallel (default 1)
        pollSeconds=N                  Rescan interval for polling watch (default 5)
        watch.mode=auto|native|poll    How --monitor detects new files (default auto)
        quiet.attempts=N               Size checks before a file counts as complete (default 10)
        quiet.intervalMillis=N         Delay between size checks (default 300)
        inflight.staleAfterMinutes=N   Reclaim abandoned guards after N minutes, 0 never (default 720)
        metadata.provider=auto|exiftool|pdfbox   Author/Creator source (default auto)
        tools.mutool|pdfsig|exiftool|otfinfo|fcScan=CMD   Tool names or paths
        tools.timeoutSeconds=N         Per-command timeout (default 120)
        metricsExporter=otlp|none      Metrics export (default none)
        otelEndpoint=URL               OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,... OpenTelemetry resource attributes

      Exit codes: 0 ok, 2 invalid arguments, 3 I/O error, 4 configuration error, 5 runtime failure,
      6 mutool not found, 7 ledger corruption, 130 interrupted.
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unknownFlags));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    IngestConfig config;
    try {
      config = loadConfig(kv);
    } catch (IOException ex) {
      log.error("Unable to read configuration file: {}", ex.toString());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ToolInventory tools = ToolInventory.resolve(config.tools(), ToolLocator.fromEnvironment());
    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config, tools, input.hasFlag("--monitor"));
      return ExitCode.SUCCESS;
    }
    if (tools.mutool().isEmpty()) {
      log.error("Mandatory tool '{}' not found on PATH; install MuPDF or set tools.mutool=PATH",
          config.tools().mutool());
      return ExitCode.TOOL_UNAVAILABLE;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, tools, metrics, ClockPort.SYSTEM);
      if (input.hasFlag("--monitor")) {
        runMonitor(root.watchUseCase());
      } else {
        ScanSummary summary = root.catchUpUseCase().scan();
        if (summary.failed() > 0) {
          log.warn("{} document(s) failed and will be retried on the next run", summary.failed());
        }
      }
      return ExitCode.SUCCESS;
    } catch (LedgerCorruptionException ex) {
      log.error("Ledger corruption at line {}: {}", ex.lineNumber(), ex.getMessage());
      return ExitCode.DATA_CORRUPTION;
    } catch (IOException ex) {
      log.error("Ingest I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Ingest configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Ingest interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in ingest pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static IngestConfig loadConfig(Map<String, String> kv) throws IOException {
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Map<String, String> yaml = ConfigCliUtils.loadYaml(configPath, DefaultsForMode.INGEST);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml, kv, DefaultsForMode.asFlatMap(DefaultsForMode.INGEST), log::warn);
    TelemetryConfigurator.configureMetrics(effective);
    IngestConfig config = IngestConfig.fromMap(effective);
    if (configPath != null) {
      log.info("Loaded configuration from {}", configPath);
    }
    return config;
  }

  private static void runMonitor(WatchUseCase watch) throws IOException, InterruptedException {
    Thread mainThread = Thread.currentThread();
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; finishing the current document");
      watch.stop();
      try {
        mainThread.join(TimeUnit.SECONDS.toMillis(SHUTDOWN_GRACE_SECONDS));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "pdfhasher-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      watch.run();
    } finally {
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException ex) {
        log.debug("JVM already shutting down");
      }
    }
  }

  private static void printDryRunPlan(IngestConfig config, ToolInventory tools, boolean monitor) {
    List<String> lines = new ArrayList<>();
    lines.add("pdfhasher dry-run: nothing will be written.");
    lines.add(" Root             : " + config.root());
    for (Map.Entry<String, Path> entry : config.layout().entrySet()) {
      lines.add(String.format(" %-16s : %s", entry.getKey(), entry.getValue()));
    }
    lines.add(" Mode             : " + (monitor ? "monitor (" + config.watchMode() + ")" : "one-shot scan"));
    lines.add(" Workers          : " + config.workers());
    lines.add(" Author/Creator   : " + config.metadataProvider());
    lines.add(" Tools:");
    for (String tool : tools.describe()) {
      lines.add("   " + tool);
    }
    if (tools.mutool().isEmpty()) {
      lines.add(" WARNING: mandatory tool missing; a real run exits with code "
          + ExitCode.TOOL_UNAVAILABLE.code());
    }
    CliPrinter.printLines(lines);
  }
}
