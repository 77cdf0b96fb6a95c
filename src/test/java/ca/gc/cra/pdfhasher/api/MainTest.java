package ca.gc.cra.pdfhasher.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ca.gc.cra.pdfhasher.domain.table.ObjectsSchema;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MainTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter out;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("--monitor, -m"));
  }

  @Test
  void unknownFlagIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"--turbo"}));
    assertTrue(out.toString().contains("usage: pdfhasher"));
    assertTrue(hasLogContaining("--turbo"));
  }

  @Test
  void bareWordIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"pdfDir"}));
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = Main.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void outOfRangeValueIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {"root=" + tempDir, "workers=0"}));
  }

  @Test
  void missingExtractorIsToolUnavailableAndWritesNothing() {
    ExitCode code = Main.run(new String[] {
        "root=" + tempDir, "tools.mutool=" + tempDir.resolve("bin/mutool")});

    assertEquals(ExitCode.TOOL_UNAVAILABLE, code);
    assertTrue(Files.notExists(tempDir.resolve("objects.tsv")));
    assertTrue(hasLogContaining("not found"));
  }

  @Test
  void dryRunPrintsLayoutWithoutWriting() {
    ExitCode code = Main.run(new String[] {
        "root=" + tempDir, "tools.mutool=" + tempDir.resolve("bin/mutool"), "--dry-run", "-m"});

    assertEquals(ExitCode.SUCCESS, code);
    String printed = out.toString();
    assertTrue(printed.contains("dry-run"));
    assertTrue(printed.contains(tempDir.resolve("pdf").toString()));
    assertTrue(printed.contains("monitor (AUTO)"));
    assertTrue(printed.contains("(not found)"));
    assertTrue(printed.contains("WARNING"));
    assertTrue(Files.notExists(tempDir.resolve("pdf")));
  }

  @Test
  void yamlValuesAreOverriddenByCli() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("c.yaml"), "ingest:\n  workers: 3\n  pdfDir: inbox\n");

    Main.run(new String[] {"config=" + yaml, "root=" + tempDir, "workers=5",
        "tools.mutool=" + tempDir.resolve("bin/mutool"), "--dry-run"});

    String printed = out.toString();
    assertTrue(printed.contains("Workers          : 5"));
    assertTrue(printed.contains(tempDir.resolve("inbox").toString()));
  }

  @Test
  void oneShotRunExtractsAndRecordsDocuments() throws IOException {
    Path mutool = script("mutool", "echo logo > image-0001.png\necho body > image-0002.jpg");
    Path pdfDir = Files.createDirectories(tempDir.resolve("pdf"));
    Files.writeString(pdfDir.resolve("MCRO_9_Order_2024-01-02.pdf"), "%PDF-1.7 fake");
    Files.writeString(pdfDir.resolve("copy.pdf"), "%PDF-1.7 fake");

    ExitCode code = Main.run(isolated(mutool));
    ExitCode again = Main.run(isolated(mutool));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(ExitCode.SUCCESS, again);
    List<String> rows = Files.readAllLines(tempDir.resolve("objects.tsv"), StandardCharsets.UTF_8);
    assertEquals(ObjectsSchema.CURRENT_HEADER, rows.get(0));
    assertEquals(3, rows.size());
    assertEquals(1, Files.readAllLines(tempDir.resolve("processed.tsv")).size());
    assertEquals(2, Files.readAllLines(tempDir.resolve("hash-count.tsv")).size());
  }

  @Test
  void corruptLedgerIsDataCorruption() throws IOException {
    Path mutool = script("mutool", "echo logo > image-0001.png");
    Files.createDirectories(tempDir.resolve("pdf"));
    Files.writeString(tempDir.resolve("pdf/a.pdf"), "%PDF-1.7 a");
    Files.writeString(tempDir.resolve("processed.tsv"), "this is not a ledger line\n");

    assertEquals(ExitCode.DATA_CORRUPTION, Main.run(isolated(mutool)));
  }

  private String[] isolated(Path mutool) {
    List<String> args = new ArrayList<>();
    args.add("root=" + tempDir);
    args.add("tools.mutool=" + mutool);
    for (String tool : List.of("pdfsig", "exiftool", "otfinfo", "fcScan")) {
      args.add("tools." + tool + "=" + tempDir.resolve("missing/" + tool));
    }
    args.add("metadata.provider=pdfbox");
    args.add("quiet.intervalMillis=0");
    return args.toArray(String[]::new);
  }

  private Path script(String name, String body) throws IOException {
    assumeTrue(!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"),
        "shell scripts need a POSIX system");
    Path bin = Files.createDirectories(tempDir.resolve("bin"));
    Path script = Files.writeString(bin.resolve(name), "#!/bin/sh\n" + body + "\n");
    assumeTrue(script.toFile().setExecutable(true), "executable bit unsupported");
    return script;
  }

  private boolean hasLogContaining(String text) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(text));
  }
}
