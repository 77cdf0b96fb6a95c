package ca.gc.cra.pdfhasher.infrastructure.tools;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs an external command with a timeout.
 * <p><strong>Why:</strong> Output is redirected to temp files instead of pipes, so a chatty tool can never block
 * on a full pipe buffer while the caller waits.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from configuration; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);
  private static final long KILL_WAIT_SECONDS = 5;

  private final Duration timeout;

  /**
   * Creates a runner.
   *
   * @param timeout maximum wall-clock time per command; must be positive
   */
  public CommandRunner(Duration timeout) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  /**
   * Runs {@code command} and waits for it.
   *
   * @param command program and arguments
   * @param workingDir working directory, or {@code null} for the current one
   * @return captured result
   * @throws IOException if the process cannot be started or its output read
   * @throws InterruptedException if interrupted while waiting; the process is killed
   */
  public CommandResult run(List<String> command, Path workingDir)
      throws IOException, InterruptedException {
    Objects.requireNonNull(command, "command");
    Path stdout = Files.createTempFile("pdfhasher-", ".out");
    Path stderr = Files.createTempFile("pdfhasher-", ".err");
    try {
      ProcessBuilder builder = new ProcessBuilder(command)
          .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile());
      if (workingDir != null) {
        builder.directory(workingDir.toFile());
      }
      log.debug("Running {}", command);
      Process process = builder.start();
      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        throw ex;
      }
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
        log.warn("{} timed out after {}s and was killed", command.get(0), timeout.toSeconds());
        return new CommandResult(-1, read(stdout), read(stderr), true);
      }
      return new CommandResult(process.exitValue(), read(stdout), read(stderr), false);
    } finally {
      Files.deleteIfExists(stdout);
      Files.deleteIfExists(stderr);
    }
  }

  /** Configured timeout. */
  public Duration timeout() {
    return timeout;
  }

  private static String read(Path file) throws IOException {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  private static File nullDevice() {
    boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    return new File(windows ? "NUL" : "/dev/null");
  }
}
