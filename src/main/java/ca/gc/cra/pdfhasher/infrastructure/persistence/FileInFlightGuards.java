package ca.gc.cra.pdfhasher.infrastructure.persistence;

import ca.gc.cra.pdfhasher.application.port.ClockPort;
import ca.gc.cra.pdfhasher.application.port.InFlightGuardPort;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-flight guards stored as {@code <sha256>.lock} marker files.
 * <p><strong>Acquisition:</strong> {@link StandardOpenOption#CREATE_NEW} makes the create atomic across threads
 * and processes. The marker records the UTC acquisition time and {@code pid@host}.</p>
 * <p><strong>Abandonment:</strong> A marker is abandoned when it names a process on this host that is no longer
 * alive, or when it is older than {@code staleAfter} (markers from other hosts can only age out). A zero
 * {@code staleAfter} disables the age rule only. {@link #isHeld(String)} ignores abandoned markers and
 * {@link #tryAcquire(String)} reclaims them by renaming them aside, so only one contender wins.</p>
 *
 * @since 0.1.0
 */
public final class FileInFlightGuards implements InFlightGuardPort {
  private static final Logger log = LoggerFactory.getLogger(FileInFlightGuards.class);
  private static final String SUFFIX = ".lock";

  private final Path directory;
  private final Duration staleAfter;
  private final ClockPort clock;
  private final String host;
  private final String owner;

  /**
   * Creates the guard store.
   *
   * @param directory marker directory, created on demand
   * @param staleAfter age after which a marker is reclaimed; zero disables reclaiming
   * @param clock time source
   */
  public FileInFlightGuards(Path directory, Duration staleAfter, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter");
    if (staleAfter.isNegative()) {
      throw new IllegalArgumentException("staleAfter must be >= 0");
    }
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.host = hostName();
    this.owner = ProcessHandle.current().pid() + "@" + host;
  }

  @Override
  public boolean isHeld(String sha256) {
    Path marker = markerFor(sha256);
    if (!Files.exists(marker)) {
      return false;
    }
    if (isAbandoned(marker)) {
      log.debug("Ignoring abandoned in-flight guard {}", marker.getFileName());
      return false;
    }
    return true;
  }

  @Override
  public Optional<Guard> tryAcquire(String sha256) throws IOException {
    Files.createDirectories(directory);
    Path marker = markerFor(sha256);
    if (create(marker)) {
      return Optional.of(new FileGuard(sha256, marker));
    }
    if (!isAbandoned(marker)) {
      return Optional.empty();
    }
    Path aside = marker.resolveSibling(
        marker.getFileName() + ".stale-" + Long.toHexString(ThreadLocalRandom.current().nextLong()));
    try {
      Files.move(marker, aside, StandardCopyOption.ATOMIC_MOVE);
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
    log.warn("Reclaimed abandoned in-flight guard {} ({})", marker.getFileName(), readQuietly(aside));
    Files.deleteIfExists(aside);
    return create(marker) ? Optional.of(new FileGuard(sha256, marker)) : Optional.empty();
  }

  private boolean create(Path marker) throws IOException {
    String content = Instant.ofEpochMilli(clock.nowMillis()).truncatedTo(ChronoUnit.SECONDS)
        + "\t" + owner + "\n";
    try {
      Files.writeString(
          marker, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      return true;
    } catch (FileAlreadyExistsException ex) {
      return false;
    }
  }

  private boolean isAbandoned(Path marker) {
    return ownerIsGone(marker) || isStale(marker);
  }

  /**
   * Reads the {@code pid@host} owner from the marker's last field. Only owners on this host can be checked.
   */
  private boolean ownerIsGone(Path marker) {
    String content = readQuietly(marker);
    String ownerField = content.substring(content.lastIndexOf('\t') + 1).strip();
    int at = ownerField.indexOf('@');
    if (at <= 0) {
      return false;
    }
    String ownerHost = ownerField.substring(at + 1);
    if (!ownerHost.equals(host) && !ownerHost.equals("localhost")) {
      return false;
    }
    long pid;
    try {
      pid = Long.parseLong(ownerField.substring(0, at));
    } catch (NumberFormatException ex) {
      return false;
    }
    return ProcessHandle.of(pid).map(process -> !process.isAlive()).orElse(true);
  }

  private boolean isStale(Path marker) {
    if (staleAfter.isZero()) {
      return false;
    }
    try {
      long modified = Files.getLastModifiedTime(marker).toMillis();
      return clock.nowMillis() - modified > staleAfter.toMillis();
    } catch (IOException ex) {
      return false;
    }
  }

  private Path markerFor(String sha256) {
    Objects.requireNonNull(sha256, "sha256");
    return directory.resolve(sha256 + SUFFIX);
  }

  private static String readQuietly(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8).strip();
    } catch (IOException ex) {
      return "unreadable";
    }
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      return "unknown-host";
    }
  }

  private static final class FileGuard implements Guard {
    private final String sha256;
    private final Path marker;
    private final AtomicBoolean released = new AtomicBoolean();

    FileGuard(String sha256, Path marker) {
      this.sha256 = sha256;
      this.marker = marker;
    }

    @Override
    public String sha256() {
      return sha256;
    }

    @Override
    public void close() {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      try {
        Files.deleteIfExists(marker);
      } catch (IOException ex) {
        log.warn("Failed to release in-flight guard {}", marker, ex);
      }
    }
  }
}
