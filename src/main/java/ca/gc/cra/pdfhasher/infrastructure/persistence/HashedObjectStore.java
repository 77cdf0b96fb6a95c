package ca.gc.cra.pdfhasher.infrastructure.persistence;

import ca.gc.cra.pdfhasher.application.port.DedupStorePort;
import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Flat directory of blobs named {@code <sha256><extension>}.
 * <p><strong>Policy:</strong> First-seen extension wins. A later object with the same hash is discarded even when
 * its extension differs.</p>
 * <p><strong>Durability:</strong> Blobs are copied to a hidden {@code .<name>.tmp-<n>} file and renamed into
 * place. Hidden names never count as stored blobs, so leftovers of a crashed copy are ignored.</p>
 * <p><strong>Thread-safety:</strong> The check and the write run under the store lock.</p>
 *
 * @since 0.1.0
 */
public final class HashedObjectStore implements DedupStorePort {
  private static final Logger log = LoggerFactory.getLogger(HashedObjectStore.class);

  private final Path directory;
  private final NamedFileLock lock;

  /**
   * Creates the store.
   *
   * @param directory blob directory, created on demand
   * @param lock store lock
   */
  public HashedObjectStore(Path directory, NamedFileLock lock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.lock = Objects.requireNonNull(lock, "lock");
  }

  @Override
  public Outcome store(Path source, String sha256, String extension) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sha256, "sha256");
    String ext = extension == null ? "" : extension;
    return lock.withLock(() -> {
      Optional<Path> existing = findUnlocked(sha256);
      if (existing.isPresent()) {
        log.debug("Blob for {} already stored as {}", sha256, existing.get().getFileName());
        return Outcome.DUPLICATE;
      }
      Files.createDirectories(directory);
      String name = sha256 + ext;
      Path temp = directory.resolve("." + name + ".tmp-" + Long.toHexString(ThreadLocalRandom.current().nextLong()));
      try {
        Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
        TsvFiles.moveReplacing(temp, directory.resolve(name));
      } finally {
        Files.deleteIfExists(temp);
      }
      return Outcome.STORED;
    });
  }

  @Override
  public Optional<Path> find(String sha256) throws IOException {
    Objects.requireNonNull(sha256, "sha256");
    return lock.withLock(() -> findUnlocked(sha256));
  }

  private Optional<Path> findUnlocked(String sha256) throws IOException {
    if (!Files.isDirectory(directory)) {
      return Optional.empty();
    }
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, sha256 + "*")) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (isBlobName(name, sha256)) {
          return Optional.of(entry);
        }
      }
    }
    return Optional.empty();
  }

  static boolean isBlobName(String fileName, String sha256) {
    return fileName.equals(sha256) || fileName.startsWith(sha256 + ".");
  }
}
