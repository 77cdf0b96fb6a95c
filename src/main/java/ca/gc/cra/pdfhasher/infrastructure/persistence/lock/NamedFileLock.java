package ca.gc.cra.pdfhasher.infrastructure.persistence.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Exclusive lock identified by a lock file path.
 * <p><strong>Why:</strong> OS file locks are held per process, so threads of one JVM must also be serialized;
 * each lock pairs a JVM-wide {@link ReentrantLock} (shared by every instance naming the same file) with an
 * exclusive {@link FileLock}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Not reentrant across the OS lock: a thread must not nest
 * {@code withLock} calls on the same file. Callers that need two locks take the objects lock before the counts
 * lock.</p>
 *
 * @since 0.1.0
 */
public final class NamedFileLock {
  private static final ConcurrentMap<Path, ReentrantLock> JVM_LOCKS = new ConcurrentHashMap<>();

  private final Path lockFile;
  private final ReentrantLock jvmLock;

  /**
   * Creates a handle for the lock file; the file is created on first use.
   *
   * @param lockFile lock file path
   */
  public NamedFileLock(Path lockFile) {
    this.lockFile = Objects.requireNonNull(lockFile, "lockFile").toAbsolutePath().normalize();
    this.jvmLock = JVM_LOCKS.computeIfAbsent(this.lockFile, key -> new ReentrantLock());
  }

  /** Action executed while the lock is held. */
  @FunctionalInterface
  public interface LockedAction<T> {
    T run() throws IOException;
  }

  /**
   * Runs {@code action} while holding the lock.
   *
   * @param action action to run
   * @param <T> result type
   * @return the action's result
   * @throws IOException if the lock file cannot be locked or the action fails
   */
  public <T> T withLock(LockedAction<T> action) throws IOException {
    Objects.requireNonNull(action, "action");
    jvmLock.lock();
    try {
      Path parent = lockFile.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (FileChannel channel = FileChannel.open(
              lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
          FileLock osLock = channel.lock()) {
        return action.run();
      }
    } finally {
      jvmLock.unlock();
    }
  }

  /**
   * Returns the lock file path.
   *
   * @return absolute lock file path
   */
  public Path lockFile() {
    return lockFile;
  }

  @Override
  public String toString() {
    return "NamedFileLock{" + lockFile + '}';
  }
}
