package io.airesearcher.safeexec.application.latex;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> One lock per canonical directory.
 * <p><strong>Role:</strong> Serializes multi-pass compilations of the same project directory. Only callers
 * sharing one {@code DirectoryLocks} instance are serialized; compilers built with separate instances may
 * interleave on the same directory and corrupt each other's auxiliary files.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Locks are fair and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryLocks {
  private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Blocks until the lock for {@code directory} is held.
   *
   * @param directory existing directory; symlinks are resolved so aliases share a lock
   * @return lease that releases the lock when closed
   * @throws IOException if the directory cannot be canonicalized
   * @throws InterruptedException if interrupted while waiting
   */
  public Lease acquire(Path directory) throws IOException, InterruptedException {
    Path key = Objects.requireNonNull(directory, "directory").toRealPath();
    ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
    lock.lockInterruptibly();
    return new Lease(key, lock);
  }

  /**
   * Returns whether some thread currently holds the lock for {@code directory}.
   *
   * @param directory existing directory
   * @return {@code true} while a compilation of the directory is in progress
   * @throws IOException if the directory cannot be canonicalized
   */
  public boolean isLocked(Path directory) throws IOException {
    ReentrantLock lock = locks.get(directory.toRealPath());
    return lock != null && lock.isLocked();
  }

  /** Held lock on one directory; closing releases it. */
  public static final class Lease implements AutoCloseable {
    private final Path directory;
    private final ReentrantLock lock;

    private Lease(Path directory, ReentrantLock lock) {
      this.directory = directory;
      this.lock = lock;
    }

    /** @return canonical directory this lease covers */
    public Path directory() {
      return directory;
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
