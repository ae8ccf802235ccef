package io.airesearcher.safeexec.application.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryLocksTest {
  @TempDir Path tempDir;

  @Test
  void leaseIsKeyedByRealPathAndReleasedOnClose() throws Exception {
    Path dir = Files.createDirectories(tempDir.resolve("paper"));
    DirectoryLocks locks = new DirectoryLocks();

    try (DirectoryLocks.Lease lease = locks.acquire(tempDir.resolve("paper").resolve("..").resolve("paper"))) {
      assertEquals(dir.toRealPath(), lease.directory());
      assertTrue(locks.isLocked(dir));
    }
    assertFalse(locks.isLocked(dir));
  }

  @Test
  void missingDirectoryCannotBeLocked() {
    assertThrows(NoSuchFileException.class, () -> new DirectoryLocks().acquire(tempDir.resolve("absent")));
  }
}
