package io.airesearcher.safeexec.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void traversalOutOfBaseIsRejected() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> Paths.validatePath("../../../etc/passwd", Path.of("/app"), false));
    assertTrue(ex.reason().contains("outside base directory"), ex.getMessage());
  }

  @Test
  void relativePathResolvesUnderMissingBase() {
    ValidatedPath validated = Paths.validatePath("papers/vq", Path.of("/app"), false);
    assertEquals(Path.of("/app/papers/vq"), validated.path());
    assertEquals(Path.of("/app"), validated.base());
  }

  @Test
  void resolvesAgainstCanonicalBase() throws IOException {
    Path validated = Paths.validatePath("papers/vq", tempDir, false).path();
    assertEquals(tempDir.toRealPath().resolve("papers/vq"), validated);
  }

  @Test
  void mustExistRejectsMissingTargets() throws IOException {
    assertThrows(ValidationException.class, () -> Paths.validatePath("missing", tempDir, true));
    Files.createDirectory(tempDir.resolve("present"));
    assertEquals(tempDir.toRealPath().resolve("present"),
        Paths.validatePath("present", tempDir, true).path());
  }

  @Test
  void absolutePathInsideBaseIsAccepted() throws IOException {
    Path inside = Files.createDirectories(tempDir.resolve("a/b"));
    assertEquals(inside.toRealPath(), Paths.validatePath(inside.toString(), tempDir, true).path());
  }

  @Test
  void symlinkEscapingBaseIsRejected() throws IOException {
    Path base = Files.createDirectory(tempDir.resolve("base"));
    Path outside = Files.createDirectory(tempDir.resolve("outside"));
    Files.createSymbolicLink(base.resolve("link"), outside);
    assertThrows(ValidationException.class, () -> Paths.validatePath("link/file.txt", base, false));
  }

  @Test
  void nulBytesAreRejected() {
    assertThrows(ValidationException.class, () -> Paths.validatePath("a\0b", tempDir, false));
  }
}
