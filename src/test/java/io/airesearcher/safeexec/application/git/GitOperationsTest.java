package io.airesearcher.safeexec.application.git;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.airesearcher.safeexec.domain.exec.CommandFailedException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.support.RecordingCommandExecutor;
import io.airesearcher.safeexec.validation.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitOperationsTest {
  @TempDir Path tempDir;

  private RecordingCommandExecutor executor;
  private GitOperations git;

  @BeforeEach
  void setUp() {
    executor = new RecordingCommandExecutor();
    git = new GitOperations(executor);
  }

  @Test
  void cloneBuildsArgumentVectorWithBranchAndDepth() throws Exception {
    Path target = tempDir.resolve("repos").resolve("vq");

    git.clone("https://github.com/org/vq.git", target, "main");

    assertEquals(List.of(List.of("git", "clone", "--branch", "main", "--depth", "1",
        "https://github.com/org/vq.git", target.toString())), executor.argvs());
    CommandSpec command = executor.commands().get(0);
    assertEquals(Duration.ofSeconds(300), command.timeout());
    assertTrue(command.checkExitCode());
    assertTrue(Files.isDirectory(tempDir.resolve("repos")));
  }

  @Test
  void cloneWithoutBranchAndZeroDepthOmitsBothFlags() throws Exception {
    Path target = tempDir.resolve("full");

    git.clone("git://example.org/repo.git", target, null, 0, Duration.ofSeconds(10));

    assertEquals(List.of("git", "clone", "git://example.org/repo.git", target.toString()),
        executor.argvs().get(0));
    assertEquals(Duration.ofSeconds(10), executor.commands().get(0).timeout());
  }

  @Test
  void cloneUsesConfiguredBinaryAndDepth() throws Exception {
    GitOperations custom = new GitOperations(executor,
        new GitSettings("/usr/local/bin/git", Duration.ofSeconds(5), Duration.ofSeconds(5), 3));
    Path target = tempDir.resolve("custom");

    custom.clone("https://example.org/r.git", target, null);

    assertEquals(List.of("/usr/local/bin/git", "clone", "--depth", "3", "https://example.org/r.git",
        target.toString()), executor.argvs().get(0));
  }

  @Test
  void cloneIntoExistingTargetRunsNothing() throws Exception {
    Path target = Files.createDirectories(tempDir.resolve("exists"));

    ValidationException ex = assertThrows(ValidationException.class,
        () -> git.clone("https://github.com/org/vq.git", target, null));

    assertEquals("target directory", ex.field());
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void cloneRejectsInjectedBranchAndUnsafeUrls() {
    Path target = tempDir.resolve("x");

    assertThrows(ValidationException.class,
        () -> git.clone("https://github.com/org/vq.git", target, "main; rm -rf /"));
    assertThrows(ValidationException.class,
        () -> git.clone("https://github.com/org/vq.git", target, "--upload-pack=evil"));
    assertThrows(ValidationException.class, () -> git.clone("file:///etc/passwd", target, null));
    assertThrows(ValidationException.class, () -> git.clone("http://example.org/r.git", target, null));
    assertThrows(ValidationException.class, () -> git.clone("https://localhost/r.git", target, null));
    assertThrows(ValidationException.class,
        () -> git.clone("https://github.com/org/vq.git", target, null, -1, null));
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void cloneFailurePropagatesCommandFailure() {
    executor.respondWith(command -> RecordingCommandExecutor.result(128, "", "fatal: repository not found"));

    CommandFailedException ex = assertThrows(CommandFailedException.class,
        () -> git.clone("https://github.com/org/missing.git", tempDir.resolve("m"), null));

    assertEquals(128, ex.exitCode());
    assertTrue(ex.getMessage().contains("fatal: repository not found"));
  }

  @Test
  void checkoutRunsInsideRepository() throws Exception {
    Path repo = Files.createDirectories(tempDir.resolve("repo"));

    git.checkout("feature/x", repo, false);
    git.checkout("exp-1", repo, true);

    assertEquals(List.of(
        List.of("git", "checkout", "feature/x"),
        List.of("git", "checkout", "-b", "exp-1")), executor.argvs());
    CommandSpec first = executor.commands().get(0);
    assertEquals(Optional.of(repo), first.workingDirectory());
    assertEquals(Duration.ofSeconds(60), first.timeout());
  }

  @Test
  void checkoutRejectsMissingRepositoryAndBadBranch() throws Exception {
    Path repo = Files.createDirectories(tempDir.resolve("repo"));

    ValidationException missing = assertThrows(ValidationException.class,
        () -> git.checkout("main", tempDir.resolve("nope"), false));
    assertEquals("repository directory", missing.field());
    assertThrows(ValidationException.class, () -> git.checkout("main..evil", repo, false));
    assertThrows(ValidationException.class, () -> git.checkout("topic.lock", repo, true));
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void prepareCloneDoesNotTouchFilesystem() {
    Path target = tempDir.resolve("a").resolve("b");

    CommandSpec command = git.prepareClone("https://example.org/r.git", target, "dev", 1, null);

    assertEquals("git", command.program());
    assertTrue(Files.notExists(tempDir.resolve("a")));
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void cloneTargetStartingWithDashIsPassedAsAbsolutePath() {
    Path target = Path.of("--config=core.fsmonitor=touch-pwned");

    CommandSpec command = git.prepareClone("https://example.org/r.git", target, null, 1, null);

    String targetArg = command.argv().get(command.argv().size() - 1);
    assertEquals(target.toAbsolutePath().normalize().toString(), targetArg);
    assertFalse(targetArg.startsWith("-"));
    assertTrue(command.argv().stream().noneMatch(arg -> arg.startsWith("--config")));
  }
}
