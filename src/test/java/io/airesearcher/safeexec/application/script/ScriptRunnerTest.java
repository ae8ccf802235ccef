package io.airesearcher.safeexec.application.script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.infrastructure.exec.ProcessCommandExecutor;
import io.airesearcher.safeexec.support.RecordingCommandExecutor;
import io.airesearcher.safeexec.validation.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ScriptRunnerTest {
  @TempDir Path tempDir;

  private final RecordingCommandExecutor executor = new RecordingCommandExecutor();

  @Test
  void buildsInterpreterArgumentVector() throws Exception {
    Path script = Files.writeString(tempDir.resolve("train.py"), "print('x')");
    ScriptRunner runner = new ScriptRunner(executor, ScriptSettings.defaults());

    runner.run(script, List.of("--epochs", "3", "a b; c"), tempDir, Duration.ofSeconds(7), Map.of("SEED", "1"));

    CommandSpec command = executor.commands().get(0);
    assertEquals(List.of("python3", script.toAbsolutePath().normalize().toString(), "--epochs", "3", "a b; c"),
        command.argv());
    assertEquals(Optional.of(tempDir), command.workingDirectory());
    assertEquals(Duration.ofSeconds(7), command.timeout());
    assertEquals(Map.of("SEED", "1"), command.environment());
    assertTrue(command.checkExitCode());
  }

  @Test
  void defaultsApplyWhenOptionalArgumentsAreOmitted() throws Exception {
    Path script = Files.writeString(tempDir.resolve("run.py"), "");
    ScriptRunner runner = new ScriptRunner(executor, ScriptSettings.defaults());

    runner.run(script, null);

    CommandSpec command = executor.commands().get(0);
    assertEquals(2, command.argv().size());
    assertEquals(Duration.ofSeconds(300), command.timeout());
    assertTrue(command.environment().isEmpty());
  }

  @Test
  void rejectsMissingScriptsAndWrongExtensions() throws Exception {
    Path shell = Files.writeString(tempDir.resolve("run.sh"), "echo hi");
    ScriptRunner runner = new ScriptRunner(executor, ScriptSettings.defaults());

    ValidationException missing = assertThrows(ValidationException.class,
        () -> runner.run(tempDir.resolve("absent.py"), List.of()));
    assertEquals("not found or not a regular file", missing.reason());
    ValidationException wrong = assertThrows(ValidationException.class, () -> runner.run(shell, List.of()));
    assertEquals("must have extension .py", wrong.reason());
    assertThrows(ValidationException.class, () -> runner.run(tempDir, List.of()));
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void scriptOutsideBaseDirectoryIsRejected() throws Exception {
    Path base = Files.createDirectories(tempDir.resolve("scripts"));
    Path outside = Files.writeString(tempDir.resolve("escape.py"), "");
    Path inside = Files.writeString(base.resolve("ok.py"), "");
    ScriptRunner runner = new ScriptRunner(executor,
        new ScriptSettings("python3", ".py", Duration.ofSeconds(5), Optional.of(base)));

    assertThrows(ValidationException.class, () -> runner.run(outside, List.of()));
    assertThrows(ValidationException.class, () -> runner.run(Path.of("../escape.py"), List.of()));
    runner.run(Path.of("ok.py"), List.of());

    assertEquals(1, executor.commands().size());
    assertEquals(inside.toRealPath().toString(), executor.argvs().get(0).get(1));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void runsThroughRealProcess() throws Exception {
    Path script = Files.writeString(tempDir.resolve("hello.py"), "print('hello')\n");
    ScriptRunner runner = new ScriptRunner(new ProcessCommandExecutor(),
        new ScriptSettings("cat", ".py", Duration.ofSeconds(10), Optional.empty()));

    ExecutionResult result = runner.run(script, List.of());

    assertEquals("print('hello')\n", result.stdout());
  }
}
