package io.airesearcher.safeexec.application.script;

import io.airesearcher.safeexec.application.port.CommandExecutor;
import io.airesearcher.safeexec.domain.exec.CommandException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.validation.Paths;
import io.airesearcher.safeexec.validation.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an interpreter script as {@code [interpreter, script, args...]}.
 *
 * <p>The script must be an existing regular file with the configured extension and, when a base
 * directory is configured, must resolve inside it. Arguments are passed verbatim; exit codes are
 * checked.</p>
 *
 * @since 0.1.0
 */
public final class ScriptRunner {
  private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

  private final CommandExecutor executor;
  private final ScriptSettings settings;

  public ScriptRunner(CommandExecutor executor, ScriptSettings settings) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Runs {@code script} with the configured timeout, inheriting the working directory and environment.
   *
   * @see #run(Path, List, Path, Duration, Map)
   */
  public ExecutionResult run(Path script, List<String> args) throws CommandException, InterruptedException {
    return run(script, args, null, null, Map.of());
  }

  /**
   * Runs {@code script}.
   *
   * @param script script file
   * @param args arguments after the script path
   * @param cwd working directory, or {@code null} to inherit
   * @param timeout bound for the run, or {@code null} for the configured default
   * @param env variables set on top of the inherited environment
   * @return exit status and captured output
   * @throws ValidationException if the script is missing, has another extension, or lies outside the base
   *         directory
   * @throws CommandException if the script fails, times out, or the interpreter cannot start
   * @throws InterruptedException if interrupted while waiting; the process has been killed
   */
  public ExecutionResult run(Path script, List<String> args, Path cwd, Duration timeout, Map<String, String> env)
      throws CommandException, InterruptedException {
    Path resolved = resolveScript(script);
    CommandSpec command = CommandSpec.builder(settings.interpreter(), resolved.toString())
        .args(args == null ? List.of() : args)
        .workingDirectory(cwd)
        .timeout(timeout == null ? settings.timeout() : timeout)
        .environment(env)
        .build();
    log.info("Running script {} with {} argument(s)", resolved, command.argv().size() - 2);
    return executor.execute(command);
  }

  private Path resolveScript(Path script) {
    if (script == null) {
      throw new ValidationException("script", "must be provided", null);
    }
    Path resolved = settings.baseDirectory()
        .map(base -> Paths.validatePath("script", script.toString(), base, true).path())
        .orElseGet(() -> script.toAbsolutePath().normalize());
    if (!Files.isRegularFile(resolved)) {
      throw new ValidationException("script", "not found or not a regular file", script.toString());
    }
    Path fileName = resolved.getFileName();
    if (fileName == null || !fileName.toString().endsWith(settings.extension())) {
      throw new ValidationException("script", "must have extension " + settings.extension(), script.toString());
    }
    return resolved;
  }
}
