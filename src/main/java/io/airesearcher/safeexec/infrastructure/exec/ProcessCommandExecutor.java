package io.airesearcher.safeexec.infrastructure.exec;

import io.airesearcher.safeexec.application.port.CommandExecutor;
import io.airesearcher.safeexec.application.port.MetricsPort;
import io.airesearcher.safeexec.domain.exec.CommandException;
import io.airesearcher.safeexec.domain.exec.CommandFailedException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.CommandTimeoutException;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CommandExecutor} backed by {@link ProcessBuilder}.
 * <p><strong>Why:</strong> The argument vector is handed to the OS unchanged, so no argument is ever
 * interpreted by a shell.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for every git, LaTeX and script invocation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply working directory and environment overrides on top of the inherited environment.</li>
 *   <li>Drain stdout and stderr concurrently so a chatty child cannot block on a full pipe.</li>
 *   <li>Destroy the child and every process it started on timeout, interruption, or any other
 *   failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared drainer pool; safe for concurrent
 * calls on independent working directories.</p>
 * <p><strong>Observability:</strong> Logs each invocation with a quoted argument vector and redacted
 * environment; emits {@code exec.command.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class ProcessCommandExecutor implements CommandExecutor {
  private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);
  private static final ExecutorService DRAINERS = ExecutorFactories.newStreamDrainerPool(
      "safeexec-drain",
      (thread, ex) -> log.error("Output drainer {} failed", thread.getName(), ex));
  private static final long DRAIN_GRACE_MILLIS = 5_000L;
  private static final long KILL_WAIT_MILLIS = 5_000L;
  private static final int LOGGED_OUTPUT_BYTES = 1_024;

  static final String METRIC_STARTED = "exec.command.started";
  static final String METRIC_COMPLETED = "exec.command.completed";
  static final String METRIC_FAILED = "exec.command.failed";
  static final String METRIC_TIMEOUT = "exec.command.timeout";
  static final String METRIC_LAUNCH_FAILED = "exec.command.launchFailed";
  static final String METRIC_LATENCY = "exec.command.latencyMillis";

  private final MetricsPort metrics;

  /** Creates an executor that records no metrics. */
  public ProcessCommandExecutor() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an executor that reports through {@code metrics}.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public ProcessCommandExecutor(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public ExecutionResult execute(CommandSpec command) throws CommandException, InterruptedException {
    Objects.requireNonNull(command, "command");
    String rendered = Logs.renderCommand(command.argv());
    String cwd = command.workingDirectory().map(Object::toString).orElse("<inherited>");
    log.info("Executing command: {} (cwd={}, timeout={}ms, env={})",
        rendered, cwd, command.timeout().toMillis(), Logs.redactEnvironment(command.environment()));

    ProcessBuilder builder = new ProcessBuilder(command.argv());
    command.workingDirectory().ifPresent(dir -> builder.directory(dir.toFile()));
    builder.environment().putAll(command.environment());
    if (!command.captureOutput()) {
      builder.redirectOutput(ProcessBuilder.Redirect.INHERIT);
      builder.redirectError(ProcessBuilder.Redirect.INHERIT);
    }

    metrics.increment(METRIC_STARTED);
    long startNanos = System.nanoTime();
    Process process;
    try {
      process = builder.start();
    } catch (IOException | SecurityException ex) {
      metrics.increment(METRIC_LAUNCH_FAILED);
      log.error("Failed to start command {} in {}: {}", rendered, cwd, ex.getMessage());
      throw new CommandException("Failed to start command: " + ex.getMessage()
          + "\nCommand: " + rendered, command, ex);
    }

    Future<String> stdout = null;
    Future<String> stderr = null;
    try {
      closeStdin(process, rendered);
      if (command.captureOutput()) {
        stdout = DRAINERS.submit(() -> readFully(process.getInputStream()));
        stderr = DRAINERS.submit(() -> readFully(process.getErrorStream()));
      }

      boolean exited = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!exited) {
        destroy(process, rendered);
        metrics.increment(METRIC_TIMEOUT);
        log.warn("Command timed out after {}ms and was killed: {}", command.timeout().toMillis(), rendered);
        throw new CommandTimeoutException(command);
      }

      Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
      ExecutionResult result = new ExecutionResult(
          process.exitValue(), collect(stdout, command), collect(stderr, command), elapsed);
      metrics.observe(METRIC_LATENCY, elapsed.toMillis());
      log.debug("Command exited with {} after {}ms; stdout={}; stderr={}",
          result.exitCode(), elapsed.toMillis(),
          Logs.truncate(result.stdout(), LOGGED_OUTPUT_BYTES),
          Logs.truncate(result.stderr(), LOGGED_OUTPUT_BYTES));

      if (command.checkExitCode() && !result.success()) {
        metrics.increment(METRIC_FAILED);
        log.warn("Command failed with exit code {}: {} ({})",
            result.exitCode(), rendered, Logs.truncate(result.firstStderrLine(), LOGGED_OUTPUT_BYTES));
        throw new CommandFailedException(command, result);
      }
      metrics.increment(METRIC_COMPLETED);
      return result;
    } catch (InterruptedException ex) {
      destroy(process, rendered);
      log.warn("Interrupted while waiting for command; killed {}", rendered);
      throw ex;
    } finally {
      if (process.isAlive()) {
        destroy(process, rendered);
      }
      cancel(stdout);
      cancel(stderr);
    }
  }

  private static void closeStdin(Process process, String rendered) {
    try {
      process.getOutputStream().close();
    } catch (IOException ex) {
      log.debug("Unable to close stdin of {}", rendered, ex);
    }
  }

  private static String readFully(InputStream in) throws IOException {
    try (InputStream stream = in) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static String collect(Future<String> output, CommandSpec command)
      throws CommandException, InterruptedException {
    if (output == null) {
      return "";
    }
    try {
      return output.get(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      // A grandchild may still hold the pipe open after the child exited.
      log.warn("Output of {} still open {}ms after exit; discarding it",
          Logs.renderCommand(command.argv()), DRAIN_GRACE_MILLIS);
      output.cancel(true);
      return "";
    } catch (ExecutionException ex) {
      throw new CommandException("Failed to read command output: " + ex.getCause().getMessage(),
          command, ex.getCause());
    }
  }

  private static void destroy(Process process, String rendered) {
    // Snapshot first: once the child dies its descendants are reparented and no longer listed.
    List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
    descendants.forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    if (!descendants.isEmpty()) {
      log.debug("Killed {} descendant process(es) of {}", descendants.size(), rendered);
    }
    try {
      if (!process.waitFor(KILL_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.error("Process did not exit after forced kill: {}", rendered);
      }
      for (ProcessHandle descendant : descendants) {
        try {
          descendant.onExit().get(KILL_WAIT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException ex) {
          log.error("Descendant {} of {} did not exit after forced kill", descendant.pid(), rendered);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for killed process to exit: {}", rendered);
    }
  }

  private static void cancel(Future<String> future) {
    if (future != null && !future.isDone()) {
      future.cancel(true);
    }
  }
}
