package io.airesearcher.safeexec.application.port;

import io.airesearcher.safeexec.domain.exec.CommandException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;

/**
 * <strong>What:</strong> Domain port that runs one external process described by a {@link CommandSpec}.
 * <p><strong>Why:</strong> Lets git, LaTeX and script operations be exercised without spawning real
 * processes, and keeps every process launch behind a single audited seam.</p>
 * <p><strong>Role:</strong> Port implemented by {@code ProcessCommandExecutor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Start the process from the argument vector without a shell.</li>
 *   <li>Bound it by the command's timeout and kill it on expiry, interruption, or failure.</li>
 *   <li>Report non-zero exits as {@code CommandFailedException} when the command asks for it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent calls for independent working
 * directories.</p>
 *
 * @since 0.1.0
 */
public interface CommandExecutor {

  /**
   * Runs the process and waits for it to exit.
   *
   * @param command process to run; must not be {@code null}
   * @return exit code, captured output and elapsed time
   * @throws io.airesearcher.safeexec.domain.exec.CommandFailedException if the exit code is non-zero and
   *         {@link CommandSpec#checkExitCode()} is set
   * @throws io.airesearcher.safeexec.domain.exec.CommandTimeoutException if the timeout expired; the
   *         process has been destroyed
   * @throws CommandException if the process could not be started
   * @throws InterruptedException if the calling thread was interrupted; the process has been destroyed
   */
  ExecutionResult execute(CommandSpec command) throws CommandException, InterruptedException;
}
