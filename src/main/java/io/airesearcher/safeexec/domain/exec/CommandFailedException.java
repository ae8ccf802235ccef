package io.airesearcher.safeexec.domain.exec;

import io.airesearcher.safeexec.logging.Logs;

/**
 * A mediated process exited with a non-zero code that its call site checks.
 *
 * @since 0.1.0
 */
public final class CommandFailedException extends CommandException {
  private static final long serialVersionUID = 1L;
  private static final int MESSAGE_OUTPUT_BYTES = 2_048;

  private final int exitCode;
  private final String stdout;
  private final String stderr;

  /**
   * Creates a failure from a finished process.
   *
   * @param command command that ran
   * @param result captured outcome with a non-zero exit code
   */
  public CommandFailedException(CommandSpec command, ExecutionResult result) {
    this("Command failed with exit code " + result.exitCode(), command, result);
  }

  /**
   * Creates a failure with a caller-specific message.
   *
   * @param message description, e.g. which compilation pass failed
   * @param command command that ran
   * @param result captured outcome
   */
  public CommandFailedException(String message, CommandSpec command, ExecutionResult result) {
    super(message + "\nCommand: " + Logs.renderCommand(command.argv())
        + "\nError: " + Logs.truncate(result.stderr(), MESSAGE_OUTPUT_BYTES), command, null);
    this.exitCode = result.exitCode();
    this.stdout = result.stdout();
    this.stderr = result.stderr();
  }

  /** @return the process exit code */
  public int exitCode() {
    return exitCode;
  }

  /** @return full captured standard output */
  public String stdout() {
    return stdout;
  }

  /** @return full captured standard error */
  public String stderr() {
    return stderr;
  }
}
