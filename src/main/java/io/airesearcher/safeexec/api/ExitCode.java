package io.airesearcher.safeexec.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the SafeExec command-line tools.
 * <p><strong>Why:</strong> Lets automation tell rejected input from a failing git, LaTeX or script run.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The clone, checkout, compile or script run completed. */
  SUCCESS(0),
  /** An argument was malformed or rejected by a validator; nothing was executed. */
  INVALID_ARGS(2),
  /** Reading the config file or touching the workspace failed. */
  IO_ERROR(3),
  /** The YAML file or a config override could not be turned into an {@code ExecConfig}. */
  CONFIG_ERROR(4),
  /** A bug or unanticipated exception; see the log. */
  RUNTIME_FAILURE(5),
  /** The mediated command failed, could not start, or produced no output document. */
  COMMAND_FAILED(6),
  /** The mediated command exceeded its timeout and was killed. */
  TIMEOUT(124),
  /** The CLI thread was interrupted and the child process was killed. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
