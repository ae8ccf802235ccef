package io.airesearcher.safeexec.domain.exec;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Base failure of a mediated process.
 * <p><strong>Why:</strong> Carries the argument vector and working directory so callers can diagnose and
 * decide their own retry policy; this layer never retries.</p>
 * <p><strong>Role:</strong> Thrown directly when a process cannot be started; subclasses describe
 * non-zero exits, timeouts, and missing compilation artifacts.</p>
 *
 * @since 0.1.0
 * @see CommandFailedException
 * @see CommandTimeoutException
 */
public class CommandException extends Exception {
  private static final long serialVersionUID = 1L;

  private final List<String> argv;
  private final String workingDirectory;

  /**
   * Creates a failure for {@code command}.
   *
   * @param message description of what went wrong
   * @param command the command that failed
   * @param cause underlying failure; may be {@code null}
   */
  public CommandException(String message, CommandSpec command, Throwable cause) {
    this(message, command.argv(), command.workingDirectory().orElse(null), cause);
  }

  /**
   * Creates a failure for an explicit argument vector.
   *
   * @param message description of what went wrong
   * @param argv argument vector that failed
   * @param workingDirectory working directory used; {@code null} when the JVM's was inherited
   * @param cause underlying failure; may be {@code null}
   */
  public CommandException(String message, List<String> argv, Path workingDirectory, Throwable cause) {
    super(message, cause);
    this.argv = List.copyOf(argv);
    // Path is not Serializable
    this.workingDirectory = workingDirectory == null ? null : workingDirectory.toString();
  }

  /**
   * Returns the argument vector of the failed process.
   *
   * @return immutable argument vector
   */
  public List<String> argv() {
    return argv;
  }

  /**
   * Returns the working directory of the failed process.
   *
   * @return working directory, if one was set
   */
  public Optional<Path> workingDirectory() {
    return Optional.ofNullable(workingDirectory).map(Path::of);
  }
}
