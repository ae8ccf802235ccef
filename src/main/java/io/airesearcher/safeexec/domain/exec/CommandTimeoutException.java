package io.airesearcher.safeexec.domain.exec;

import io.airesearcher.safeexec.logging.Logs;
import java.time.Duration;

/**
 * A mediated process exceeded its timeout and was killed.
 *
 * @since 0.1.0
 */
public final class CommandTimeoutException extends CommandException {
  private static final long serialVersionUID = 1L;

  private final Duration timeout;

  /**
   * Creates a timeout failure.
   *
   * @param command command whose process was destroyed
   */
  public CommandTimeoutException(CommandSpec command) {
    super("Command timed out after " + command.timeout().toMillis() + "ms\nCommand: "
        + Logs.renderCommand(command.argv()), command, null);
    this.timeout = command.timeout();
  }

  /** @return the bound that was exceeded */
  public Duration timeout() {
    return timeout;
  }
}
