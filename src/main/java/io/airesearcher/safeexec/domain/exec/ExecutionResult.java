package io.airesearcher.safeexec.domain.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable outcome of a finished process.
 *
 * @param exitCode OS exit code (0 = success)
 * @param stdout captured standard output; empty when capture was disabled
 * @param stderr captured standard error; empty when capture was disabled
 * @param elapsed wall-clock time from start to exit
 * @since 0.1.0
 */
public record ExecutionResult(int exitCode, String stdout, String stderr, Duration elapsed) {

  public ExecutionResult {
    stdout = Objects.requireNonNullElse(stdout, "");
    stderr = Objects.requireNonNullElse(stderr, "");
    elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
  }

  /** Returns {@code true} if the exit code is 0. */
  public boolean success() {
    return exitCode == 0;
  }

  /** Returns the first non-blank line of stderr, or an empty string. */
  public String firstStderrLine() {
    return stderr.lines()
        .filter(l -> !l.isBlank())
        .findFirst()
        .orElse("");
  }
}
