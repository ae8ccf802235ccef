package io.airesearcher.safeexec.application.git;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for {@link GitOperations}.
 *
 * @param binary git executable name or path
 * @param cloneTimeout default bound for {@code git clone}
 * @param checkoutTimeout default bound for {@code git checkout}
 * @param defaultDepth default clone depth; {@code 0} clones full history
 * @since 0.1.0
 */
public record GitSettings(String binary, Duration cloneTimeout, Duration checkoutTimeout, int defaultDepth) {

  public GitSettings {
    binary = Objects.requireNonNullElse(binary, "git");
    if (binary.isBlank()) {
      throw new IllegalArgumentException("git binary must not be blank");
    }
    cloneTimeout = Objects.requireNonNullElse(cloneTimeout, Duration.ofSeconds(300));
    checkoutTimeout = Objects.requireNonNullElse(checkoutTimeout, Duration.ofSeconds(60));
    if (defaultDepth < 0) {
      throw new IllegalArgumentException("defaultDepth must not be negative");
    }
  }

  /** Returns {@code git} with a 300s clone bound, 60s checkout bound and shallow clones. */
  public static GitSettings defaults() {
    return new GitSettings("git", Duration.ofSeconds(300), Duration.ofSeconds(60), 1);
  }
}
