package io.airesearcher.safeexec.application.script;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for {@link ScriptRunner}.
 *
 * @param interpreter interpreter executable placed before the script path
 * @param extension required script file extension, including the dot
 * @param timeout default bound for a script run
 * @param baseDirectory directory scripts must live in, if restricted
 * @since 0.1.0
 */
public record ScriptSettings(String interpreter, String extension, Duration timeout, Optional<Path> baseDirectory) {

  public ScriptSettings {
    interpreter = Objects.requireNonNullElse(interpreter, "python3").trim();
    if (interpreter.isEmpty()) {
      throw new IllegalArgumentException("interpreter must not be blank");
    }
    extension = Objects.requireNonNullElse(extension, ".py").trim();
    if (!extension.startsWith(".") || extension.length() < 2) {
      throw new IllegalArgumentException("extension must start with '.' (was '" + extension + "')");
    }
    timeout = Objects.requireNonNullElse(timeout, Duration.ofSeconds(300));
    baseDirectory = Objects.requireNonNullElse(baseDirectory, Optional.empty());
  }

  /** Returns {@code python3}, {@code .py}, 300s and no base directory restriction. */
  public static ScriptSettings defaults() {
    return new ScriptSettings("python3", ".py", Duration.ofSeconds(300), Optional.empty());
  }
}
