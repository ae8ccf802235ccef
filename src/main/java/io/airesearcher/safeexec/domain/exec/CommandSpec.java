package io.airesearcher.safeexec.domain.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable description of one process to run.
 * <p><strong>Why:</strong> The command is an ordered argument vector, program first. No factory accepts a
 * single command string, so there is no code path that could hand a concatenated line to a shell.</p>
 * <p><strong>Role:</strong> Input of {@link io.airesearcher.safeexec.application.port.CommandExecutor}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; collections are defensively copied.</p>
 *
 * @param argv non-empty argument vector; no element may be {@code null} or contain NUL
 * @param directory directory the process starts in; {@code null} inherits the JVM's
 * @param timeout maximum wall-clock time before the process is killed; must be positive
 * @param environment variables set on top of the inherited environment
 * @param checkExitCode whether a non-zero exit is itself a failure
 * @param captureOutput whether stdout and stderr are captured; otherwise they go to the JVM's streams
 * @since 0.1.0
 */
public record CommandSpec(
    List<String> argv,
    Path directory,
    Duration timeout,
    Map<String, String> environment,
    boolean checkExitCode,
    boolean captureOutput) {

  /** Timeout applied when a builder does not set one. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  /**
   * Validates and copies the components.
   *
   * @throws IllegalArgumentException if the vector is empty, an element contains NUL, or the timeout is
   *         not positive
   */
  public CommandSpec {
    Objects.requireNonNull(argv, "argv");
    if (argv.isEmpty()) {
      throw new IllegalArgumentException("argv must contain at least the program name");
    }
    for (int i = 0; i < argv.size(); i++) {
      String arg = Objects.requireNonNull(argv.get(i), "argv[" + i + "]");
      if (arg.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argv[" + i + "] must not contain null bytes");
      }
    }
    if (argv.get(0).isBlank()) {
      throw new IllegalArgumentException("program name must not be blank");
    }
    argv = List.copyOf(argv);
    timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive (was " + timeout + ")");
    }
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Starts a builder for {@code program} followed by {@code args}.
   *
   * @param program executable name or path
   * @param args further arguments, each passed to the process verbatim
   * @return builder with default settings
   */
  public static Builder builder(String program, String... args) {
    return new Builder(program).args(Arrays.asList(args));
  }

  /**
   * Creates a spec with default settings for {@code argv}.
   *
   * @param argv argument vector, program first
   * @return spec with the default timeout, exit code checking, and output capture
   */
  public static CommandSpec of(List<String> argv) {
    return new CommandSpec(argv, null, DEFAULT_TIMEOUT, Map.of(), true, true);
  }

  /**
   * Returns the program name.
   *
   * @return first element of {@link #argv()}
   */
  public String program() {
    return argv.get(0);
  }

  /**
   * Returns the working directory.
   *
   * @return {@link #directory()}, or empty when the JVM's is inherited
   */
  public Optional<Path> workingDirectory() {
    return Optional.ofNullable(directory);
  }

  /** Fluent builder for {@link CommandSpec}. */
  public static final class Builder {
    private final List<String> argv = new ArrayList<>();
    private Path workingDirectory;
    private Duration timeout = DEFAULT_TIMEOUT;
    private final Map<String, String> environment = new LinkedHashMap<>();
    private boolean checkExitCode = true;
    private boolean captureOutput = true;

    private Builder(String program) {
      argv.add(Objects.requireNonNull(program, "program"));
    }

    /** Appends one argument. */
    public Builder arg(String arg) {
      argv.add(Objects.requireNonNull(arg, "arg"));
      return this;
    }

    /** Appends arguments in order. */
    public Builder args(List<String> args) {
      for (String arg : Objects.requireNonNull(args, "args")) {
        arg(arg);
      }
      return this;
    }

    /** Sets the working directory. */
    public Builder workingDirectory(Path directory) {
      this.workingDirectory = directory;
      return this;
    }

    /** Sets the timeout. */
    public Builder timeout(Duration timeout) {
      this.timeout = Objects.requireNonNull(timeout, "timeout");
      return this;
    }

    /** Adds environment overrides. */
    public Builder environment(Map<String, String> overrides) {
      if (overrides != null) {
        environment.putAll(overrides);
      }
      return this;
    }

    /** Controls whether a non-zero exit fails the call. */
    public Builder checkExitCode(boolean check) {
      this.checkExitCode = check;
      return this;
    }

    /** Controls whether stdout and stderr are captured. */
    public Builder captureOutput(boolean capture) {
      this.captureOutput = capture;
      return this;
    }

    /** Builds the immutable spec. */
    public CommandSpec build() {
      return new CommandSpec(
          argv, workingDirectory, timeout, environment, checkExitCode, captureOutput);
    }
  }
}
