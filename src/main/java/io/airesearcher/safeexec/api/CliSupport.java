package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.config.ConfigMerger;
import io.airesearcher.safeexec.config.DefaultsForMode;
import io.airesearcher.safeexec.config.ExecConfig;
import io.airesearcher.safeexec.config.YamlConfigLoader;
import io.airesearcher.safeexec.domain.exec.CommandException;
import io.airesearcher.safeexec.domain.exec.CommandTimeoutException;
import io.airesearcher.safeexec.logging.LoggingConfigurator;
import io.airesearcher.safeexec.validation.Paths;
import io.airesearcher.safeexec.validation.ValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Argument, configuration and failure handling shared by the SafeExec subcommands.
 *
 * <p>{@link #prepare} parses {@code key=value} arguments, merges them over YAML and defaults, applies
 * telemetry settings and builds the {@link ExecConfig}. {@link #execute} maps every failure class to its
 * {@link ExitCode}.</p>
 */
final class CliSupport {

  private CliSupport() {}

  /** Work performed by a subcommand once its inputs are prepared. */
  @FunctionalInterface
  interface Action {
    ExitCode run() throws Exception;
  }

  /**
   * Result of {@link #prepare}: either ready to run, or an exit code to return immediately.
   *
   * @param input parsed arguments
   * @param options effective settings, CLI arguments included
   * @param config typed configuration
   * @param exit early exit code, or {@code null} when ready
   */
  record Prepared(CliInput input, Map<String, String> options, ExecConfig config, ExitCode exit) {
    static Prepared stop(ExitCode code) {
      return new Prepared(null, Map.of(), null, code);
    }

    boolean ready() {
      return exit == null;
    }
  }

  static Prepared prepare(String mode, String[] args, String usage, String helpText, Logger log) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return Prepared.stop(ExitCode.SUCCESS);
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", mode);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Prepared.stop(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.isRegularFile(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return Prepared.stop(ExitCode.CONFIG_ERROR);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Prepared.stop(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Prepared.stop(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    ExecConfig config;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      config = ExecConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Prepared.stop(ExitCode.CONFIG_ERROR);
    }
    log.debug("Effective {} configuration: workspaceRoot={}, metricsExporter={}",
        mode, config.workspaceRoot(), config.metricsExporter());
    return new Prepared(input, Map.copyOf(effective), config, null);
  }

  /**
   * Resolves a command-line path inside the configured workspace root.
   *
   * @throws ValidationException if the path escapes the workspace or is missing when required
   */
  static Path workspacePath(ExecConfig config, String name, String raw, boolean mustExist) {
    return Paths.validatePath(name, raw, config.workspaceRoot(), mustExist).path();
  }

  static ExitCode execute(String operation, Logger log, Action action) {
    try {
      return action.run();
    } catch (ValidationException ex) {
      log.error("Rejected {} input: {}", operation, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (CommandTimeoutException ex) {
      log.error("{} timed out: {}", operation, ex.getMessage());
      return ExitCode.TIMEOUT;
    } catch (CommandException ex) {
      log.error("{} failed: {}", operation, ex.getMessage());
      return ExitCode.COMMAND_FAILED;
    } catch (IOException ex) {
      log.error("{} I/O failure", operation, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; child process killed", operation, ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", operation, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", operation, ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in {}", operation, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
