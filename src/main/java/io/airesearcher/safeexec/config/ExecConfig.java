package io.airesearcher.safeexec.config;

import io.airesearcher.safeexec.application.git.GitSettings;
import io.airesearcher.safeexec.application.latex.LatexSettings;
import io.airesearcher.safeexec.application.script.ScriptSettings;
import io.airesearcher.safeexec.validation.Numbers;
import io.airesearcher.safeexec.validation.Strings;
import io.airesearcher.safeexec.validation.ValidationException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Effective configuration of the SafeExec tools.
 * <p><strong>Why:</strong> Built once from defaults, YAML and CLI overrides, then handed to
 * {@link CompositionRoot}; no component reads configuration on its own.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param workspaceRoot directory that command-line paths must stay inside
 * @param gitBinary git executable
 * @param gitCloneTimeout bound for {@code git clone}
 * @param gitCheckoutTimeout bound for {@code git checkout}
 * @param gitDepth default clone depth; {@code 0} disables shallow clones
 * @param latexBinary typesetting engine
 * @param latexBibtexBinary bibliography tool
 * @param latexRuns default pass count
 * @param latexPassTimeout bound per pass
 * @param latexBibtexTimeout bound for the bibliography step
 * @param latexOutputExtension extension of the produced document
 * @param latexSanitizeSource whether document sources are checked for denied commands
 * @param scriptInterpreter interpreter executable
 * @param scriptExtension required script extension
 * @param scriptTimeout bound per script run
 * @param scriptBaseDirectory directory scripts must live in, if restricted
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record ExecConfig(
    Path workspaceRoot,
    String gitBinary,
    Duration gitCloneTimeout,
    Duration gitCheckoutTimeout,
    int gitDepth,
    String latexBinary,
    String latexBibtexBinary,
    int latexRuns,
    Duration latexPassTimeout,
    Duration latexBibtexTimeout,
    String latexOutputExtension,
    boolean latexSanitizeSource,
    String scriptInterpreter,
    String scriptExtension,
    Duration scriptTimeout,
    Optional<Path> scriptBaseDirectory,
    String metricsExporter) {

  private static final int MAX_TIMEOUT_SECONDS = 86_400;
  private static final int MAX_DEPTH = 1_000_000;

  public ExecConfig {
    workspaceRoot = Objects.requireNonNullElse(workspaceRoot, Path.of("")).toAbsolutePath().normalize();
    scriptBaseDirectory = Objects.requireNonNullElse(scriptBaseDirectory, Optional.empty());
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "none").trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
  }

  /**
   * Returns the built-in configuration rooted at the current working directory.
   *
   * @return default configuration
   */
  public static ExecConfig defaults() {
    GitSettings git = GitSettings.defaults();
    LatexSettings latex = LatexSettings.defaults();
    ScriptSettings script = ScriptSettings.defaults();
    return new ExecConfig(
        Path.of(""),
        git.binary(),
        git.cloneTimeout(),
        git.checkoutTimeout(),
        git.defaultDepth(),
        latex.binary(),
        latex.bibtexBinary(),
        latex.runs(),
        latex.passTimeout(),
        latex.bibtexTimeout(),
        latex.outputExtension(),
        latex.sanitizeSource(),
        script.interpreter(),
        script.extension(),
        script.timeout(),
        script.baseDirectory(),
        "none");
  }

  /**
   * Creates a configuration from flattened key/value pairs; absent or blank keys keep their defaults.
   *
   * @param options keys such as {@code git.binary} or {@code latex.runs}
   * @return populated configuration
   * @throws ValidationException when a value is malformed or out of range
   */
  public static ExecConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ExecConfig d = defaults();
    return new ExecConfig(
        path(options, "workspaceRoot").orElse(d.workspaceRoot()),
        binary(options, "git.binary", d.gitBinary()),
        seconds(options, "git.cloneTimeoutSeconds", d.gitCloneTimeout()),
        seconds(options, "git.checkoutTimeoutSeconds", d.gitCheckoutTimeout()),
        integer(options, "git.depth", 0, MAX_DEPTH, d.gitDepth()),
        binary(options, "latex.binary", d.latexBinary()),
        binary(options, "latex.bibtexBinary", d.latexBibtexBinary()),
        integer(options, "latex.runs", 1, LatexSettings.MAX_RUNS, d.latexRuns()),
        seconds(options, "latex.passTimeoutSeconds", d.latexPassTimeout()),
        seconds(options, "latex.bibtexTimeoutSeconds", d.latexBibtexTimeout()),
        extension(options, "latex.outputExtension", d.latexOutputExtension()),
        bool(options, "latex.sanitizeSource", d.latexSanitizeSource()),
        binary(options, "script.interpreter", d.scriptInterpreter()),
        extension(options, "script.extension", d.scriptExtension()),
        seconds(options, "script.timeoutSeconds", d.scriptTimeout()),
        path(options, "script.baseDirectory"),
        value(options, "metricsExporter").orElse(d.metricsExporter()));
  }

  /** @return git settings derived from this configuration */
  public GitSettings gitSettings() {
    return new GitSettings(gitBinary, gitCloneTimeout, gitCheckoutTimeout, gitDepth);
  }

  /** @return LaTeX settings derived from this configuration */
  public LatexSettings latexSettings() {
    return new LatexSettings(latexBinary, latexBibtexBinary, latexRuns, latexPassTimeout, latexBibtexTimeout,
        latexOutputExtension, latexSanitizeSource);
  }

  /** @return script settings derived from this configuration */
  public ScriptSettings scriptSettings() {
    return new ScriptSettings(scriptInterpreter, scriptExtension, scriptTimeout, scriptBaseDirectory);
  }

  private static Optional<String> value(Map<String, String> options, String key) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw.trim());
  }

  private static String binary(Map<String, String> options, String key, String fallback) {
    return value(options, key)
        .map(v -> Strings.requireNoShellMetacharacters(key, Strings.requireNonBlank(key, v)))
        .orElse(fallback);
  }

  private static String extension(Map<String, String> options, String key, String fallback) {
    return value(options, key)
        .map(v -> Strings.requireNoShellMetacharacters(key, Strings.requireNoTraversal(key, v)))
        .orElse(fallback);
  }

  private static Duration seconds(Map<String, String> options, String key, Duration fallback) {
    return value(options, key)
        .map(v -> Duration.ofSeconds(Numbers.parseIntInRange(key, v, 1, MAX_TIMEOUT_SECONDS)))
        .orElse(fallback);
  }

  private static int integer(Map<String, String> options, String key, int min, int max, int fallback) {
    return value(options, key).map(v -> Numbers.parseIntInRange(key, v, min, max)).orElse(fallback);
  }

  private static boolean bool(Map<String, String> options, String key, boolean fallback) {
    Optional<String> raw = value(options, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    String normalized = raw.get().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new ValidationException(key, "must be true or false", raw.get());
    }
    return Boolean.parseBoolean(normalized);
  }

  private static Optional<Path> path(Map<String, String> options, String key) {
    Optional<String> raw = value(options, key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    String text = Strings.requireNonBlank(key, raw.get());
    try {
      return Optional.of(Path.of(text).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new ValidationException(key, "is not a valid path", text, ex);
    }
  }
}
