package io.airesearcher.safeexec.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each SafeExec command.
 *
 * <p>The defaults are the single source of truth for the keys YAML files may set.</p>
 */
public final class DefaultsForMode {
  /** Commands that accept configuration. */
  public static final Set<String> MODES = Set.of("clone", "checkout", "compile", "script");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command (clone, checkout, compile, script)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "clone" -> Map.of("dryRun", "false");
      case "checkout" -> Map.of("create", "false", "dryRun", "false");
      case "compile", "script" -> Map.<String, String>of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ExecConfig defaults = ExecConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workspaceRoot", defaults.workspaceRoot().toString());
    map.put("git.binary", defaults.gitBinary());
    map.put("git.cloneTimeoutSeconds", Long.toString(defaults.gitCloneTimeout().toSeconds()));
    map.put("git.checkoutTimeoutSeconds", Long.toString(defaults.gitCheckoutTimeout().toSeconds()));
    map.put("git.depth", Integer.toString(defaults.gitDepth()));
    map.put("latex.binary", defaults.latexBinary());
    map.put("latex.bibtexBinary", defaults.latexBibtexBinary());
    map.put("latex.runs", Integer.toString(defaults.latexRuns()));
    map.put("latex.passTimeoutSeconds", Long.toString(defaults.latexPassTimeout().toSeconds()));
    map.put("latex.bibtexTimeoutSeconds", Long.toString(defaults.latexBibtexTimeout().toSeconds()));
    map.put("latex.outputExtension", defaults.latexOutputExtension());
    map.put("latex.sanitizeSource", Boolean.toString(defaults.latexSanitizeSource()));
    map.put("script.interpreter", defaults.scriptInterpreter());
    map.put("script.extension", defaults.scriptExtension());
    map.put("script.timeoutSeconds", Long.toString(defaults.scriptTimeout().toSeconds()));
    map.put("script.baseDirectory", defaults.scriptBaseDirectory().map(Object::toString).orElse(""));
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
