package io.airesearcher.safeexec.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer receiving override and unknown-key notices
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-field validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> notices = warn == null ? message -> { } : warn;
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.containsKey(entry.getKey())) {
        notices.accept("Ignoring unknown YAML key for " + mode + ": " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        notices.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged, notices);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective, Consumer<String> notices) {
    String exporter = trim(effective.get("metricsExporter"));
    if (!trim(effective.get("otelEndpoint")).isEmpty() && !exporter.equalsIgnoreCase("otlp")) {
      notices.accept("otelEndpoint is ignored unless metricsExporter=otlp");
    }
    long passTimeout = parseLong(effective.get("latex.passTimeoutSeconds"));
    long bibtexTimeout = parseLong(effective.get("latex.bibtexTimeoutSeconds"));
    if (passTimeout > 0 && bibtexTimeout > 0 && bibtexTimeout > passTimeout) {
      notices.accept("latex.bibtexTimeoutSeconds exceeds latex.passTimeoutSeconds");
    }
    String workspace = trim(effective.get("workspaceRoot"));
    String scriptBase = trim(effective.get("script.baseDirectory"));
    if (workspace.isEmpty() && effective.containsKey("workspaceRoot")) {
      throw new IllegalArgumentException("workspaceRoot must not be blank");
    }
    if (!scriptBase.isEmpty() && scriptBase.contains("..")) {
      throw new IllegalArgumentException("script.baseDirectory must not contain '..'");
    }
  }

  private static long parseLong(String value) {
    if (value == null || value.isBlank()) {
      return -1L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      // Reported with the key name when ExecConfig parses the value.
      return -1L;
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
