package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.validation.Numbers;
import java.util.Map;

/**
 * Option lookups shared by the subcommands once {@code key=value} arguments have been split from
 * the {@code config=} file reference.
 *
 * <p>Blank values count as absent everywhere.</p>
 */
final class ConfigCliUtils {
  static final String CONFIG_KEY = "config";

  private ConfigCliUtils() {}

  /** Removes {@code config=} from {@code args} so the remaining entries are pure overrides. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || !args.containsKey(CONFIG_KEY)) {
      return null;
    }
    return trimToNull(args.remove(CONFIG_KEY));
  }

  static boolean parseBoolean(Map<String, String> options, String key, boolean fallback) {
    String value = optional(options, key);
    return value == null ? fallback : Boolean.parseBoolean(value);
  }

  static String required(Map<String, String> options, String key) {
    String value = optional(options, key);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  static String optional(Map<String, String> options, String key) {
    return options == null ? null : trimToNull(options.get(key));
  }

  /**
   * Reads a bounded integer option, falling back to {@code fallback} when it is absent.
   *
   * @throws io.airesearcher.safeexec.validation.ValidationException if present but not an integer in
   *         {@code [min, max]}
   */
  static int intOption(Map<String, String> options, String key, int fallback, int min, int max) {
    String value = optional(options, key);
    return value == null ? fallback : Numbers.parseIntInRange(key, value, min, max);
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
