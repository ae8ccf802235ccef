package io.airesearcher.safeexec.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by the validators, configuration and CLI.
 * <p><strong>Why:</strong> Guards ports, clone depths, pass counts and timeouts before they reach a
 * command line.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws ValidationException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ValidationException(
          name, "must be between " + min + " and " + max, Long.toString(value));
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw decimal text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws ValidationException if the text is not an integer or is out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    final int parsed;
    try {
      parsed = Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new ValidationException(name, "must be numeric", trimmed, ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }
}
