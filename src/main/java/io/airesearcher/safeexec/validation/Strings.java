package io.airesearcher.safeexec.validation;

/**
 * <strong>What:</strong> Shared string checks used by the validators, configuration parsing and the CLI.
 * <p><strong>Why:</strong> Every validated value starts from the same presence, whitespace and control
 * character rules, so diagnostics stay consistent across identifiers, branches, URLs and paths.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans.</p>
 * <p><strong>Observability:</strong> No metrics or logs; failures raise {@link ValidationException}.</p>
 *
 * @since 0.1.0
 * @see Identifiers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is present, free of NUL bytes, and not whitespace-only.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @return input with leading and trailing whitespace stripped
   * @throws ValidationException if the value is {@code null}, contains NUL, or is blank
   */
  public static String requireNonBlank(String name, String value) {
    if (value == null) {
      throw new ValidationException(name, "must be a non-empty string", null);
    }
    if (value.indexOf('\0') >= 0) {
      throw new ValidationException(name, "must not contain null bytes", value);
    }
    String stripped = value.strip();
    if (stripped.isEmpty()) {
      throw new ValidationException(name, "must not be empty or whitespace only", value);
    }
    return stripped;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws ValidationException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    requireMaxLength(name, sanitized, maxLength);
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new ValidationException(name, "must contain printable ASCII characters only", sanitized);
      }
    }
    return sanitized;
  }

  /**
   * Rejects values longer than {@code maxLength} characters.
   *
   * @param name logical name for diagnostics
   * @param value candidate string, already known to be non-null
   * @param maxLength inclusive upper bound
   * @return {@code value} unchanged
   * @throws ValidationException if the value is too long
   */
  public static String requireMaxLength(String name, String value, int maxLength) {
    if (value.length() > maxLength) {
      throw new ValidationException(
          name, "is too long (" + value.length() + " characters > " + maxLength + " max)", value);
    }
    return value;
  }

  /**
   * Rejects values containing any shell metacharacter listed in {@link DeniedTokens#SHELL_METACHARACTERS}.
   *
   * @param name logical name for diagnostics
   * @param value candidate string, already known to be non-null
   * @return {@code value} unchanged
   * @throws ValidationException naming every metacharacter found
   */
  public static String requireNoShellMetacharacters(String name, String value) {
    var found = DeniedTokens.shellMetacharactersIn(value);
    if (!found.isEmpty()) {
      StringBuilder listed = new StringBuilder();
      for (Character c : found) {
        if (listed.length() > 0) {
          listed.append(", ");
        }
        listed.append('\'').append(c).append('\'');
      }
      throw new ValidationException(name, "must not contain shell metacharacters (found " + listed + ")", value);
    }
    return value;
  }

  /**
   * Rejects values containing the parent-directory sequence {@code ..}.
   *
   * @param name logical name for diagnostics
   * @param value candidate string, already known to be non-null
   * @return {@code value} unchanged
   * @throws ValidationException if {@code ..} is present
   */
  public static String requireNoTraversal(String name, String value) {
    if (value.contains("..")) {
      throw new ValidationException(name, "must not contain '..' (path traversal)", value);
    }
    return value;
  }
}
