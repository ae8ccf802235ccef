package io.airesearcher.safeexec.validation;

/**
 * <strong>What:</strong> Validation of free-form identifiers such as research fields, instance ids and
 * model names before they are embedded in file names or argument vectors.
 * <p><strong>Why:</strong> Identifiers arrive from users and from model output; each one is checked
 * against an allow-listed charset and, independently, against the shell metacharacter table.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> No logs; failures raise {@link ValidationException}.</p>
 *
 * @since 0.1.0
 * @see DeniedTokens
 */
public final class Identifiers {
  /** Default maximum identifier length. */
  public static final int DEFAULT_MAX_LENGTH = 50;
  /** Maximum model-name length. */
  public static final int MODEL_NAME_MAX_LENGTH = 200;

  private Identifiers() {
    // Utility
  }

  /**
   * Validates an identifier with the default policy: at most {@value #DEFAULT_MAX_LENGTH} characters,
   * dash and underscore allowed, slash rejected.
   *
   * @param name field name used in diagnostics
   * @param value untrusted input
   * @return validated identifier
   * @throws ValidationException if the value violates the policy
   */
  public static ValidatedIdentifier validateIdentifier(String name, String value) {
    return validateIdentifier(name, value, DEFAULT_MAX_LENGTH, true, true, false);
  }

  /**
   * Validates an identifier against a charset built from alphanumerics plus the opted-in characters.
   *
   * <p>Checks, in order: presence and NUL bytes, blankness, length, the shell metacharacter veto,
   * {@code ..}, and finally the charset. The metacharacter veto does not depend on the flags.</p>
   *
   * @param name field name used in diagnostics
   * @param value untrusted input; surrounding whitespace is stripped before checking
   * @param maxLength inclusive maximum length after stripping
   * @param allowDash whether {@code -} is part of the charset
   * @param allowUnderscore whether {@code _} is part of the charset
   * @param allowSlash whether {@code /} is part of the charset
   * @return validated identifier holding the stripped value
   * @throws ValidationException if any check fails
   */
  public static ValidatedIdentifier validateIdentifier(
      String name,
      String value,
      int maxLength,
      boolean allowDash,
      boolean allowUnderscore,
      boolean allowSlash) {
    String stripped = Strings.requireNonBlank(name, value);
    Strings.requireMaxLength(name, stripped, maxLength);
    Strings.requireNoShellMetacharacters(name, stripped);
    Strings.requireNoTraversal(name, stripped);
    for (int i = 0; i < stripped.length(); i++) {
      char c = stripped.charAt(i);
      boolean allowed = isAsciiAlnum(c)
          || (allowDash && c == '-')
          || (allowUnderscore && c == '_')
          || (allowSlash && c == '/');
      if (!allowed) {
        throw new ValidationException(
            name, "contains invalid characters (allowed: " + describe(allowDash, allowUnderscore, allowSlash) + ")",
            stripped);
      }
    }
    return new ValidatedIdentifier(stripped);
  }

  /**
   * Validates an LLM model name such as {@code openrouter/google/gemini-2.5-pro}.
   *
   * @param model untrusted model name
   * @return validated identifier over the charset {@code [A-Za-z0-9/_.-]}
   * @throws ValidationException if the name is blank, longer than {@value #MODEL_NAME_MAX_LENGTH}
   *         characters, contains {@code ..}, or has characters outside the charset
   */
  public static ValidatedIdentifier validateModelName(String model) {
    String stripped = Strings.requireNonBlank("model name", model);
    Strings.requireMaxLength("model name", stripped, MODEL_NAME_MAX_LENGTH);
    for (int i = 0; i < stripped.length(); i++) {
      char c = stripped.charAt(i);
      if (!(isAsciiAlnum(c) || c == '/' || c == '_' || c == '.' || c == '-')) {
        throw new ValidationException(
            "model name", "contains invalid characters (allowed: alphanumeric, dash, underscore, slash, dot)",
            stripped);
      }
    }
    Strings.requireNoTraversal("model name", stripped);
    return new ValidatedIdentifier(stripped);
  }

  static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }

  private static String describe(boolean dash, boolean underscore, boolean slash) {
    StringBuilder sb = new StringBuilder("alphanumeric");
    if (dash) {
      sb.append(" + dash");
    }
    if (underscore) {
      sb.append(" + underscore");
    }
    if (slash) {
      sb.append(" + slash");
    }
    return sb.toString();
  }
}
