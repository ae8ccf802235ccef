package io.airesearcher.safeexec.validation;

/**
 * Git ref validation for branch names passed to {@code git clone --branch} and {@code git checkout}.
 *
 * @since 0.1.0
 */
public final class GitRefs {
  /** Maximum branch name length accepted. */
  public static final int MAX_BRANCH_LENGTH = 255;

  private GitRefs() {
    // Utility
  }

  /**
   * Validates a branch name.
   *
   * <p>Accepts {@code [A-Za-z0-9/_-]} up to {@value #MAX_BRANCH_LENGTH} characters; rejects names that
   * start with {@code .} or {@code /}, end with {@code .lock}, or contain {@code ..}. A leading
   * {@code -} is refused by the same rule set git uses for option-looking refs.</p>
   *
   * @param branch untrusted branch name
   * @return validated branch name, stripped of surrounding whitespace
   * @throws ValidationException if any rule is violated
   */
  public static ValidatedBranchName validateBranchName(String branch) {
    String name = "branch name";
    String stripped = Strings.requireNonBlank(name, branch);
    Strings.requireMaxLength(name, stripped, MAX_BRANCH_LENGTH);
    Strings.requireNoShellMetacharacters(name, stripped);
    if (stripped.startsWith(".") || stripped.startsWith("/")) {
      throw new ValidationException(name, "cannot start with '.' or '/'", stripped);
    }
    if (stripped.startsWith("-")) {
      throw new ValidationException(name, "cannot start with '-'", stripped);
    }
    if (stripped.endsWith(".lock")) {
      throw new ValidationException(name, "cannot end with '.lock'", stripped);
    }
    if (stripped.contains("..")) {
      throw new ValidationException(name, "cannot contain '..'", stripped);
    }
    for (int i = 0; i < stripped.length(); i++) {
      char c = stripped.charAt(i);
      if (!(Identifiers.isAsciiAlnum(c) || c == '/' || c == '_' || c == '-')) {
        throw new ValidationException(
            name, "contains invalid characters (allowed: alphanumeric, dash, underscore, slash)", stripped);
      }
    }
    return new ValidatedBranchName(stripped);
  }
}
