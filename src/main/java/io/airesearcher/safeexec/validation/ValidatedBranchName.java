package io.airesearcher.safeexec.validation;

import java.util.Objects;

/**
 * A git branch name that satisfies the identifier rules plus git's ref restrictions.
 *
 * <p>Created only by {@link GitRefs#validateBranchName(String)}.</p>
 *
 * @since 0.1.0
 */
public final class ValidatedBranchName {
  private final String value;

  ValidatedBranchName(String value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  /**
   * Returns the branch name.
   *
   * @return validated branch name
   */
  public String value() {
    return value;
  }

  /**
   * Views this branch name as a plain validated identifier.
   *
   * @return identifier with the same value
   */
  public ValidatedIdentifier asIdentifier() {
    return new ValidatedIdentifier(value);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ValidatedBranchName that && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
