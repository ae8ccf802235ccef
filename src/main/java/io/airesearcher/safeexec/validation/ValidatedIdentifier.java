package io.airesearcher.safeexec.validation;

import java.util.Objects;

/**
 * An identifier proven to match its declared charset, length bound, and the shell metacharacter veto.
 *
 * <p>Instances are only created by {@link Identifiers}; once constructed the value can be placed in an
 * argument vector without re-validation.</p>
 *
 * @since 0.1.0
 */
public final class ValidatedIdentifier {
  private final String value;

  ValidatedIdentifier(String value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  /**
   * Returns the validated text.
   *
   * @return identifier value, stripped of surrounding whitespace
   */
  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ValidatedIdentifier that && value.equals(that.value);
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
