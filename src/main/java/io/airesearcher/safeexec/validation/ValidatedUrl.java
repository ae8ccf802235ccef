package io.airesearcher.safeexec.validation;

import java.util.Objects;

/**
 * A URL whose scheme passed an allow-list and whose host is neither malformed nor local.
 *
 * <p>Created only by {@link Net#validateUrl(String, java.util.Set)}.</p>
 *
 * @since 0.1.0
 */
public final class ValidatedUrl {
  private final String value;
  private final String scheme;
  private final String host;

  ValidatedUrl(String value, String scheme, String host) {
    this.value = Objects.requireNonNull(value, "value");
    this.scheme = Objects.requireNonNull(scheme, "scheme");
    this.host = Objects.requireNonNull(host, "host");
  }

  /** @return full URL text as supplied, stripped of surrounding whitespace */
  public String value() {
    return value;
  }

  /** @return lower-cased scheme */
  public String scheme() {
    return scheme;
  }

  /** @return host component */
  public String host() {
    return host;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ValidatedUrl that && value.equals(that.value);
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
