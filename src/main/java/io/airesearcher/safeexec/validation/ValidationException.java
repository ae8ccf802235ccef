package io.airesearcher.safeexec.validation;

import io.airesearcher.safeexec.logging.Logs;

/**
 * <strong>What:</strong> Structured rejection raised when an untrusted value fails validation.
 * <p><strong>Why:</strong> Callers need the field, the reason, and a bounded copy of the offending
 * value to report the problem without echoing arbitrarily large model output.</p>
 * <p><strong>Role:</strong> Single failure type of every {@code validate*}/{@code sanitize} operation.
 * Never retried automatically; the caller must correct the input.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;
  static final int MAX_VALUE_BYTES = 64;

  private final String field;
  private final String reason;
  private final String offendingValue;

  /**
   * Creates a rejection for {@code field}.
   *
   * @param field logical name of the validated input; blank names are reported as {@code "value"}
   * @param reason human-readable reason, phrased to follow the field name
   * @param offendingValue rejected input; stored truncated to {@value #MAX_VALUE_BYTES} UTF-8 bytes
   */
  public ValidationException(String field, String reason, String offendingValue) {
    this(field, reason, offendingValue, null);
  }

  /**
   * Creates a rejection for {@code field} that wraps a lower-level cause.
   *
   * @param field logical name of the validated input
   * @param reason human-readable reason
   * @param offendingValue rejected input
   * @param cause underlying parsing or I/O failure; may be {@code null}
   */
  public ValidationException(String field, String reason, String offendingValue, Throwable cause) {
    super(format(label(field), reason, Logs.truncate(offendingValue, MAX_VALUE_BYTES)), cause);
    this.field = label(field);
    this.reason = reason;
    this.offendingValue = Logs.truncate(offendingValue, MAX_VALUE_BYTES);
  }

  /**
   * Returns the logical name of the rejected input.
   *
   * @return field label
   */
  public String field() {
    return field;
  }

  /**
   * Returns the human-readable reason without the field or value decoration.
   *
   * @return rejection reason
   */
  public String reason() {
    return reason;
  }

  /**
   * Returns the rejected value, truncated for safe display.
   *
   * @return truncated offending value, or {@code "<null>"}
   */
  public String offendingValue() {
    return offendingValue;
  }

  private static String label(String field) {
    return field == null || field.isBlank() ? "value" : field;
  }

  private static String format(String field, String reason, String value) {
    return field + " " + reason + " (value: '" + value + "')";
  }
}
