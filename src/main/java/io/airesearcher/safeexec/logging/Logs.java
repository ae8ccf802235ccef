package io.airesearcher.safeexec.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers for the execution boundary.
 * <p><strong>Why:</strong> Keeps oversized process output, secrets from environment overrides, and
 * untrusted argument text from flooding or corrupting operator logs.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by validators, the process executor, and the
 * LaTeX and git operations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 payloads to a safe byte budget while preserving readability.</li>
 *   <li>Provide consistent redaction placeholders for sensitive fields.</li>
 *   <li>Render argument vectors with POSIX single-quote rules for audit lines.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Truncation allocates transient buffers proportional to {@code maxBytes}.</p>
 * <p><strong>Observability:</strong> Indirectly shapes log messages; emits no metrics.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final Pattern SAFE_TOKEN = Pattern.compile("[A-Za-z0-9@%+=:,./_-]+");

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, Math.min(bytes.length, maxBytes), StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Renders environment overrides for logs, keeping the keys and redacting every value.
   *
   * @param environment override map; {@code null} or empty renders as {@code "{}"}
   * @return sorted {@code {KEY=[REDACTED], ...}} rendering
   */
  public static String redactEnvironment(Map<String, String> environment) {
    if (environment == null || environment.isEmpty()) {
      return "{}";
    }
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    for (String key : new TreeSet<>(environment.keySet())) {
      joiner.add(key + "=" + redact(environment.get(key)));
    }
    return joiner.toString();
  }

  /**
   * Renders an argument vector the way a POSIX shell would need it quoted.
   *
   * <p>The output is for audit lines only. It is never parsed or executed; processes are always
   * started from the original list.</p>
   *
   * @param argv argument vector, program first; {@code null} renders as {@code "<null>"}
   * @return space-separated tokens, each single-quoted when it contains anything outside
   *         {@code [A-Za-z0-9@%+=:,./_-]}
   */
  public static String renderCommand(List<String> argv) {
    if (argv == null) {
      return NULL_PLACEHOLDER;
    }
    StringJoiner joiner = new StringJoiner(" ");
    for (String arg : argv) {
      joiner.add(quote(arg));
    }
    return joiner.toString();
  }

  private static String quote(String arg) {
    if (arg == null) {
      return NULL_PLACEHOLDER;
    }
    if (arg.isEmpty()) {
      return "''";
    }
    if (SAFE_TOKEN.matcher(arg).matches()) {
      return arg;
    }
    return "'" + arg.replace("'", "'\"'\"'") + "'";
  }
}
