package io.airesearcher.safeexec.validation;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Network value validation: repository URLs and listening ports.
 *
 * @since 0.1.0
 */
public final class Net {

  /** Schemes accepted when the caller does not pass an allow-list. */
  public static final Set<String> DEFAULT_SCHEMES = Set.of("https");

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final int MIN_PORT = 1024;
  private static final int MAX_PORT = 65535;

  private static final Pattern URL_PATTERN = Pattern.compile(
      "\\A([A-Za-z][A-Za-z0-9+.-]*)://([A-Za-z0-9.-]*)(/[A-Za-z0-9._~:/?#\\[\\]@!$&'()*+,;=-]*)?\\z");
  // IPv4 dotted-quad shape (fast pre-check); octets are still range-checked.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a URL using the default allow-list {@link #DEFAULT_SCHEMES}.
   *
   * @param url untrusted URL
   * @return validated URL
   * @throws ValidationException if the URL is malformed, uses another scheme, or references a local host
   */
  public static ValidatedUrl validateUrl(String url) {
    return validateUrl(url, DEFAULT_SCHEMES);
  }

  /**
   * Validates a URL of the form {@code scheme://host[/path]}.
   *
   * <p>The scheme is checked against {@code allowedSchemes} before the host so that
   * {@code file:///etc/passwd} is reported as a disallowed scheme. Hosts must be dotted IPv4 literals
   * or hostnames made of 1-63 character alphanumeric/hyphen labels. Any mention of a
   * {@link DeniedTokens#LOCAL_HOSTS local host} anywhere in the URL is rejected.</p>
   *
   * @param url untrusted URL
   * @param allowedSchemes lower-case schemes to accept; {@code null} means {@link #DEFAULT_SCHEMES}
   * @return validated URL
   * @throws ValidationException if any check fails
   */
  public static ValidatedUrl validateUrl(String url, Set<String> allowedSchemes) {
    Set<String> schemes = allowedSchemes == null ? DEFAULT_SCHEMES : allowedSchemes;
    String name = "URL";
    String sanitized = Strings.requireNonBlank(name, url);
    Matcher matcher = URL_PATTERN.matcher(sanitized);
    if (!matcher.matches()) {
      throw new ValidationException(name, "has an invalid format", sanitized);
    }
    String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
    if (!schemes.contains(scheme)) {
      throw new ValidationException(
          name, "scheme '" + scheme + "' is not allowed (allowed: " + String.join(", ", schemes.stream().sorted().toList()) + ")",
          sanitized);
    }
    String host = matcher.group(2);
    Optional<String> local = DeniedTokens.localHostIn(sanitized);
    if (local.isPresent()) {
      throw new ValidationException(name, "must not reference local host '" + local.get() + "'", sanitized);
    }
    validateHost(name, host, sanitized);
    return new ValidatedUrl(sanitized, scheme, host);
  }

  /**
   * Validates a non-privileged TCP port.
   *
   * @param name logical field name for diagnostics
   * @param port candidate port
   * @return the port
   * @throws ValidationException if the port is outside {@code [1024, 65535]}
   */
  public static int validatePort(String name, int port) {
    return (int) Numbers.requireRange(name == null ? "port" : name, port, MIN_PORT, MAX_PORT);
  }

  private static void validateHost(String name, String host, String url) {
    if (host.isEmpty()) {
      throw new ValidationException(name, "must include a host", url);
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(name, host, url);
      return;
    }
    validateHostname(name, host, url);
  }

  private static void validateHostname(String name, String host, String url) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new ValidationException(name, "host is longer than " + MAX_HOSTNAME_LENGTH + " characters", url);
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(name, host, start, end, url);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new ValidationException(name, "host has an empty trailing label", url);
      }
    }
  }

  private static void validateLabel(String name, String s, int start, int end, String url) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new ValidationException(
          name, "host label length " + labelLen + " must be 1.." + MAX_LABEL_LENGTH, url);
    }
    final char first = s.charAt(start);
    final char last = s.charAt(end - 1);
    if (!Identifiers.isAsciiAlnum(first) || !Identifiers.isAsciiAlnum(last)) {
      throw new ValidationException(name, "host labels must start and end with an alphanumeric", url);
    }
    // Interior characters are alphanumeric or '-' by construction of URL_PATTERN.
  }

  private static void validateIpv4Octets(String name, String host, String url) {
    for (String part : host.split("\\.")) {
      int octet = Integer.parseInt(part);
      if (octet > 255) {
        throw new ValidationException(name, "IPv4 octet " + octet + " must be between 0 and 255", url);
      }
    }
  }
}
