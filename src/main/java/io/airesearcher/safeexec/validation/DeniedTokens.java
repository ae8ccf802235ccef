package io.airesearcher.safeexec.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> The explicit tables of denied tokens, one per validated-value kind.
 * <p><strong>Why:</strong> Keeps every blocklist in one reviewable place instead of scattering literals
 * across validators.</p>
 * <p><strong>Role:</strong> Defense in depth only. The guarantees are argument-vector process creation
 * and {@code -no-shell-escape} on every typesetting pass; these tables are not an exhaustive model of
 * shell or TeX syntax and must not be treated as one without a dedicated security review.</p>
 * <p><strong>Thread-safety:</strong> Immutable constants.</p>
 *
 * @since 0.1.0
 */
public final class DeniedTokens {

  /** Shell metacharacters vetoed in identifiers and branch names. */
  public static final String SHELL_METACHARACTERS = ";&|`$(){}[]<>*?'\"\\";

  /** Host references that may not appear in a validated URL. */
  public static final List<String> LOCAL_HOSTS = List.of("localhost", "127.0.0.1");

  /** TeX primitives and commands that reach the filesystem or a subprocess from inside a document. */
  public static final List<DeniedPattern> LATEX_COMMANDS = List.of(
      new DeniedPattern("\\\\write18", "write18 (shell escape)"),
      new DeniedPattern("\\\\input\\{?\\|", "input with pipe"),
      new DeniedPattern("\\\\immediate", "immediate"),
      new DeniedPattern("\\\\openout", "openout (file write)"),
      new DeniedPattern("\\\\openin", "openin (file read)"),
      new DeniedPattern("\\\\special", "special"),
      new DeniedPattern("\\\\pdfliteral", "pdfliteral"));

  private DeniedTokens() {
    // Utility
  }

  /**
   * Lists the distinct shell metacharacters present in {@code value}, in order of first appearance.
   *
   * @param value candidate text; must not be {@code null}
   * @return denied characters found; empty when the value is clean
   */
  public static List<Character> shellMetacharactersIn(String value) {
    List<Character> found = new ArrayList<>();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (SHELL_METACHARACTERS.indexOf(c) >= 0 && !found.contains(c)) {
        found.add(c);
      }
    }
    return found;
  }

  /**
   * Returns the first local-host reference contained in {@code value}, compared case-insensitively.
   *
   * @param value candidate URL; must not be {@code null}
   * @return matching entry of {@link #LOCAL_HOSTS}, if any
   */
  public static Optional<String> localHostIn(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    return LOCAL_HOSTS.stream().filter(lower::contains).findFirst();
  }

  /**
   * Returns the first LaTeX command pattern found in {@code content}.
   *
   * @param content document source; must not be {@code null}
   * @return matching denied pattern, if any
   */
  public static Optional<DeniedPattern> latexCommandIn(String content) {
    return LATEX_COMMANDS.stream().filter(p -> p.pattern().matcher(content).find()).findFirst();
  }

  /**
   * A case-insensitive regular expression paired with the name used in rejection messages.
   *
   * @param pattern compiled expression
   * @param description operator-facing name of the denied construct
   */
  public record DeniedPattern(Pattern pattern, String description) {
    DeniedPattern(String regex, String description) {
      this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description);
    }
  }
}
