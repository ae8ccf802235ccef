package io.airesearcher.safeexec.validation;

import java.util.Optional;

/**
 * LaTeX source screening: the document-language analogue of the shell metacharacter veto.
 *
 * <p>Argument-vector execution cannot stop a document from asking the typesetting engine to run
 * commands or touch files, so generated sections are screened against
 * {@link DeniedTokens#LATEX_COMMANDS} before they are written into a paper. Every compilation pass also
 * disables shell-escape, which remains the actual guarantee.</p>
 *
 * @since 0.1.0
 */
public final class LatexSource {
  private LatexSource() {
    // Utility
  }

  /**
   * Returns {@code content} unchanged when it contains none of the denied commands.
   *
   * @param content LaTeX source; must not be {@code null}
   * @return the same content
   * @throws ValidationException naming the first denied construct found
   */
  public static String sanitize(String content) {
    if (content == null) {
      throw new ValidationException("LaTeX content", "must not be null", null);
    }
    Optional<DeniedTokens.DeniedPattern> denied = DeniedTokens.latexCommandIn(content);
    if (denied.isPresent()) {
      String match = firstMatch(denied.get(), content);
      throw new ValidationException(
          "LaTeX content",
          "contains a dangerous command: " + denied.get().description()
              + "; it could execute arbitrary code or access files",
          match);
    }
    return content;
  }

  private static String firstMatch(DeniedTokens.DeniedPattern denied, String content) {
    var matcher = denied.pattern().matcher(content);
    return matcher.find() ? matcher.group() : "";
  }
}
