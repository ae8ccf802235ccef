package io.airesearcher.safeexec.domain.latex;

import io.airesearcher.safeexec.domain.exec.CommandException;
import java.nio.file.Path;
import java.util.List;

/**
 * Every typesetting pass exited successfully but the expected document was not written.
 *
 * @since 0.1.0
 */
public final class PdfNotProducedException extends CommandException {
  private static final long serialVersionUID = 1L;

  private final String expected;

  /**
   * Creates the failure.
   *
   * @param expected path the document should have been written to
   * @param lastPass argument vector of the final pass
   * @param projectDirectory working directory of the passes
   */
  public PdfNotProducedException(Path expected, List<String> lastPass, Path projectDirectory) {
    super("Compilation finished but no output was produced: " + expected, lastPass, projectDirectory, null);
    this.expected = expected.toString();
  }

  /** @return the missing artifact path */
  public Path expected() {
    return Path.of(expected);
  }
}
