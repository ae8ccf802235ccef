package io.airesearcher.safeexec.application.latex;

import io.airesearcher.safeexec.application.port.CommandExecutor;
import io.airesearcher.safeexec.domain.exec.CommandException;
import io.airesearcher.safeexec.domain.exec.CommandFailedException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.domain.latex.CompilationState;
import io.airesearcher.safeexec.domain.latex.PdfNotProducedException;
import io.airesearcher.safeexec.logging.Logs;
import io.airesearcher.safeexec.validation.LatexSource;
import io.airesearcher.safeexec.validation.Numbers;
import io.airesearcher.safeexec.validation.Strings;
import io.airesearcher.safeexec.validation.ValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Multi-pass LaTeX compilation with an optional bibliography step.
 * <p><strong>Why:</strong> Cross-references and citations need several passes; each pass runs with shell
 * escape disabled so the document cannot start processes.</p>
 * <p><strong>Role:</strong> Application operation over the {@link CommandExecutor} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Check the file name, project directory and source before any process starts.</li>
 *   <li>Run the passes in order, stopping at the first failure.</li>
 *   <li>Run the bibliography tool once after the first pass when {@code *.bib} files exist.</li>
 *   <li>Verify the output document exists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Compilations of one directory are serialized through the shared
 * {@link DirectoryLocks}; different directories compile concurrently.</p>
 * <p><strong>Observability:</strong> Logs each pass at INFO and failing pass output, truncated, at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class LatexCompiler {
  private static final Logger log = LoggerFactory.getLogger(LatexCompiler.class);
  private static final String TEX_EXTENSION = ".tex";
  private static final int LOGGED_OUTPUT_BYTES = 2_000;

  private final CommandExecutor executor;
  private final DirectoryLocks locks;
  private final LatexSettings settings;

  /**
   * Creates a compiler.
   *
   * @param executor process executor
   * @param locks directory locks shared by every compiler that may touch the same directories
   * @param settings binaries, pass count and timeouts
   */
  public LatexCompiler(CommandExecutor executor, DirectoryLocks locks, LatexSettings settings) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Compiles with the configured number of passes.
   *
   * @see #compile(String, Path, int)
   */
  public Path compile(String texFile, Path projectDir)
      throws CommandException, InterruptedException, IOException {
    return compile(texFile, projectDir, settings.runs());
  }

  /**
   * Compiles {@code texFile} inside {@code projectDir}.
   *
   * @param texFile bare file name ending in {@code .tex}
   * @param projectDir existing directory containing the file; the working directory of every pass
   * @param runs number of typesetting passes; at least 1
   * @return path of the produced document
   * @throws ValidationException if a precondition fails or the source contains a denied command; nothing
   *         was spawned
   * @throws CommandFailedException if a pass exits non-zero; carries the pass output
   * @throws PdfNotProducedException if all passes succeeded but no document exists
   * @throws CommandException if a pass times out or cannot start
   * @throws IOException if the source or directory cannot be read
   * @throws InterruptedException if interrupted while waiting for the lock or a pass
   */
  public Path compile(String texFile, Path projectDir, int runs)
      throws CommandException, InterruptedException, IOException {
    String fileName = validateFileName(texFile);
    Numbers.requireRange("runs", runs, 1, LatexSettings.MAX_RUNS);
    if (projectDir == null || !Files.isDirectory(projectDir)) {
      throw new ValidationException("project directory", "does not exist", String.valueOf(projectDir));
    }
    Path source = projectDir.resolve(fileName);
    if (!Files.isRegularFile(source)) {
      throw new ValidationException("tex file", "does not exist in " + projectDir, fileName);
    }
    if (settings.sanitizeSource()) {
      LatexSource.sanitize(new String(Files.readAllBytes(source), StandardCharsets.UTF_8));
    }

    String baseName = fileName.substring(0, fileName.length() - TEX_EXTENSION.length());
    try (DirectoryLocks.Lease lease = locks.acquire(projectDir)) {
      log.debug("Acquired compilation lock for {}", lease.directory());
      return runPasses(fileName, baseName, projectDir, runs);
    }
  }

  private Path runPasses(String fileName, String baseName, Path projectDir, int runs)
      throws CommandException, InterruptedException, IOException {
    CompilationState state = CompilationState.start(runs);
    CommandSpec pass = passCommand(fileName, projectDir);
    while (state.hasMorePasses()) {
      int number = state.pass() + 1;
      log.info("LaTeX pass {}/{} for {} in {}", number, runs, fileName, projectDir);
      ExecutionResult result = executor.execute(pass);
      if (!result.success()) {
        state = state.failed();
        log.error("LaTeX pass {}/{} failed with exit code {}; output:\n{}",
            number, runs, result.exitCode(), Logs.truncate(result.stdout(), LOGGED_OUTPUT_BYTES));
        throw new CommandFailedException(
            "LaTeX compilation failed on pass " + number + " of " + runs, pass, result);
      }
      state = state.passCompleted();
      if (state.needsBibliographyCheck() && hasBibliography(projectDir)) {
        runBibliography(baseName, projectDir);
        state = state.bibliographyCompleted();
      }
    }

    Path output = projectDir.resolve(baseName + "." + settings.outputExtension());
    if (!Files.isRegularFile(output)) {
      state = state.failed();
      log.error("LaTeX finished {} passes in phase {} but {} was not produced", state.pass(), state.phase(), output);
      throw new PdfNotProducedException(output, pass.argv(), projectDir);
    }
    state = state.done(output);
    log.info("Compiled {} in {} passes (bibliography: {})", output, state.pass(), state.bibliographyRan());
    return output;
  }

  private CommandSpec passCommand(String fileName, Path projectDir) {
    return CommandSpec.builder(settings.binary(),
            "-interaction=nonstopmode",
            "-no-shell-escape",
            "-halt-on-error",
            fileName)
        .workingDirectory(projectDir)
        .timeout(settings.passTimeout())
        .checkExitCode(false)
        .build();
  }

  private void runBibliography(String baseName, Path projectDir) throws InterruptedException {
    CommandSpec bibtex = CommandSpec.builder(settings.bibtexBinary(), baseName)
        .workingDirectory(projectDir)
        .timeout(settings.bibtexTimeout())
        .checkExitCode(false)
        .build();
    log.info("Running bibliography step for {}", baseName);
    try {
      ExecutionResult result = executor.execute(bibtex);
      if (!result.success()) {
        log.warn("Bibliography step exited with {}; continuing: {}",
            result.exitCode(), Logs.truncate(result.stdout(), LOGGED_OUTPUT_BYTES));
      }
    } catch (CommandException ex) {
      log.warn("Bibliography step failed; continuing without it: {}", ex.getMessage());
    }
  }

  private static boolean hasBibliography(Path projectDir) throws IOException {
    try (DirectoryStream<Path> bibs = Files.newDirectoryStream(projectDir, "*.bib")) {
      return bibs.iterator().hasNext();
    }
  }

  private static String validateFileName(String texFile) {
    String name = "tex file";
    String value = Strings.requireNonBlank(name, texFile);
    if (!value.endsWith(TEX_EXTENSION)) {
      throw new ValidationException(name, "must end with " + TEX_EXTENSION, value);
    }
    if (value.indexOf('/') >= 0 || value.indexOf('\\') >= 0) {
      throw new ValidationException(name, "must be a file name only, not a path", value);
    }
    if (value.length() == TEX_EXTENSION.length()) {
      throw new ValidationException(name, "must have a base name", value);
    }
    return value;
  }
}
