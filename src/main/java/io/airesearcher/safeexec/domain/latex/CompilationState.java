package io.airesearcher.safeexec.domain.latex;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable snapshot of one compilation's progress.
 * <p><strong>Why:</strong> Makes the pass/bibliography ordering explicit; each transition returns a new
 * instance and rejects moves the sequence does not allow.</p>
 * <p><strong>Role:</strong> Local state of a single {@code LatexCompiler.compile} call; never shared.</p>
 *
 * @param phase current phase
 * @param pass number of completed typesetting passes
 * @param maxPasses configured number of passes
 * @param bibliographyRan whether the bibliography step has been attempted
 * @param artifact produced document, present only in {@link CompilationPhase#DONE}
 * @since 0.1.0
 */
public record CompilationState(
    CompilationPhase phase, int pass, int maxPasses, boolean bibliographyRan, Optional<Path> artifact) {

  public CompilationState {
    Objects.requireNonNull(phase, "phase");
    artifact = Objects.requireNonNullElse(artifact, Optional.empty());
    if (maxPasses < 1) {
      throw new IllegalArgumentException("maxPasses must be at least 1");
    }
    if (pass < 0 || pass > maxPasses) {
      throw new IllegalArgumentException("pass must be between 0 and " + maxPasses + " (was " + pass + ")");
    }
  }

  /**
   * Creates the initial state.
   *
   * @param maxPasses number of typesetting passes to run; at least 1
   * @return state in {@link CompilationPhase#INIT}
   */
  public static CompilationState start(int maxPasses) {
    return new CompilationState(CompilationPhase.INIT, 0, maxPasses, false, Optional.empty());
  }

  /** Records a successful typesetting pass. */
  public CompilationState passCompleted() {
    requireActive();
    if (pass >= maxPasses) {
      throw new IllegalStateException("all " + maxPasses + " passes already completed");
    }
    return new CompilationState(CompilationPhase.PASS, pass + 1, maxPasses, bibliographyRan, Optional.empty());
  }

  /** Records that the bibliography step ran; allowed only right after the first pass. */
  public CompilationState bibliographyCompleted() {
    if (!needsBibliographyCheck()) {
      throw new IllegalStateException("bibliography may only run once, after the first pass");
    }
    return new CompilationState(CompilationPhase.BIBLIOGRAPHY, pass, maxPasses, true, Optional.empty());
  }

  /** Marks the compilation as failed. */
  public CompilationState failed() {
    return new CompilationState(CompilationPhase.FAILED, pass, maxPasses, bibliographyRan, Optional.empty());
  }

  /**
   * Marks the compilation as finished.
   *
   * @param output produced document
   * @return state in {@link CompilationPhase#DONE}
   */
  public CompilationState done(Path output) {
    requireActive();
    if (pass != maxPasses) {
      throw new IllegalStateException("cannot finish after " + pass + " of " + maxPasses + " passes");
    }
    return new CompilationState(
        CompilationPhase.DONE, pass, maxPasses, bibliographyRan, Optional.of(Objects.requireNonNull(output)));
  }

  /** Returns {@code true} when another typesetting pass is due. */
  public boolean hasMorePasses() {
    return pass < maxPasses && (phase == CompilationPhase.INIT
        || phase == CompilationPhase.PASS
        || phase == CompilationPhase.BIBLIOGRAPHY);
  }

  /** Returns {@code true} exactly once: after the first pass, before the bibliography step. */
  public boolean needsBibliographyCheck() {
    return phase == CompilationPhase.PASS && pass == 1 && !bibliographyRan;
  }

  private void requireActive() {
    if (phase == CompilationPhase.DONE || phase == CompilationPhase.FAILED) {
      throw new IllegalStateException("compilation already finished in phase " + phase);
    }
  }
}
