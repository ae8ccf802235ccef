package io.airesearcher.safeexec.domain.latex;

/**
 * Phases of a multi-pass LaTeX compilation.
 *
 * @since 0.1.0
 */
public enum CompilationPhase {
  /** Preconditions checked, no process started yet. */
  INIT,
  /** A typesetting pass has completed successfully. */
  PASS,
  /** The bibliography tool has run after the first pass. */
  BIBLIOGRAPHY,
  /** All passes succeeded and the output artifact exists. */
  DONE,
  /** A pass failed or the artifact is missing. */
  FAILED
}
