package io.airesearcher.safeexec.application.latex;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for {@link LatexCompiler}.
 *
 * @param binary typesetting engine executable
 * @param bibtexBinary bibliography tool executable
 * @param runs default number of typesetting passes
 * @param passTimeout bound for each typesetting pass
 * @param bibtexTimeout bound for the bibliography step
 * @param outputExtension extension of the produced document, without the dot
 * @param sanitizeSource whether the document source is checked for denied commands before the first pass
 * @since 0.1.0
 */
public record LatexSettings(
    String binary,
    String bibtexBinary,
    int runs,
    Duration passTimeout,
    Duration bibtexTimeout,
    String outputExtension,
    boolean sanitizeSource) {

  /** Upper bound on passes accepted from configuration or callers. */
  public static final int MAX_RUNS = 10;

  public LatexSettings {
    binary = requireText("latex binary", binary, "pdflatex");
    bibtexBinary = requireText("bibtex binary", bibtexBinary, "bibtex");
    outputExtension = requireText("output extension", outputExtension, "pdf");
    if (outputExtension.startsWith(".")) {
      outputExtension = outputExtension.substring(1);
    }
    if (runs < 1 || runs > MAX_RUNS) {
      throw new IllegalArgumentException("runs must be between 1 and " + MAX_RUNS + " (was " + runs + ")");
    }
    passTimeout = Objects.requireNonNullElse(passTimeout, Duration.ofSeconds(120));
    bibtexTimeout = Objects.requireNonNullElse(bibtexTimeout, Duration.ofSeconds(30));
  }

  /** Returns pdflatex/bibtex with three passes, 120s per pass, 30s for bibtex and source checking on. */
  public static LatexSettings defaults() {
    return new LatexSettings(
        "pdflatex", "bibtex", 3, Duration.ofSeconds(120), Duration.ofSeconds(30), "pdf", true);
  }

  private static String requireText(String name, String value, String fallback) {
    String effective = Objects.requireNonNullElse(value, fallback).trim();
    if (effective.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return effective;
  }
}
