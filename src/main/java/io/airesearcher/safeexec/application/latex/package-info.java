/**
 * <strong>Purpose:</strong> Multi-pass LaTeX compilation.
 * <p><strong>Concurrency:</strong> Per-directory serialization through
 * {@link io.airesearcher.safeexec.application.latex.DirectoryLocks}.
 * <p><strong>Security:</strong> Every pass runs with {@code -no-shell-escape}.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.application.latex;
