/**
 * Compilation state and failures of the multi-pass LaTeX workflow.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.domain.latex;
