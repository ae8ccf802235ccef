/**
 * Application layer: git, LaTeX and script operations over validated inputs.
 * <p><strong>Role:</strong> Hosts the operations and the ports they use to start processes and record metrics.</p>
 * <p><strong>Concurrency:</strong> Operations block the calling thread until the child process exits or is killed.</p>
 * <p><strong>Metrics:</strong> Process metrics use the {@code exec.command.*} namespace.</p>
 * <p><strong>Security:</strong> Every external value passes through {@code io.airesearcher.safeexec.validation}
 * before it reaches an argument vector.</p>
 */
package io.airesearcher.safeexec.application;
