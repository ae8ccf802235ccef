/**
 * <strong>Purpose:</strong> Child-process execution adapters.
 * <p><strong>Role:</strong> Implements {@link io.airesearcher.safeexec.application.port.CommandExecutor}.
 * <p><strong>Concurrency:</strong> Output is drained on a shared pool of daemon threads.
 * <p><strong>Security:</strong> Processes are created from argument vectors only; no shell is involved.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.infrastructure.exec;
