/**
 * <strong>Purpose:</strong> Value types and failures of mediated process execution.
 * <p><strong>Role:</strong> Shared vocabulary between the application operations, the
 * {@link io.airesearcher.safeexec.application.port.CommandExecutor} port and its adapters.
 * <p><strong>Concurrency:</strong> All types are immutable.
 * <p><strong>Security:</strong> {@link io.airesearcher.safeexec.domain.exec.CommandSpec} models a command only
 * as an argument vector.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.domain.exec;
