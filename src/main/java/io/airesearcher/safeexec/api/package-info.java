/**
 * <strong>Purpose:</strong> Command-line entry points for clone, checkout, compile and script.
 * <p><strong>Role:</strong> Adapter layer that turns {@code key=value} arguments, flags and YAML files into
 * an {@link io.airesearcher.safeexec.config.ExecConfig}, invokes one operation and maps the outcome to an
 * {@link io.airesearcher.safeexec.api.ExitCode}.
 * <p><strong>Concurrency:</strong> Each invocation runs on the calling thread.
 * <p><strong>Security:</strong> Paths given on the command line are confined to {@code workspaceRoot}.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.api;
