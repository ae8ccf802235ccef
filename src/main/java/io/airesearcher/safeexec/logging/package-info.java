/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize payloads before emission.
 * <p><strong>Role:</strong> Cross-cutting support for validators, the process executor and the git, LaTeX
 * and script operations.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Redacts environment override values and quotes argument vectors so audit
 * lines cannot be mistaken for, or spliced into, shell input.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.logging;
