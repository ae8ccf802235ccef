/**
 * <strong>Purpose:</strong> Configuration loading, merging and dependency wiring.
 * <p><strong>Role:</strong> Turns defaults, YAML files and CLI overrides into an
 * {@link io.airesearcher.safeexec.config.ExecConfig} and builds operations from it.
 * <p><strong>Concurrency:</strong> Loading runs once on the CLI thread; configuration values are immutable.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.config;
