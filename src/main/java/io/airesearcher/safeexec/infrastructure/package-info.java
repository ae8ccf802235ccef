/**
 * Infrastructure adapters: OS process execution and OpenTelemetry metrics.
 */
package io.airesearcher.safeexec.infrastructure;
