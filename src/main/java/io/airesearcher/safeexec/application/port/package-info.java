/**
 * <strong>Purpose:</strong> Ports between the application operations and their infrastructure adapters.
 * <p><strong>Role:</strong> Process execution and metrics seams.
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.application.port;
