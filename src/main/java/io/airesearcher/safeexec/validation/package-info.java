/**
 * <strong>Purpose:</strong> Pure validators that turn untrusted strings into typed safe values.
 * <p><strong>Role:</strong> First layer of the execution boundary; every git, LaTeX and script operation
 * validates its inputs here before building an argument vector.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation without
 * synchronization.
 * <p><strong>Observability:</strong> No logging or metrics; failures surface as
 * {@link io.airesearcher.safeexec.validation.ValidationException}.
 * <p><strong>Security:</strong> The typed values ({@code Validated*}) can only be built by this package.
 * Denied-token tables live in {@link io.airesearcher.safeexec.validation.DeniedTokens} and are defense in
 * depth on top of argument-vector execution.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.validation;
