/**
 * Interpreter script execution.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.application.script;
