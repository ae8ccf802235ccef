/**
 * Git clone and checkout over validated inputs.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.application.git;
