/**
 * Domain value types for process execution and LaTeX compilation.
 */
package io.airesearcher.safeexec.domain;
