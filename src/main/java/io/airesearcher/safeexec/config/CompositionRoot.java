package io.airesearcher.safeexec.config;

import io.airesearcher.safeexec.application.git.GitOperations;
import io.airesearcher.safeexec.application.latex.DirectoryLocks;
import io.airesearcher.safeexec.application.latex.LatexCompiler;
import io.airesearcher.safeexec.application.port.CommandExecutor;
import io.airesearcher.safeexec.application.port.MetricsPort;
import io.airesearcher.safeexec.application.script.ScriptRunner;
import io.airesearcher.safeexec.infrastructure.exec.ProcessCommandExecutor;
import io.airesearcher.safeexec.infrastructure.metrics.NoOpMetricsAdapter;
import io.airesearcher.safeexec.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Composition root that wires the SafeExec operations to concrete adapters.
 * <p><strong>Why:</strong> Gives every operation its configuration and collaborators explicitly, so no
 * component reaches for global state.</p>
 * <p><strong>Role:</strong> Adapter composition root used by the CLI and by embedding applications.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from {@link ExecConfig#metricsExporter()}.</li>
 *   <li>Share one {@link CommandExecutor} and one {@link DirectoryLocks} across all operations it builds.</li>
 *   <li>Close the metrics pipeline on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods may be called from any thread; the returned operations
 * are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final ExecConfig config;
  private final MetricsPort metrics;
  private final CommandExecutor executor;
  private final DirectoryLocks directoryLocks = new DirectoryLocks();

  /**
   * Creates a root using the real process executor.
   *
   * @param config effective configuration
   */
  public CompositionRoot(ExecConfig config) {
    this(config, null);
  }

  /**
   * Creates a root whose operations run through {@code executor}; {@code null} selects the real process
   * executor.
   *
   * @param config effective configuration
   * @param executor executor override, mainly for tests
   */
  public CompositionRoot(ExecConfig config, CommandExecutor executor) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = createMetrics(config.metricsExporter(), OpenTelemetryMetricsAdapter::new);
    this.executor = executor != null ? executor : new ProcessCommandExecutor(metrics);
  }

  /** @return the configuration this root was built from */
  public ExecConfig config() {
    return config;
  }

  /** @return the shared metrics port */
  public MetricsPort metrics() {
    return metrics;
  }

  /** @return the shared command executor */
  public CommandExecutor commandExecutor() {
    return executor;
  }

  /** @return git operations using the configured binary and timeouts */
  public GitOperations gitOperations() {
    return new GitOperations(executor, config.gitSettings());
  }

  /** @return a LaTeX compiler sharing this root's directory locks */
  public LatexCompiler latexCompiler() {
    return new LatexCompiler(executor, directoryLocks, config.latexSettings());
  }

  /** @return a script runner using the configured interpreter */
  public ScriptRunner scriptRunner() {
    return new ScriptRunner(executor, config.scriptSettings());
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        throw new IllegalStateException("Failed to close metrics adapter", ex);
      }
    }
  }

  static MetricsPort createMetrics(String exporter, Supplier<? extends MetricsPort> otel) {
    if ("otlp".equalsIgnoreCase(exporter)) {
      return otel.get();
    }
    return new NoOpMetricsAdapter();
  }
}
