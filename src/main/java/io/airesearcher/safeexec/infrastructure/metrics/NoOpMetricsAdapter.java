package io.airesearcher.safeexec.infrastructure.metrics;

import io.airesearcher.safeexec.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Thread-safe and stateless; wired when the exporter is {@code none}.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  /**
   * Discards the increment request.
   *
   * @param key metric identifier; ignored
   */
  @Override
  public void increment(String key) {}

  /**
   * Discards the observation.
   *
   * @param key metric identifier; ignored
   * @param value observed value; ignored
   */
  @Override
  public void observe(String key, long value) {}
}
