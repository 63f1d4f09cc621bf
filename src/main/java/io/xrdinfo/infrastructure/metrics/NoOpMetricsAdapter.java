package io.xrdinfo.infrastructure.metrics;

import io.xrdinfo.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 *
 * <p>Selected when metrics are switched off on the command line.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
