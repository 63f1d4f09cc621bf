/**
 * Metrics adapters bridging {@link io.xrdinfo.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code globalconf.*} and {@code metadata.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counters and latencies are exported; no configuration content or response
 * bodies.</p>
 */
package io.xrdinfo.infrastructure.metrics;
