package io.xrdinfo.api;

import io.xrdinfo.application.port.MetricsPort;
import io.xrdinfo.infrastructure.metrics.NoOpMetricsAdapter;
import io.xrdinfo.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.xrdinfo.validation.Strings;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the metrics adapter for one command run.
 *
 * <p>Metrics are off unless {@code metricsExporter=otlp} is given. The OTLP endpoint and resource attributes are
 * handed to the OpenTelemetry bootstrap through system properties.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static MetricsPort configureMetrics(Map<String, String> options) {
    String exporter = options.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + exporter + "')");
    }
    if (exporter.equals("none")) {
      return new NoOpMetricsAdapter();
    }
    String endpoint = options.get("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      System.setProperty("otel.exporter.otlp.endpoint", Strings.requireHttpUrl("otelEndpoint", endpoint).toString());
    }
    String attributes = options.get("otelResourceAttributes");
    if (attributes != null && !attributes.isBlank()) {
      System.setProperty("otel.resource.attributes",
          Strings.requirePrintableAscii("otelResourceAttributes", attributes.trim(), MAX_RESOURCE_ATTRIBUTES_LENGTH));
    }
    System.setProperty("otel.metrics.exporter", "otlp");
    log.debug("OTLP metrics export enabled");
    return new OpenTelemetryMetricsAdapter();
  }

  static void close(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.flush();
      otel.close();
    }
  }
}
