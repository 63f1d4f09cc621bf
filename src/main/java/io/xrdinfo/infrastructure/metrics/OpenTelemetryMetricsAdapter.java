package io.xrdinfo.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.xrdinfo.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forwards configuration and metadata metrics to OpenTelemetry.
 *
 * <p>Each dotted key becomes one instrument, created on first use. Keys ending in {@code Millis} are recorded with
 * unit {@code ms}. The original key is attached as the {@code xrdinfo.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("xrdinfo.metric.key");

  private final OpenTelemetryBootstrap.Meters meters;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and {@code OTEL_*} environment variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Meters meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::counter).add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::histogram).record(value, Attributes.of(METRIC_KEY, key));
  }

  /** Pushes pending observations to the exporter. */
  public void flush() {
    meters.forceFlush();
  }

  @Override
  public void close() {
    meters.close();
  }

  boolean isNoop() {
    return meters.isNoop();
  }

  private LongCounter counter(String key) {
    Meter meter = meters.meter();
    return meter.counterBuilder(instrumentName(key)).setUnit("1").setDescription("xrdinfo counter " + key).build();
  }

  private LongHistogram histogram(String key) {
    Meter meter = meters.meter();
    return meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("xrdinfo observation " + key)
        .build();
  }

  static String instrumentName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return "xrdinfo.metric";
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }
}
