package io.xrdinfo.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the OpenTelemetry meter used by the command line tools.
 *
 * <p>Settings come from system properties first, then the standard {@code OTEL_*} environment variables. The
 * exporter is OTLP over gRPC unless {@code none} is requested. A short export interval is used because the tools are
 * short-lived and flush on exit.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.xrdinfo";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {}

  static Meters initialize() {
    return initialize(System.getProperties(), System.getenv());
  }

  static Meters initialize(Properties properties, Map<String, String> environment) {
    try {
      Settings settings = Settings.from(properties, environment);
      if (!settings.enabled()) {
        log.debug("OpenTelemetry metrics exporter disabled");
        return Meters.noop();
      }
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      log.debug("OpenTelemetry metrics exported to {}", settings.endpoint());
      return Meters.of(reader, settings.resourceAttributes());
    } catch (RuntimeException ex) {
      log.warn("OpenTelemetry metrics unavailable, continuing without export: {}", ex.getMessage());
      return Meters.noop();
    }
  }

  static Meters forTesting(MetricReader reader) {
    return Meters.of(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/io.xrdinfo/xrdinfo/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Cannot read pom.properties for the service version", ex);
    }
    return "0.0.0-dev";
  }

  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String token : raw.split(",")) {
      int idx = token.indexOf('=');
      String key = idx < 0 ? "" : token.substring(0, idx).trim();
      String value = idx < 0 ? "" : token.substring(idx + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!token.isBlank()) {
          log.warn("Ignoring malformed OTEL_RESOURCE_ATTRIBUTES entry: {}", token.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  record Settings(boolean enabled, String endpoint, Attributes resourceAttributes) {
    static Settings from(Properties properties, Map<String, String> environment) {
      String exporter = firstNonBlank(
          properties.getProperty("otel.metrics.exporter"), environment.get("OTEL_METRICS_EXPORTER"), "otlp");
      boolean enabled = !"none".equals(exporter.toLowerCase(Locale.ROOT));
      String endpoint = firstNonBlank(
          properties.getProperty("otel.exporter.otlp.endpoint"),
          environment.get("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      Attributes attributes = parseResourceAttributes(firstNonBlank(
          properties.getProperty("otel.resource.attributes"), environment.get("OTEL_RESOURCE_ATTRIBUTES")));
      return new Settings(enabled, endpoint, attributes);
    }
  }

  /** Meter plus the provider that owns it; closing flushes pending exports. */
  static final class Meters implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Meters(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Meters noop() {
      return new Meters(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static Meters of(MetricReader reader, Attributes extra) {
      String version = serviceVersion();
      Resource resource = Resource.getDefault()
          .merge(Resource.create(Attributes.of(SERVICE_NAME, "xrdinfo", SERVICE_VERSION, version)))
          .merge(Resource.create(extra));
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(resource)
          .registerMetricReader(reader)
          .build();
      Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
      return new Meters(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within 5s");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
