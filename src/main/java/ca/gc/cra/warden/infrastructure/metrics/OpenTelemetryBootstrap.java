package ca.gc.cra.warden.infrastructure.metrics;

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
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the OpenTelemetry meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from system properties (set by the CLI) and fall back to the standard
 * {@code OTEL_*} environment variables. Any failure degrades to a no-op meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.warden";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static Handle initialize() {
    try {
      Settings settings = Settings.fromEnvironment();
      if (!settings.exportEnabled()) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return Handle.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      Handle handle = Handle.active(reader, resource(settings.resourceAttributes()));
      log.info("OpenTelemetry metrics exporting via OTLP to {}", settings.endpoint());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return Handle.noop();
    }
  }

  static Handle forTesting(MetricReader reader) {
    return Handle.active(Objects.requireNonNull(reader, "reader"), resource(Attributes.empty()));
  }

  private static Resource resource(Attributes extra) {
    Attributes service = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "warden")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), serviceVersion())
        .build();
    return Resource.getDefault().merge(Resource.create(service)).merge(Resource.create(extra));
  }

  static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  /** Parses {@code k=v,k2=v2}; malformed entries are skipped with a warning. */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String entry : raw.split(",")) {
      String trimmed = entry.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed resource attribute: {}", trimmed);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private record Settings(boolean exportEnabled, String endpoint, Attributes resourceAttributes) {
    static Settings fromEnvironment() {
      String exporter = firstNonBlank(
          System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "otlp");
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
        normalized = "otlp";
      }
      String endpoint = firstNonBlank(
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
      return new Settings(normalized.equals("otlp"), endpoint, parseResourceAttributes(attributes));
    }

    private static String firstNonBlank(String first, String second, String fallback) {
      if (first != null && !first.isBlank()) {
        return first.trim();
      }
      if (second != null && !second.isBlank()) {
        return second.trim();
      }
      return fallback;
    }
  }

  /** Meter plus the provider that must be flushed and closed with it. */
  static final class Handle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Handle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Handle noop() {
      return new Handle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static Handle active(MetricReader reader, Resource resource) {
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(resource)
          .registerMetricReader(reader)
          .build();
      Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
          .setInstrumentationVersion(serviceVersion())
          .build();
      return new Handle(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean exporting() {
      return provider != null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {}s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
