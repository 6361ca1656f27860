package ca.gc.cra.warden.infrastructure.metrics;

import ca.gc.cra.warden.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} adapter publishing WARDEN counters and histograms through
 * OpenTelemetry.
 * <p><strong>Role:</strong> Driven adapter on the observability plane, created by the CLI composition root.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; safe for analysis workers.</p>
 * <p><strong>Observability:</strong> Each instrument carries the original key as {@code warden.metric.key};
 * histogram keys ending in {@code Nanos} are published with unit {@code ns}.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("warden.metric.key");
  private static final String FALLBACK_NAME = "warden.metric";

  private final OpenTelemetryBootstrap.Handle handle;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from {@code otel.*} system properties or {@code OTEL_*} variables.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::newCounter).add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::newHistogram).record(value, Attributes.of(METRIC_KEY, key));
  }

  /**
   * Whether observations leave the process.
   *
   * @return {@code false} when running with the no-op meter
   */
  public boolean exporting() {
    return handle.exporting();
  }

  void flush() {
    handle.flush();
  }

  /**
   * Flushes pending observations and shuts the meter provider down.
   */
  @Override
  public void close() {
    handle.flush();
    handle.close();
  }

  private LongCounter newCounter(String key) {
    return meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("WARDEN counter " + key)
        .build();
  }

  private LongHistogram newHistogram(String key) {
    return meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("WARDEN observation " + key)
        .build();
  }

  /**
   * Maps a dotted key to a legal instrument name: lower-case, starts with a letter,
   * characters outside {@code [a-z0-9._-]} replaced by {@code _}.
   *
   * @param key metric key
   * @return instrument name
   */
  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean legal = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
      name.append(legal ? c : '_');
    }
    return name.toString();
  }
}
