package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void appliesAndRemovesTelemetryKeys() {
    Map<String, String> config = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector.internal.example:4317",
        "otelResourceAttributes", "env=prod",
        "in", "index.json"));

    assertEquals("otlp", TelemetryConfigurator.configureMetrics(config));

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector.internal.example:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("env=prod", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("in", "index.json"), config);
  }

  @Test
  void rejectsEndpointWithInvalidHost() {
    String longLabel = "a".repeat(64);
    Map<String, String> config = new HashMap<>(Map.of(
        "otelEndpoint", "http://" + longLabel + ".example:4317"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(config));
    assertFalse(System.getProperties().containsKey("otel.exporter.otlp.endpoint"));
  }

  @Test
  void rejectsUnknownExporterAndNonHttpEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector:21"))));
  }
}
