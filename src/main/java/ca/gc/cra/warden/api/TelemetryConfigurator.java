package ca.gc.cra.warden.api;

import ca.gc.cra.warden.validation.Net;
import ca.gc.cra.warden.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry settings out of the effective configuration and into the {@code otel.*} system
 * properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param config mutable effective configuration
   * @return normalized exporter name ({@code otlp} or {@code none})
   * @throws IllegalArgumentException when a value is invalid
   */
  static String configureMetrics(Map<String, String> config) {
    String exporter = trimmed(config.remove("metricsExporter"));
    String normalized = exporter.isEmpty() ? "none" : exporter.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", normalized);
    log.debug("Configured OpenTelemetry metrics exporter: {}", normalized);

    String endpoint = trimmed(config.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("Configured OTLP endpoint: {}", endpoint);
    }

    String attributes = trimmed(config.remove("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
      log.debug("Configured OpenTelemetry resource attributes override");
    }
    return normalized;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    Net.requireHost("otelEndpoint host", uri.getHost());
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
