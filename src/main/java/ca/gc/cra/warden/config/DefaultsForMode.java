package ca.gc.cra.warden.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each WARDEN command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  /** Command that analyzes session logs. */
  public static final String ANALYZE = "analyze";
  /** Command that lists the effective trust catalog. */
  public static final String TRUSTED_DOMAINS = "trusted-domains";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case ANALYZE -> buildAnalyzeDefaults();
      case TRUSTED_DOMAINS -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("logLevel", "");
    map.put("trustedDomains", "");
    map.put("addTrusted", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("externalOnly", "false");
    map.put("textOut", "");
    map.put("jsonOut", "");
    map.put("workers", Integer.toString(AnalyzeConfig.DEFAULT_WORKERS));
    map.put("quiet", "false");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
