package ca.gc.cra.warden.api;

import ca.gc.cra.warden.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} from the CLI map.
   *
   * @param args mutable CLI map
   * @return the configured path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads the YAML section for {@code mode} from an explicitly named file.
   *
   * @param configPath path given on the command line, or {@code null}
   * @param mode command name
   * @return flattened YAML settings, empty when no file was named
   * @throws IllegalArgumentException when the named file does not exist or is malformed
   * @throws IOException when the file cannot be read
   */
  static Optional<Map<String, String>> loadYaml(String configPath, String mode) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath, mode);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
