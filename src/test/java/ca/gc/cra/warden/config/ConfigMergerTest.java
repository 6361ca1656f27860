package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("analyze");
    Map<String, String> yaml = Map.of("in", "yaml.json", "workers", "3", "externalOnly", "true");
    Map<String, String> cli = Map.of("in", "cli.json");
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective =
        ConfigMerger.buildEffectiveConfig("analyze", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("cli.json", effective.get("in"));
    assertEquals("3", effective.get("workers"));
    assertEquals("true", effective.get("externalOnly"));
    assertEquals("none", effective.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: in"), warnings);
  }

  @Test
  void noWarningWhenCliKeyIsAbsentFromYaml() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.empty(), Map.of("in", "a.json"), DefaultsForMode.asFlatMap("analyze"), warnings::add);

    assertTrue(warnings.isEmpty());
  }

  @Test
  void sameFileForBothReportsIsRejected() {
    Map<String, String> cli = Map.of("in", "a.json", "textOut", "report.out", "jsonOut", "report.out");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.empty(), cli, DefaultsForMode.asFlatMap("analyze"), null));
  }

  @Test
  void reportMayNotOverwriteInput() {
    Map<String, String> cli = Map.of("in", "logs.json", "jsonOut", "logs.json");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.empty(), cli, DefaultsForMode.asFlatMap("analyze"), null));
  }

  @Test
  void unknownModeDefaultsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }

  @Test
  void trustedDomainsModeCarriesCommonKeysOnly() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("trusted-domains");

    assertTrue(defaults.containsKey("trustedDomains"));
    assertTrue(defaults.containsKey("addTrusted"));
    assertTrue(!defaults.containsKey("in"));
  }
}
