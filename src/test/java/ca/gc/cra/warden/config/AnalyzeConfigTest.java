package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalyzeConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(Map.of("in", "logs/consolidated_logs.json"));

    assertEquals(Path.of("logs/consolidated_logs.json").toAbsolutePath().normalize(), config.input());
    assertTrue(config.trustedDomainsFile().isEmpty());
    assertEquals(List.of(), config.additionalTrustedDomains());
    assertFalse(config.externalOnly());
    assertTrue(config.textOutput().isEmpty());
    assertTrue(config.jsonOutput().isEmpty());
    assertEquals(AnalyzeConfig.DEFAULT_WORKERS, config.workers());
    assertFalse(config.quiet());
  }

  @Test
  void fromMapParsesAllKeys() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(Map.of(
        "in", "in.json",
        "trustedDomains", "trust.yaml",
        "addTrusted", "corp.example.com, *.lab.example.com",
        "externalOnly", "TRUE",
        "textOut", "out/report.txt",
        "jsonOut", "out/report.json",
        "workers", "4",
        "quiet", "true"));

    assertEquals(Path.of("trust.yaml").toAbsolutePath().normalize(), config.trustedDomainsFile().orElseThrow());
    assertEquals(List.of("corp.example.com", "*.lab.example.com"), config.additionalTrustedDomains());
    assertTrue(config.externalOnly());
    assertEquals(Path.of("out/report.txt").toAbsolutePath().normalize(), config.textOutput().orElseThrow());
    assertEquals(Path.of("out/report.json").toAbsolutePath().normalize(), config.jsonOutput().orElseThrow());
    assertEquals(4, config.workers());
    assertTrue(config.quiet());
  }

  @Test
  void missingInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(Map.of("in", " ")));
  }

  @Test
  void workersOutsideRangeAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("in", "a.json", "workers", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("in", "a.json", "workers", "257")));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("in", "a.json", "workers", "many")));
  }

  @Test
  void malformedBooleanIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("in", "a.json", "externalOnly", "yes")));
  }
}
