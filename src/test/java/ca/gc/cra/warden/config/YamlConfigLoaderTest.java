package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("warden.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          workers: 2
        analyze:
          in: ./spark_logs/consolidated_logs.json
          workers: 8
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "analyze");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("./spark_logs/consolidated_logs.json", map.get("in"));
    assertEquals("8", map.get("workers"));
  }

  @Test
  void scalarListsAreJoinedWithCommas() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        analyze:
          addTrusted:
            - corp.example.com
            - "*.internal.example.com"
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("corp.example.com,*.internal.example.com", map.get("addTrusted"));
  }

  @Test
  void nestedStructuresInsideListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("nested-list.yaml");
    Files.writeString(yaml, """
        analyze:
          addTrusted:
            - host: corp.example.com
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "analyze"));
  }

  @Test
  void nestedMapsAreFlattenedWithDots() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        analyze:
          report:
            json: out.json
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("out.json", map.get("report.json"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "analyze").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "analyze").orElseThrow());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - analyze:
            in: x.json
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "analyze"));
  }
}
