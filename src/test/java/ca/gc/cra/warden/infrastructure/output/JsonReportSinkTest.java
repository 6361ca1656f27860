package ca.gc.cra.warden.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonReportSinkTest {

  @Test
  @SuppressWarnings("unchecked")
  void writesSummaryAndProfiles(@TempDir Path dir) throws IOException {
    Path target = dir.resolve("report.json");
    new JsonReportSink(target).write(ReportFixtures.mixedReport());

    Map<String, Object> root = parse(Files.readAllBytes(target));

    assertEquals(1, ((Number) root.get("schemaVersion")).intValue());
    assertEquals("2024-06-01T12:00:00Z", root.get("generatedAt"));
    assertEquals(2, ((Number) root.get("totalSessions")).intValue());
    assertEquals(1, ((Number) root.get("sessionsWithExternalActivity")).intValue());
    assertEquals(2, ((Number) root.get("trustedDomainCount")).intValue());
    assertEquals(List.of("*.fabric.microsoft.com", "localhost"), root.get("trustedDomains"));
    assertEquals(Boolean.FALSE, root.get("externalOnly"));

    List<Object> profiles = (List<Object>) root.get("profiles");
    assertEquals(2, profiles.size());
    Map<String, Object> risky = (Map<String, Object>) profiles.get(0);
    assertEquals("s-risky", risky.get("sessionId"));
    assertEquals("Exfil", risky.get("notebookName"));
    assertNull(risky.get("sparkApplicationId"));
    assertEquals(Boolean.TRUE, risky.get("hasExternalActivity"));

    List<Object> connections = (List<Object>) risky.get("connections");
    assertEquals(3, connections.size());
    Map<String, Object> evil = (Map<String, Object>) connections.get(0);
    assertEquals("evil.io", evil.get("host"));
    assertEquals(443, ((Number) evil.get("port")).intValue());
    assertEquals(Boolean.FALSE, evil.get("trusted"));
    assertNull(evil.get("matchedPattern"));
    assertEquals("livy", evil.get("streamKind"));
    Map<String, Object> fabric = (Map<String, Object>) connections.get(1);
    assertNull(fabric.get("port"));
    assertEquals("*.fabric.microsoft.com", fabric.get("matchedPattern"));

    Map<String, Object> install = (Map<String, Object>) ((List<Object>) risky.get("packageInstalls")).get(0);
    assertEquals("pip", install.get("manager"));
    assertEquals(List.of("requests", "pandas"), install.get("packages"));
    Map<String, Object> change = (Map<String, Object>) ((List<Object>) risky.get("loggingChanges")).get(0);
    assertEquals(Boolean.TRUE, change.get("disablesLogging"));
    assertEquals(List.of("stderr stream missing"), risky.get("warnings"));
  }

  @Test
  void leavesCallerStreamOpen() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    JsonReportSink sink = new JsonReportSink(Path.of("unused.json"));

    sink.write(ReportFixtures.cleanReport(), out);
    out.write('#');

    String text = out.toString(StandardCharsets.UTF_8);
    assertTrue(text.endsWith("}\n#"));
    Map<String, Object> root = parse(text.substring(0, text.length() - 1).getBytes(StandardCharsets.UTF_8));
    assertEquals(List.of(), root.get("profiles"));
    assertEquals(Boolean.TRUE, root.get("externalOnly"));
  }

  private static Map<String, Object> parse(byte[] json) throws IOException {
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      assertEquals(JsonToken.START_OBJECT, parser.nextToken());
      return readObject(parser);
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      default -> null;
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String name = parser.currentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
