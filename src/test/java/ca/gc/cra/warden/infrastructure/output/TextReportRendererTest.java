package ca.gc.cra.warden.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.report.Report;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextReportRendererTest {

  private final TextReportRenderer renderer = new TextReportRenderer();

  @Test
  void rendersExternalSessionsAndSections() {
    List<String> lines = renderer.render(ReportFixtures.mixedReport());

    assertEquals("WARDEN session security report", lines.get(0));
    assertTrue(lines.contains("Sessions analyzed                : 2"));
    assertTrue(lines.contains("Trusted domain patterns (2)"));
    assertTrue(lines.contains("  *.fabric.microsoft.com"));
    assertTrue(lines.contains("Listing                          : all sessions"));
    assertTrue(lines.contains("SECURITY REVIEW NEEDED: 1 session(s) with external connections"));
    assertTrue(lines.contains("Notebook: Exfil (nb-1)"));
    assertTrue(lines.contains("  Livy session        : s-risky"));
    assertTrue(lines.contains("  Workspace           : Finance"));
    assertTrue(lines.contains("  External connections: 2, trusted connections: 1"));
    assertTrue(lines.contains("  Monitor             : https://app/monitor"));
    int first = lines.indexOf("    - 10.0.0.5:8080");
    int second = lines.indexOf("    - evil.io:443");
    assertTrue(first > 0 && second == first + 1, "endpoints sorted");
    assertFalse(lines.contains("    - api.fabric.microsoft.com"));
    assertFalse(lines.contains("  Livy session        : s-clean"));
    assertTrue(lines.contains("  [s-risky] pip: requests, pandas (stdout:2)"));
    assertTrue(lines.contains("  [s-risky] logging.disable (DISABLES LOGGING) (stdout:4)"));
    assertTrue(lines.contains("  [s-risky] stderr stream missing"));
  }

  @Test
  void cleanReportOmitsEmptySections() {
    List<String> lines = renderer.render(ReportFixtures.cleanReport());

    assertTrue(lines.contains("No external network activity detected."));
    assertTrue(lines.contains("Listing                          : sessions with external activity only"));
    assertFalse(lines.contains("PACKAGE INSTALLS"));
    assertFalse(lines.contains("LOGGING CHANGES"));
    assertFalse(lines.contains("WARNINGS"));
  }

  @Test
  void sinksShareTheRenderedText(@TempDir Path dir) throws IOException {
    Report report = ReportFixtures.mixedReport();
    List<String> printed = new ArrayList<>();
    Path file = dir.resolve("report.txt");

    new ConsoleReportSink(renderer, printed::add).write(report);
    new TextFileReportSink(renderer, file).write(report);

    assertEquals(renderer.render(report), printed);
    assertEquals(printed, Files.readAllLines(file, StandardCharsets.UTF_8));
  }
}
