package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AnalyzeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(AnalyzeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  private Path writeIndex() throws IOException {
    Path logs = Files.createDirectories(tempDir.resolve("logs/s1"));
    Files.writeString(logs.resolve("livy.log"), "Connecting to evil.io:443\n", StandardCharsets.UTF_8);
    Files.writeString(logs.resolve("driver_stdout.log"), "pip install requests\n", StandardCharsets.UTF_8);
    Files.writeString(logs.resolve("driver_stderr.log"), "", StandardCharsets.UTF_8);
    Path index = tempDir.resolve("logs/consolidated_logs.json");
    Files.writeString(index, """
        {"log_summaries": [{"livy_id": "s1", "notebook_name": "Exfil", "state": "success",
          "downloaded_files": ["s1/livy.log", "s1/driver_stdout.log", "s1/driver_stderr.log"]}]}
        """, StandardCharsets.UTF_8);
    return index;
  }

  @Test
  void missingInputReturnsInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {"workers=2"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: analyze"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid analyze arguments"));
    assertTrue(logged);
  }

  @Test
  void unknownFlagReturnsInvalidArgs() throws IOException {
    ExitCode code = AnalyzeCli.run(new String[] {"in=" + writeIndex(), "--bogus"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: analyze"));
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutputs() throws IOException {
    Path index = writeIndex();
    Path json = tempDir.resolve("reports/report.json");

    ExitCode code = AnalyzeCli.run(new String[] {"in=" + index, "jsonOut=" + json, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Analyze dry-run"));
    assertTrue(output.contains("<bundled>"));
    assertFalse(Files.exists(json.getParent()), "dry-run should not create report directory");
  }

  @Test
  void analyzesIndexAndWritesReports() throws IOException {
    Path index = writeIndex();
    Path text = tempDir.resolve("out/report.txt");
    Path json = tempDir.resolve("out/report.json");

    ExitCode code = AnalyzeCli.run(new String[] {
        "in=" + index, "textOut=" + text, "jsonOut=" + json, "workers=2", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String console = buffer.toString();
    assertTrue(console.contains("SECURITY REVIEW NEEDED: 1 session(s) with external connections"));
    assertTrue(console.contains("    - evil.io:443"));
    assertTrue(console.contains("  [s1] pip: requests (stdout:1)"));
    assertEquals(console.strip(), Files.readString(text, StandardCharsets.UTF_8).strip());
    String report = Files.readString(json, StandardCharsets.UTF_8);
    assertTrue(report.contains("\"evil.io\""));
    assertTrue(report.contains("\"s1\""));
  }

  @Test
  void quietSuppressesConsoleReport() throws IOException {
    Path json = tempDir.resolve("report.json");

    ExitCode code = AnalyzeCli.run(new String[] {"in=" + writeIndex(), "jsonOut=" + json, "--quiet"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("", buffer.toString());
    assertTrue(Files.exists(json));
  }

  @Test
  void existingOutputRequiresAllowOverwrite() throws IOException {
    Path index = writeIndex();
    Path json = Files.writeString(tempDir.resolve("report.json"), "old");

    assertEquals(ExitCode.INVALID_ARGS,
        AnalyzeCli.run(new String[] {"in=" + index, "jsonOut=" + json, "--quiet"}));
    assertEquals("old", Files.readString(json));

    assertEquals(ExitCode.SUCCESS,
        AnalyzeCli.run(new String[] {"in=" + index, "jsonOut=" + json, "--quiet", "--allow-overwrite"}));
    assertTrue(Files.readString(json).contains("\"schemaVersion\""));
  }

  @Test
  void invalidTrustCatalogReturnsConfigError() throws IOException {
    Path catalog = Files.writeString(tempDir.resolve("trust.yaml"), "trustedDomains: []\n");

    ExitCode code = AnalyzeCli.run(new String[] {"in=" + writeIndex(), "trustedDomains=" + catalog, "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, AnalyzeCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("WARDEN analyze"));
  }
}
