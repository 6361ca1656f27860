package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsOverview() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("trusted-domains"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: warden"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void leadingHelpIsForwardedToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "analyze"}));
    assertTrue(buffer.toString().contains("WARDEN analyze"));
  }

  @Test
  void dispatchesTrustedDomains() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"TRUSTED-DOMAINS"}));
    assertTrue(buffer.toString().startsWith("Trusted patterns ("));
  }
}
