package ca.gc.cra.warden.api;

import ca.gc.cra.warden.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WARDEN CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: warden <analyze|trusted-domains> [options]";
  private static final String HELP_TEXT = """
      WARDEN: security review of Spark session logs

      Usage:
        warden <command> [options]

      Commands:
        analyze          Analyze downloaded session logs (analyze --help for details)
        trusted-domains  Print the effective trust catalog

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the subcommand
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safe.length; i++) {
      if (safe[i] != null && !safe[i].isBlank() && !safe[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput leading = CliInput.parse(Arrays.copyOfRange(safe, 0, commandIndex));
    if (leading.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safe, commandIndex + 1, safe.length);
    if (leading.help()) {
      delegateArgs = append(delegateArgs, "--help");
    }

    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "trusted-domains" -> TrustedDomainsCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
