package ca.gc.cra.warden.api;

import ca.gc.cra.warden.config.ConfigMerger;
import ca.gc.cra.warden.config.DefaultsForMode;
import ca.gc.cra.warden.config.TrustCatalogLoader;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import ca.gc.cra.warden.domain.trust.TrustPattern;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.validation.Paths;
import ca.gc.cra.warden.validation.Strings;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the effective trust catalog: bundled or file-supplied patterns plus {@code addTrusted} entries.
 *
 * @since 0.1.0
 */
public final class TrustedDomainsCli {
  private static final Logger log = LoggerFactory.getLogger(TrustedDomainsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: trusted-domains [trustedDomains=FILE] [addTrusted=a,b] [config=FILE]";
  private static final String HELP_TEXT = """
      WARDEN trusted-domains

      Usage:
        trusted-domains [options]

      Optional:
        trustedDomains=PATH   YAML trust catalog replacing the bundled defaults
        addTrusted=a,*.b      Extra trusted hosts or *.suffix wildcards
        config=PATH           YAML file with common/trusted-domains sections
        --verbose             Enable DEBUG logging
        --help                Show this message
      """;

  private TrustedDomainsCli() {}

  /**
   * Lists the effective catalog.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    List<String> unknown = input.unknownFlags(Set.of());
    if (!unknown.isEmpty()) {
      log.error("Unknown option(s): {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Path> file;
    List<String> additional;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Optional<Map<String, String>> yaml =
          ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), DefaultsForMode.TRUSTED_DOMAINS);
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          DefaultsForMode.TRUSTED_DOMAINS,
          yaml,
          kv,
          DefaultsForMode.asFlatMap(DefaultsForMode.TRUSTED_DOMAINS),
          log::warn);
      if (!input.verbose()) {
        LoggingConfigurator.applyLevel(effective.get("logLevel"));
      }
      file = catalogFile(effective.get("trustedDomains"));
      additional = Strings.splitList(effective.get("addTrusted"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid trusted-domains arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      TrustCatalog catalog = TrustCatalogLoader.load(file, additional);
      CliPrinter.printLines(describe(catalog, file));
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid trust catalog: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read trust catalog", ex);
      return ExitCode.IO_ERROR;
    }
  }

  static List<String> describe(TrustCatalog catalog, Optional<Path> file) {
    List<String> lines = new ArrayList<>(catalog.size() + 2);
    lines.add("Trusted patterns (" + catalog.size() + ") from "
        + file.map(Path::toString).orElse("bundled catalog") + ":");
    for (TrustPattern pattern : catalog.patterns()) {
      String kind = pattern.kind() == TrustPattern.Kind.WILDCARD_SUFFIX ? "wildcard" : "exact";
      lines.add(String.format("  %-50s %s", pattern.pattern(), kind));
    }
    return lines;
  }

  private static Optional<Path> catalogFile(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Paths.requireReadableFile("trustedDomains", Path.of(raw.trim())));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("trustedDomains is not a valid path: " + raw, ex);
    }
  }
}
