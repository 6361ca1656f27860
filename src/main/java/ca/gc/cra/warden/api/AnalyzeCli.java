package ca.gc.cra.warden.api;

import ca.gc.cra.warden.application.pipeline.SecurityAnalysisUseCase;
import ca.gc.cra.warden.config.AnalyzeConfig;
import ca.gc.cra.warden.config.CompositionRoot;
import ca.gc.cra.warden.config.ConfigMerger;
import ca.gc.cra.warden.config.DefaultsForMode;
import ca.gc.cra.warden.config.TrustCatalogLoader;
import ca.gc.cra.warden.domain.report.Report;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.validation.Paths;
import java.io.IOException;
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
 * Entry point for analyzing downloaded Spark session logs.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--external-only", "externalOnly",
      "--quiet", "quiet");
  private static final Set<String> ACCEPTED_FLAGS =
      Set.of("--external-only", "--quiet", "--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: analyze in=INDEX.json [trustedDomains=FILE] [addTrusted=a,b] [--external-only] "
          + "[textOut=FILE] [jsonOut=FILE] [workers=N] [config=FILE] [--allow-overwrite] [--dry-run] [--quiet] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      WARDEN analyze

      Usage:
        analyze in=./spark_logs/consolidated_logs.json [options]

      Required:
        in=PATH                    Consolidated log index written by the log downloader

      Optional (validated):
        trustedDomains=PATH        YAML trust catalog replacing the bundled defaults
        addTrusted=a,*.b           Extra trusted hosts or *.suffix wildcards
        --external-only            List only sessions with external activity
        textOut=PATH               Write the text report to a file
        jsonOut=PATH               Write the JSON report to a file
        workers=N                  Analysis threads (1-256, default max(2, cpus/2))
        config=PATH                YAML file with common/analyze sections
        logLevel=LEVEL             TRACE, DEBUG, INFO, WARN, ERROR or OFF
        --quiet                    Do not print the report to stdout
        --dry-run                  Validate inputs and print the plan without analyzing
        --allow-overwrite          Replace existing report files
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private AnalyzeCli() {}

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
   * Executes the analyze command using structured logging and exit codes.
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
      log.debug("Verbose logging enabled for analyze CLI");
    }
    List<String> unknown = input.unknownFlags(ACCEPTED_FLAGS);
    if (!unknown.isEmpty()) {
      log.error("Unknown option(s): {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    input.applyFlags(kv, FLAG_KEYS);

    Map<String, String> effective;
    try {
      Optional<Map<String, String>> yaml =
          ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), DefaultsForMode.ANALYZE);
      effective = ConfigMerger.buildEffectiveConfig(
          DefaultsForMode.ANALYZE, yaml, kv, DefaultsForMode.asFlatMap(DefaultsForMode.ANALYZE), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    AnalyzeConfig config;
    String metricsExporter;
    try {
      if (!input.verbose()) {
        LoggingConfigurator.applyLevel(configInputs.get("logLevel"));
      }
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = AnalyzeConfig.fromMap(configInputs);
      validatePaths(config, allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    TrustCatalog catalog;
    try {
      catalog = TrustCatalogLoader.load(config.trustedDomainsFile(), config.additionalTrustedDomains());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid trust catalog: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read trust catalog", ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config, catalog, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      SecurityAnalysisUseCase useCase = root.analysisUseCase();
      log.info(
          "Configured analysis: input={}, trustedPatterns={}, workers={}, externalOnly={}, metricsExporter={}",
          config.input(),
          catalog.size(),
          config.workers(),
          config.externalOnly(),
          metricsExporter);
      Report report = useCase.run(
          root.logBundleSource(), catalog, config.externalOnly(), root.reportSinks(CliPrinter::println));
      config.textOutput().ifPresent(path -> log.info("Text report written to {}", path));
      config.jsonOutput().ifPresent(path -> log.info("JSON report written to {}", path));
      if (report.sessionsWithExternalActivity() > 0) {
        log.warn("{} session(s) need security review", report.sessionsWithExternalActivity());
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Analysis configuration error: {}", ex.getMessage(), ex);
      return ExitCode.forFailure(ex);
    } catch (IOException ex) {
      log.error("Analysis I/O failure while processing {}", config.input(), ex);
      return ExitCode.forFailure(ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted; shutting down", ex);
      return ExitCode.forFailure(ex);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during analysis", ex);
      return ExitCode.forFailure(ex);
    }
  }

  private static void validatePaths(AnalyzeConfig config, boolean allowOverwrite, boolean createParents) {
    Paths.requireReadableFile("in", config.input());
    config.trustedDomainsFile().ifPresent(path -> Paths.requireReadableFile("trustedDomains", path));
    config.textOutput().ifPresent(path -> Paths.validateWritableFile("textOut", path, createParents, allowOverwrite));
    config.jsonOutput().ifPresent(path -> Paths.validateWritableFile("jsonOut", path, createParents, allowOverwrite));
  }

  private static void printDryRunPlan(AnalyzeConfig config, TrustCatalog catalog, boolean allowOverwrite) {
    List<String> lines = new ArrayList<>();
    lines.add("Analyze dry-run: no sessions will be analyzed.");
    lines.add(" Input index       : " + config.input());
    lines.add(" Trust catalog     : "
        + config.trustedDomainsFile().map(Path::toString).orElse("<bundled>")
        + " (" + catalog.size() + " patterns)");
    lines.add(" Listing           : " + (config.externalOnly() ? "external activity only" : "all sessions"));
    lines.add(" Text report       : " + config.textOutput().map(Path::toString).orElse("<none>"));
    lines.add(" JSON report       : " + config.jsonOutput().map(Path::toString).orElse("<none>"));
    lines.add(" Console report    : " + (config.quiet() ? "suppressed" : "stdout"));
    lines.add(" Workers           : " + config.workers());
    lines.add(" Allow overwrite   : " + allowOverwrite);
    lines.add(" Re-run without --dry-run to analyze.");
    CliPrinter.printLines(lines);
  }
}
