package ca.gc.cra.warden.config;

import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.validation.Numbers;
import ca.gc.cra.warden.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Captures configuration for the {@code analyze} command that reviews Spark session logs.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML and defaults so analysis runs stay reproducible.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the consolidated log index and the optional trust catalog file.</li>
 *   <li>Select report destinations and the listing mode.</li>
 *   <li>Bound the analysis worker pool.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> Normalizes paths during construction; accessors are constant-time.</p>
 * <p><strong>Observability:</strong> Values are echoed by the dry-run plan and the startup log line.</p>
 *
 * @param input consolidated log index (JSON) produced by the downloader
 * @param trustedDomainsFile optional YAML file replacing the bundled trust catalog
 * @param additionalTrustedDomains extra trust patterns appended to the catalog
 * @param externalOnly whether the report lists only sessions with external activity
 * @param textOutput optional plain-text report file
 * @param jsonOutput optional JSON report file
 * @param workers analysis pool size
 * @param quiet suppresses the console report
 * @since 0.1.0
 * @see ca.gc.cra.warden.application.pipeline.SecurityAnalysisUseCase
 */
public record AnalyzeConfig(
    Path input,
    Optional<Path> trustedDomainsFile,
    List<String> additionalTrustedDomains,
    boolean externalOnly,
    Optional<Path> textOutput,
    Optional<Path> jsonOutput,
    int workers,
    boolean quiet) {

  /** Default analysis pool size derived from available processors. */
  public static final int DEFAULT_WORKERS = ExecutorFactories.defaultWorkers();
  /** Upper bound accepted for {@code workers}. */
  public static final int MAX_WORKERS = 256;

  /**
   * Normalizes values and enforces invariants.
   *
   * @throws IllegalArgumentException when the input is missing or workers fall outside {@code 1..256}
   */
  public AnalyzeConfig {
    if (input == null) {
      throw new IllegalArgumentException("in is required (path to the consolidated log index)");
    }
    input = input.toAbsolutePath().normalize();
    trustedDomainsFile = Objects.requireNonNullElse(trustedDomainsFile, Optional.<Path>empty())
        .map(p -> p.toAbsolutePath().normalize());
    additionalTrustedDomains = List.copyOf(Objects.requireNonNullElse(additionalTrustedDomains, List.of()));
    textOutput = Objects.requireNonNullElse(textOutput, Optional.<Path>empty())
        .map(p -> p.toAbsolutePath().normalize());
    jsonOutput = Objects.requireNonNullElse(jsonOutput, Optional.<Path>empty())
        .map(p -> p.toAbsolutePath().normalize());
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
  }

  /**
   * Creates a configuration instance from CLI-style key/value pairs.
   *
   * @param options key/value pairs such as {@code in}, {@code trustedDomains}, {@code jsonOut}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or {@code in} is missing
   *
   * <p><strong>Concurrency:</strong> Call from a single thread.</p>
   * <p><strong>Observability:</strong> Validation messages name the offending key.</p>
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String inRaw = optionalString(options.get("in"))
        .orElseThrow(() -> new IllegalArgumentException("in is required (path to the consolidated log index)"));
    Path input = parsePath("in", inRaw);
    Optional<Path> trusted = optionalString(options.get("trustedDomains")).map(v -> parsePath("trustedDomains", v));
    List<String> extra = Strings.splitList(options.get("addTrusted"));
    boolean externalOnly = parseBoolean(options.get("externalOnly"), false);
    Optional<Path> textOut = optionalString(options.get("textOut")).map(v -> parsePath("textOut", v));
    Optional<Path> jsonOut = optionalString(options.get("jsonOut")).map(v -> parsePath("jsonOut", v));
    int workers = optionalString(options.get("workers"))
        .map(v -> Numbers.parseIntInRange("workers", v, 1, MAX_WORKERS))
        .orElse(DEFAULT_WORKERS);
    boolean quiet = parseBoolean(options.get("quiet"), false);
    return new AnalyzeConfig(input, trusted, extra, externalOnly, textOut, jsonOut, workers, quiet);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false but was '" + trimmed + "'");
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String name, String raw) {
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }
}
