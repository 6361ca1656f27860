package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.aggregate.SessionAggregator;
import ca.gc.cra.warden.application.classify.EndpointClassifier;
import ca.gc.cra.warden.application.parse.LogParser;
import ca.gc.cra.warden.application.pipeline.SecurityAnalysisUseCase;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.LogBundleSource;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.ReportSink;
import ca.gc.cra.warden.application.report.ReportBuilder;
import ca.gc.cra.warden.infrastructure.bundle.ConsolidatedLogIndexReader;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.infrastructure.output.ConsoleReportSink;
import ca.gc.cra.warden.infrastructure.output.JsonReportSink;
import ca.gc.cra.warden.infrastructure.output.TextFileReportSink;
import ca.gc.cra.warden.infrastructure.output.TextReportRenderer;
import ca.gc.cra.warden.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Central composition root that wires the WARDEN analysis use case to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link AnalyzeConfig} to a runnable pipeline in one place.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning index reading, analysis and report sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Construct the parser, classifier, aggregator and report builder graph.</li>
 *   <li>Create the bundle source for the configured index.</li>
 *   <li>Create report sinks in a fixed order: console, text file, JSON file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 * @see SecurityAnalysisUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private final AnalyzeConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   *
   * @param config analyze configuration; must not be {@code null}
   */
  public CompositionRoot(AnalyzeConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @param config analyze configuration; must not be {@code null}
   * @param metricsPort metrics adapter used by the use case
   * @param clock clock stamping {@code generatedAt}
   */
  public CompositionRoot(AnalyzeConfig config, MetricsPort metricsPort, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the analysis use case.
   *
   * @return use case sized by {@link AnalyzeConfig#workers()}
   */
  public SecurityAnalysisUseCase analysisUseCase() {
    SessionAggregator aggregator = new SessionAggregator(new LogParser(), new EndpointClassifier());
    return new SecurityAnalysisUseCase(aggregator, new ReportBuilder(clock), metrics, config.workers());
  }

  /**
   * Creates the bundle source reading the configured consolidated index.
   *
   * @return bundle source
   */
  public LogBundleSource logBundleSource() {
    return new ConsolidatedLogIndexReader(config.input());
  }

  /**
   * Creates the configured report sinks.
   *
   * @param console line printer for the console report; ignored when {@link AnalyzeConfig#quiet()} is set
   * @return sinks in write order
   */
  public List<ReportSink> reportSinks(Consumer<String> console) {
    TextReportRenderer renderer = new TextReportRenderer();
    List<ReportSink> sinks = new ArrayList<>(3);
    if (!config.quiet()) {
      sinks.add(new ConsoleReportSink(renderer, Objects.requireNonNull(console, "console")));
    }
    config.textOutput().ifPresent(path -> sinks.add(new TextFileReportSink(renderer, path)));
    config.jsonOutput().ifPresent(path -> sinks.add(new JsonReportSink(path)));
    return List.copyOf(sinks);
  }

  /**
   * Returns the metrics adapter shared by constructed use cases.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Flushes and shuts down the OpenTelemetry adapter when one is in use. */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter adapter) {
      adapter.close();
    }
  }
}
