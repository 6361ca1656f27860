package ca.gc.cra.warden.application.pipeline;

import ca.gc.cra.warden.application.aggregate.SessionAggregator;
import ca.gc.cra.warden.application.port.LogBundleSource;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.ReportSink;
import ca.gc.cra.warden.application.report.ReportBuilder;
import ca.gc.cra.warden.domain.log.LogBundle;
import ca.gc.cra.warden.domain.report.ClassifiedConnection;
import ca.gc.cra.warden.domain.report.Report;
import ca.gc.cra.warden.domain.report.SessionSecurityProfile;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs the security analysis over a set of session bundles and produces the report.
 * <p><strong>Why:</strong> Sessions are independent, so they are analyzed on a bounded worker pool and
 * joined before one deterministic sort.</p>
 * <p><strong>Role:</strong> Application-layer use case; the single synchronous entry point of the core.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fan sessions out to a fixed-size pool and wait for all of them.</li>
 *   <li>Turn a failed session into a warning-only profile without affecting the others.</li>
 *   <li>Build the report and hand it to the configured sinks.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent runs; each run owns its pool.</p>
 * <p><strong>Performance:</strong> Parallelism bounded by {@code workers}; memory bounded by bundle text.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code session} on workers; emits {@code analysis.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class SecurityAnalysisUseCase {
  private static final Logger log = LoggerFactory.getLogger(SecurityAnalysisUseCase.class);
  private static final String MDC_SESSION = "session";

  private final SessionAggregator aggregator;
  private final ReportBuilder reportBuilder;
  private final MetricsPort metrics;
  private final int workers;

  /**
   * Creates the use case.
   *
   * @param aggregator per-session analysis
   * @param reportBuilder report assembly
   * @param metrics metrics sink
   * @param workers analysis pool size; must be positive
   */
  public SecurityAnalysisUseCase(
      SessionAggregator aggregator, ReportBuilder reportBuilder, MetricsPort metrics, int workers) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.reportBuilder = Objects.requireNonNull(reportBuilder, "reportBuilder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Loads bundles from the source, analyzes them and writes the report to every sink in order.
   *
   * @param source bundle source
   * @param catalog trust catalog for this run
   * @param externalOnly whether the report lists only sessions with external activity
   * @param sinks report destinations
   * @return the report that was written
   * @throws IOException when the source cannot be read or a sink fails
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public Report run(LogBundleSource source, TrustCatalog catalog, boolean externalOnly, List<ReportSink> sinks)
      throws IOException, InterruptedException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sinks, "sinks");
    List<LogBundle> bundles = source.load();
    log.info("Loaded {} session bundle(s)", bundles.size());
    Report report = runPipeline(bundles, catalog, externalOnly);
    for (ReportSink sink : sinks) {
      sink.write(report);
    }
    log.info(
        "Security analysis complete: sessions={}, external={}, listed={}",
        report.totalSessions(),
        report.sessionsWithExternalActivity(),
        report.profiles().size());
    return report;
  }

  /**
   * Analyzes the bundles and builds the report.
   *
   * @param bundles session bundles in any order
   * @param catalog trust catalog for this run
   * @param externalOnly whether the report lists only sessions with external activity
   * @return report ordered independently of worker completion order
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public Report runPipeline(List<LogBundle> bundles, TrustCatalog catalog, boolean externalOnly)
      throws InterruptedException {
    Objects.requireNonNull(bundles, "bundles");
    Objects.requireNonNull(catalog, "catalog");
    if (bundles.isEmpty()) {
      return reportBuilder.build(List.of(), catalog, externalOnly);
    }

    List<Callable<SessionSecurityProfile>> tasks = new ArrayList<>(bundles.size());
    for (LogBundle bundle : bundles) {
      tasks.add(() -> analyzeSession(bundle, catalog));
    }

    int poolSize = Math.min(workers, bundles.size());
    ExecutorService executor = ExecutorFactories.newAnalysisPool(
        poolSize,
        "warden-analysis",
        (thread, ex) -> log.error("Uncaught failure on analysis worker {}", thread.getName(), ex));
    List<SessionSecurityProfile> profiles = new ArrayList<>(bundles.size());
    try {
      List<Future<SessionSecurityProfile>> futures = executor.invokeAll(tasks);
      for (int i = 0; i < futures.size(); i++) {
        profiles.add(collect(futures.get(i), bundles.get(i)));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Security analysis interrupted; requesting worker shutdown");
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }
    return reportBuilder.build(profiles, catalog, externalOnly);
  }

  private SessionSecurityProfile analyzeSession(LogBundle bundle, TrustCatalog catalog) {
    String previousSession = MDC.get(MDC_SESSION);
    MDC.put(MDC_SESSION, bundle.sessionId());
    long start = System.nanoTime();
    try {
      SessionSecurityProfile profile = aggregator.analyze(bundle, catalog);
      recordMetrics(profile);
      log.debug(
          "Session analyzed: connections={}, installs={}, loggingChanges={}, parseWarnings={}",
          profile.connections().size(),
          profile.packageInstalls().size(),
          profile.loggingChanges().size(),
          profile.parseWarnings());
      return profile;
    } finally {
      metrics.observe("analysis.session.latencyNanos", System.nanoTime() - start);
      if (previousSession == null) {
        MDC.remove(MDC_SESSION);
      } else {
        MDC.put(MDC_SESSION, previousSession);
      }
    }
  }

  private SessionSecurityProfile collect(Future<SessionSecurityProfile> future, LogBundle bundle)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.error("Analysis of session {} failed", bundle.sessionId(), cause);
      metrics.increment("analysis.sessions.failed");
      return SessionSecurityProfile.failed(bundle.metadata(), "session analysis failed: " + cause);
    }
  }

  private void recordMetrics(SessionSecurityProfile profile) {
    metrics.increment("analysis.sessions.analyzed");
    if (profile.hasExternalActivity()) {
      metrics.increment("analysis.sessions.external");
    }
    for (ClassifiedConnection connection : profile.connections()) {
      metrics.increment(connection.trusted() ? "analysis.connections.trusted" : "analysis.connections.external");
    }
    metrics.observe("analysis.session.parseWarnings", profile.parseWarnings());
  }
}
