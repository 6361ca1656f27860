package ca.gc.cra.warden.application.aggregate;

import ca.gc.cra.warden.application.classify.EndpointClassifier;
import ca.gc.cra.warden.application.parse.LogParser;
import ca.gc.cra.warden.domain.events.ConnectionReference;
import ca.gc.cra.warden.domain.events.LogEvent;
import ca.gc.cra.warden.domain.events.LoggingConfigChange;
import ca.gc.cra.warden.domain.events.PackageInstallCommand;
import ca.gc.cra.warden.domain.events.Unrecognized;
import ca.gc.cra.warden.domain.log.LogBundle;
import ca.gc.cra.warden.domain.log.RawLogFile;
import ca.gc.cra.warden.domain.log.SessionMetadata;
import ca.gc.cra.warden.domain.log.StreamKind;
import ca.gc.cra.warden.domain.report.SessionSecurityProfile;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Merges a session's Livy, stdout and stderr events into one
 * {@link SessionSecurityProfile}.
 * <p><strong>Why:</strong> A single session spreads its evidence over three streams; the report needs
 * one deduplicated view per session.</p>
 * <p><strong>Role:</strong> Application service executed by an analysis worker per session.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk streams in canonical order (livy, stdout, stderr), preserving in-stream order.</li>
 *   <li>Classify and deduplicate connections.</li>
 *   <li>Isolate stream failures: a failing stream adds a warning and keeps what was gathered.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe to share.</p>
 * <p><strong>Observability:</strong> Logs structural warnings at WARN with the session id.</p>
 *
 * @since 0.1.0
 */
public final class SessionAggregator {
  private static final Logger log = LoggerFactory.getLogger(SessionAggregator.class);

  private final LogParser parser;
  private final EndpointClassifier classifier;

  /**
   * Creates an aggregator.
   *
   * @param parser parser applied to each stream
   * @param classifier classifier applied to each connection
   */
  public SessionAggregator(LogParser parser, EndpointClassifier classifier) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  /**
   * Parses every stream of the bundle and aggregates the result.
   *
   * @param bundle session bundle
   * @param catalog trust catalog for this run
   * @return session profile, possibly carrying warnings
   */
  public SessionSecurityProfile analyze(LogBundle bundle, TrustCatalog catalog) {
    Objects.requireNonNull(bundle, "bundle");
    List<String> warnings = new ArrayList<>(bundle.retrievalWarnings());
    Map<StreamKind, Iterable<LogEvent>> events = new EnumMap<>(StreamKind.class);
    for (StreamKind kind : StreamKind.values()) {
      RawLogFile file = bundle.streams().get(kind);
      if (file == null) {
        continue;
      }
      if (!file.sessionId().equals(bundle.sessionId())) {
        warnings.add(kind.label() + " stream belongs to session " + file.sessionId() + "; ignored");
        continue;
      }
      events.put(kind, parser.parse(file));
    }
    return aggregate(bundle.metadata(), events, catalog, warnings);
  }

  /**
   * Aggregates already-parsed events.
   *
   * @param metadata session metadata
   * @param eventsByStream event sequences per stream; missing kinds are reported as warnings
   * @param catalog trust catalog for this run
   * @param initialWarnings warnings collected before aggregation (retrieval problems)
   * @return immutable session profile
   */
  public SessionSecurityProfile aggregate(
      SessionMetadata metadata,
      Map<StreamKind, ? extends Iterable<LogEvent>> eventsByStream,
      TrustCatalog catalog,
      List<String> initialWarnings) {
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(catalog, "catalog");
    Map<StreamKind, ? extends Iterable<LogEvent>> streams =
        eventsByStream == null ? Map.of() : eventsByStream;
    List<String> warnings = new ArrayList<>(initialWarnings == null ? List.of() : initialWarnings);
    ConnectionDeduplicator connections = new ConnectionDeduplicator();
    List<PackageInstallCommand> installs = new ArrayList<>();
    List<LoggingConfigChange> loggingChanges = new ArrayList<>();
    int unrecognized = 0;

    for (StreamKind kind : StreamKind.values()) {
      Iterable<LogEvent> events = streams.get(kind);
      if (events == null) {
        warnings.add(kind.label() + " stream missing");
        continue;
      }
      try {
        for (LogEvent event : events) {
          if (event instanceof ConnectionReference reference) {
            connections.add(classifier.classify(reference, catalog));
          } else if (event instanceof PackageInstallCommand install) {
            installs.add(install);
          } else if (event instanceof LoggingConfigChange change) {
            loggingChanges.add(change);
          } else if (event instanceof Unrecognized) {
            unrecognized++;
          }
        }
      } catch (RuntimeException ex) {
        warnings.add(kind.label() + " stream analysis failed: " + ex.getMessage());
        log.warn("Session {} {} stream failed; keeping partial results", metadata.sessionId(), kind.label(), ex);
      }
    }

    if (!warnings.isEmpty()) {
      log.warn("Session {} analyzed with {} warning(s): {}", metadata.sessionId(), warnings.size(), warnings);
    }
    return new SessionSecurityProfile(
        metadata,
        connections.connections(),
        installs,
        loggingChanges,
        unrecognized + warnings.size(),
        warnings);
  }
}
