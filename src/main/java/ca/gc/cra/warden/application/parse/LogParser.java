package ca.gc.cra.warden.application.parse;

import ca.gc.cra.warden.domain.events.LogEvent;
import ca.gc.cra.warden.domain.events.Unrecognized;
import ca.gc.cra.warden.domain.log.RawLogFile;
import ca.gc.cra.warden.domain.log.StreamKind;
import ca.gc.cra.warden.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Converts one raw log stream into typed {@link LogEvent}s.
 * <p><strong>Why:</strong> Session logs are free text mixing Spark, Livy, pip and user output; the
 * analysis needs typed connection, install and logging events.</p>
 * <p><strong>Role:</strong> Application service invoked once per stream by the session aggregator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the stream line by line, skipping blank lines.</li>
 *   <li>Emit install, logging-change and connection events in that order for each line.</li>
 *   <li>Emit a single {@link Unrecognized} for lines where nothing matched.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; one instance may serve all workers.</p>
 * <p><strong>Performance:</strong> Lazy; memory use is bounded by the events of a single line.</p>
 * <p><strong>Observability:</strong> Does not log; unrecognized lines are counted by the caller.</p>
 *
 * @implNote Never throws on log content.
 * @since 0.1.0
 */
public final class LogParser {
  private final ConnectionExtractor connections = new ConnectionExtractor();
  private final PackageInstallDetector installs = new PackageInstallDetector();
  private final LoggingChangeDetector loggingChanges = new LoggingChangeDetector();

  /**
   * Creates a parser.
   */
  public LogParser() {}

  /**
   * Returns a lazy, restartable event sequence over the stream.
   *
   * @param file raw stream
   * @return sequence whose every iteration re-reads the text and yields the same events
   */
  public LogEventSequence parse(RawLogFile file) {
    Objects.requireNonNull(file, "file");
    return new LogEventSequence(file, this);
  }

  /**
   * Extracts the events of one line.
   *
   * @param line raw line text
   * @param lineNumber 1-based position of the line
   * @param streamKind originating stream
   * @return recognized events, or one {@link Unrecognized}; empty for blank lines
   */
  public List<LogEvent> parseLine(String line, int lineNumber, StreamKind streamKind) {
    if (line == null || line.isBlank()) {
      return List.of();
    }
    String sanitized = Logs.sanitizeLine(line);
    List<LogEvent> events = new ArrayList<>(2);
    installs.detect(line, sanitized, lineNumber, streamKind).ifPresent(events::add);
    loggingChanges.detect(line, sanitized, lineNumber, streamKind).ifPresent(events::add);
    ConnectionExtractor.Result result = connections.extract(line, sanitized, lineNumber, streamKind);
    events.addAll(result.connections());
    if (events.isEmpty()) {
      Unrecognized.Reason reason = result.malformed()
          ? Unrecognized.Reason.MALFORMED_CONNECTION
          : Unrecognized.Reason.NO_MATCH;
      return List.of(new Unrecognized(reason, lineNumber, streamKind));
    }
    return List.copyOf(events);
  }
}
