package ca.gc.cra.warden.domain.events;

import ca.gc.cra.warden.domain.log.StreamKind;
import java.util.Objects;

/**
 * Runtime change to logging configuration observed on a log line.
 *
 * @param rawLine the line, redacted and truncated
 * @param configKeyHint the marker that identified the change, such as {@code log4j.rootLogger}
 * @param disablesLogging whether the change switches logging off or to a near-silent level
 * @param lineNumber 1-based line number
 * @param streamKind originating stream
 * @since 0.1.0
 */
public record LoggingConfigChange(
    String rawLine,
    String configKeyHint,
    boolean disablesLogging,
    int lineNumber,
    StreamKind streamKind) implements LogEvent {

  public LoggingConfigChange {
    rawLine = rawLine == null ? "" : rawLine;
    Objects.requireNonNull(configKeyHint, "configKeyHint");
    Objects.requireNonNull(streamKind, "streamKind");
  }
}
