package ca.gc.cra.warden.domain.events;

import ca.gc.cra.warden.domain.log.StreamKind;
import java.util.Objects;

/**
 * Marker for a non-blank line that produced no recognized event. Counted, never raised.
 *
 * @param reason why the line was not recognized
 * @param lineNumber 1-based line number
 * @param streamKind originating stream
 * @since 0.1.0
 */
public record Unrecognized(Reason reason, int lineNumber, StreamKind streamKind) implements LogEvent {

  public Unrecognized {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(streamKind, "streamKind");
  }

  /** Why a line was not recognized. */
  public enum Reason {
    /** Nothing on the line matched any detector. */
    NO_MATCH,
    /** A connection-like token was found but its host or port was invalid. */
    MALFORMED_CONNECTION
  }
}
