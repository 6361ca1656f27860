package ca.gc.cra.warden.domain.log;

import java.util.Objects;

/**
 * Text of one log stream for one session, exactly as retrieved.
 *
 * @param sessionId owning session identifier
 * @param streamKind stream the text belongs to
 * @param text decoded stream contents; may be empty or arbitrarily malformed
 * @since 0.1.0
 */
public record RawLogFile(String sessionId, StreamKind streamKind, String text) {
  /**
   * Validates required fields and normalizes {@code null} text to empty.
   */
  public RawLogFile {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(streamKind, "streamKind");
    text = text == null ? "" : text;
  }
}
