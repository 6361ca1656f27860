package ca.gc.cra.warden.domain.log;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable input unit: one session's metadata plus whichever of its streams could be retrieved.
 *
 * @param metadata session attributes
 * @param streams retrieved streams keyed by kind; absent kinds were not available
 * @param retrievalWarnings problems recorded while fetching the streams
 * @since 0.1.0
 */
public record LogBundle(
    SessionMetadata metadata, Map<StreamKind, RawLogFile> streams, List<String> retrievalWarnings) {

  /**
   * Copies collections so the bundle stays immutable after construction.
   */
  public LogBundle {
    Objects.requireNonNull(metadata, "metadata");
    Map<StreamKind, RawLogFile> copy = new EnumMap<>(StreamKind.class);
    if (streams != null) {
      copy.putAll(streams);
    }
    streams = Collections.unmodifiableMap(copy);
    retrievalWarnings = retrievalWarnings == null ? List.of() : List.copyOf(retrievalWarnings);
  }

  /**
   * Returns the stream of the given kind if it was retrieved.
   *
   * @param kind stream kind
   * @return the stream, or empty when missing
   */
  public Optional<RawLogFile> stream(StreamKind kind) {
    return Optional.ofNullable(streams.get(kind));
  }

  /**
   * Convenience accessor for the owning session id.
   *
   * @return session identifier
   */
  public String sessionId() {
    return metadata.sessionId();
  }
}
