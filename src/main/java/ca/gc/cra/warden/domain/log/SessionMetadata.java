package ca.gc.cra.warden.domain.log;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Descriptive attributes of one notebook execution session.
 *
 * @param sessionId Livy session identifier; never blank
 * @param notebookId notebook (artifact) identifier; empty string when unknown
 * @param notebookName display name of the notebook, when known
 * @param workspaceId workspace identifier, when known
 * @param workspaceName workspace display name, when known
 * @param sparkApplicationId Spark application identifier, when known
 * @param appUrl monitoring URL for the session, when known
 * @param startTime session start time, when known
 * @param status terminal or current session state such as {@code success}; empty string when unknown
 * @since 0.1.0
 */
public record SessionMetadata(
    String sessionId,
    String notebookId,
    Optional<String> notebookName,
    Optional<String> workspaceId,
    Optional<String> workspaceName,
    Optional<String> sparkApplicationId,
    Optional<String> appUrl,
    Optional<Instant> startTime,
    String status) {

  /**
   * Validates the identifier and replaces {@code null} optionals with empty ones.
   */
  public SessionMetadata {
    Objects.requireNonNull(sessionId, "sessionId");
    if (sessionId.isBlank()) {
      throw new IllegalArgumentException("sessionId must not be blank");
    }
    notebookId = notebookId == null ? "" : notebookId;
    notebookName = Objects.requireNonNullElse(notebookName, Optional.empty());
    workspaceId = Objects.requireNonNullElse(workspaceId, Optional.empty());
    workspaceName = Objects.requireNonNullElse(workspaceName, Optional.empty());
    sparkApplicationId = Objects.requireNonNullElse(sparkApplicationId, Optional.empty());
    appUrl = Objects.requireNonNullElse(appUrl, Optional.empty());
    startTime = Objects.requireNonNullElse(startTime, Optional.empty());
    status = status == null ? "" : status;
  }

  /**
   * Creates metadata carrying only the core attributes.
   *
   * @param sessionId Livy session identifier
   * @param notebookId notebook identifier
   * @param startTime session start, or {@code null} when unknown
   * @param status session state
   * @return metadata with empty descriptive fields
   */
  public static SessionMetadata of(String sessionId, String notebookId, Instant startTime, String status) {
    return new SessionMetadata(
        sessionId,
        notebookId,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.ofNullable(startTime),
        status);
  }
}
