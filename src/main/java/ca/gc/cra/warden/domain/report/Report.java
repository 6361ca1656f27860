package ca.gc.cra.warden.domain.report;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final security report for one pipeline run.
 *
 * <p>All counts are computed over every analyzed session; {@code profiles} alone is narrowed when
 * {@code externalOnly} is set.</p>
 *
 * @param generatedAt report creation time
 * @param totalSessions sessions analyzed
 * @param sessionsWithExternalActivity sessions with at least one untrusted connection
 * @param trustedDomainCount number of distinct catalog patterns
 * @param trustedDomains catalog patterns in load order
 * @param sessionsWithConnections sessions with any connection
 * @param sessionsWithPackageInstalls sessions with any install command
 * @param sessionsWithLoggingChanges sessions with any logging change
 * @param sessionsWithDisabledLogging sessions where logging was switched off
 * @param externalOnly whether {@code profiles} was filtered to external sessions
 * @param profiles profiles ordered by start time (unknown last), then session id
 * @since 0.1.0
 */
public record Report(
    Instant generatedAt,
    int totalSessions,
    int sessionsWithExternalActivity,
    int trustedDomainCount,
    List<String> trustedDomains,
    int sessionsWithConnections,
    int sessionsWithPackageInstalls,
    int sessionsWithLoggingChanges,
    int sessionsWithDisabledLogging,
    boolean externalOnly,
    List<SessionSecurityProfile> profiles) {

  public Report {
    Objects.requireNonNull(generatedAt, "generatedAt");
    trustedDomains = trustedDomains == null ? List.of() : List.copyOf(trustedDomains);
    profiles = profiles == null ? List.of() : List.copyOf(profiles);
  }
}
