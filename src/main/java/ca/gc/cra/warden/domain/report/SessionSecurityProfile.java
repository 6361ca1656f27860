package ca.gc.cra.warden.domain.report;

import ca.gc.cra.warden.domain.events.LoggingConfigChange;
import ca.gc.cra.warden.domain.events.PackageInstallCommand;
import ca.gc.cra.warden.domain.log.SessionMetadata;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Security findings for one session after its three streams have been merged.
 * <p><strong>Role:</strong> Output of the session aggregator, input of the report builder.</p>
 * <p><strong>Thread-safety:</strong> Immutable; owned by one analysis worker until handed to the report.</p>
 *
 * @param metadata session attributes
 * @param connections deduplicated connections in first-seen order
 * @param packageInstalls install commands in canonical stream order
 * @param loggingChanges logging configuration changes in canonical stream order
 * @param parseWarnings number of unrecognized lines plus structural warnings
 * @param warnings structural warning messages (missing streams, failed streams)
 * @since 0.1.0
 */
public record SessionSecurityProfile(
    SessionMetadata metadata,
    List<ClassifiedConnection> connections,
    List<PackageInstallCommand> packageInstalls,
    List<LoggingConfigChange> loggingChanges,
    int parseWarnings,
    List<String> warnings) {

  public SessionSecurityProfile {
    Objects.requireNonNull(metadata, "metadata");
    connections = connections == null ? List.of() : List.copyOf(connections);
    packageInstalls = packageInstalls == null ? List.of() : List.copyOf(packageInstalls);
    loggingChanges = loggingChanges == null ? List.of() : List.copyOf(loggingChanges);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    if (parseWarnings < 0) {
      throw new IllegalArgumentException("parseWarnings must be >= 0");
    }
  }

  /**
   * Profile for a session whose analysis failed outright.
   *
   * @param metadata session attributes
   * @param warning failure description
   * @return profile with empty findings and one warning
   */
  public static SessionSecurityProfile failed(SessionMetadata metadata, String warning) {
    return new SessionSecurityProfile(metadata, List.of(), List.of(), List.of(), 1, List.of(warning));
  }

  public String sessionId() {
    return metadata.sessionId();
  }

  public String notebookId() {
    return metadata.notebookId();
  }

  public Optional<Instant> startTime() {
    return metadata.startTime();
  }

  public String status() {
    return metadata.status();
  }

  /**
   * Derived flag: at least one connection is not trusted.
   *
   * @return {@code true} when the session reached an external endpoint
   */
  public boolean hasExternalActivity() {
    for (ClassifiedConnection connection : connections) {
      if (!connection.trusted()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the untrusted connections in first-seen order.
   *
   * @return external connections
   */
  public List<ClassifiedConnection> externalConnections() {
    return connections.stream().filter(c -> !c.trusted()).toList();
  }

  public long trustedConnectionCount() {
    return connections.stream().filter(ClassifiedConnection::trusted).count();
  }

  /**
   * Whether any logging change switched logging off.
   *
   * @return {@code true} when a disabling change was observed
   */
  public boolean disablesLogging() {
    for (LoggingConfigChange change : loggingChanges) {
      if (change.disablesLogging()) {
        return true;
      }
    }
    return false;
  }
}
