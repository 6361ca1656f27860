package ca.gc.cra.warden.infrastructure.output;

import ca.gc.cra.warden.domain.events.LoggingConfigChange;
import ca.gc.cra.warden.domain.events.PackageInstallCommand;
import ca.gc.cra.warden.domain.report.ClassifiedConnection;
import ca.gc.cra.warden.domain.report.Report;
import ca.gc.cra.warden.domain.report.SessionSecurityProfile;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Renders a {@link Report} as the plain-text summary shared by the console and text-file sinks.
 *
 * @since 0.1.0
 */
public final class TextReportRenderer {
  private static final String RULE = "-".repeat(72);

  /**
   * Creates a renderer.
   */
  public TextReportRenderer() {}

  /**
   * Renders the report.
   *
   * @param report report to render
   * @return lines without terminators
   */
  public List<String> render(Report report) {
    List<String> lines = new ArrayList<>();
    lines.add("WARDEN session security report");
    lines.add(RULE);
    lines.add("Generated                        : " + report.generatedAt());
    lines.add("Sessions analyzed                : " + report.totalSessions());
    lines.add("Sessions with external activity  : " + report.sessionsWithExternalActivity());
    lines.add("Sessions with connections        : " + report.sessionsWithConnections());
    lines.add("Sessions with package installs   : " + report.sessionsWithPackageInstalls());
    lines.add("Sessions with logging changes    : " + report.sessionsWithLoggingChanges());
    lines.add("Sessions with logging disabled   : " + report.sessionsWithDisabledLogging());
    lines.add("Trusted domain patterns (" + report.trustedDomainCount() + ")");
    for (String pattern : report.trustedDomains()) {
      lines.add("  " + pattern);
    }
    lines.add("Listing                          : "
        + (report.externalOnly() ? "sessions with external activity only" : "all sessions"));

    List<SessionSecurityProfile> external =
        report.profiles().stream().filter(SessionSecurityProfile::hasExternalActivity).toList();
    lines.add("");
    if (external.isEmpty()) {
      lines.add("No external network activity detected.");
    } else {
      lines.add("SECURITY REVIEW NEEDED: " + external.size() + " session(s) with external connections");
      lines.add(RULE);
      for (SessionSecurityProfile profile : external) {
        renderExternal(profile, lines);
      }
    }

    renderInstalls(report.profiles(), lines);
    renderLoggingChanges(report.profiles(), lines);
    renderWarnings(report.profiles(), lines);
    return List.copyOf(lines);
  }

  private static void renderExternal(SessionSecurityProfile profile, List<String> lines) {
    String notebook = profile.metadata().notebookName().orElse("<unnamed notebook>");
    lines.add("Notebook: " + notebook + (profile.notebookId().isEmpty() ? "" : " (" + profile.notebookId() + ")"));
    lines.add("  Livy session        : " + profile.sessionId());
    profile.metadata().workspaceName().ifPresent(ws -> lines.add("  Workspace           : " + ws));
    lines.add("  Status              : " + (profile.status().isEmpty() ? "<unknown>" : profile.status())
        + ", started " + profile.startTime().map(Object::toString).orElse("<unknown>"));
    lines.add("  External connections: " + profile.externalConnections().size()
        + ", trusted connections: " + profile.trustedConnectionCount());
    profile.metadata().appUrl().ifPresent(url -> lines.add("  Monitor             : " + url));
    lines.add("  External endpoints:");
    TreeSet<String> endpoints = new TreeSet<>();
    for (ClassifiedConnection connection : profile.externalConnections()) {
      endpoints.add(connection.reference().endpoint());
    }
    for (String endpoint : endpoints) {
      lines.add("    - " + endpoint);
    }
    lines.add("");
  }

  private static void renderInstalls(List<SessionSecurityProfile> profiles, List<String> lines) {
    List<String> section = new ArrayList<>();
    for (SessionSecurityProfile profile : profiles) {
      for (PackageInstallCommand install : profile.packageInstalls()) {
        String packages = install.packages().isEmpty() ? "<no packages named>" : String.join(", ", install.packages());
        section.add("  [" + profile.sessionId() + "] " + install.manager().name().toLowerCase(Locale.ROOT)
            + ": " + packages + " (" + install.streamKind().label() + ":" + install.lineNumber() + ")");
      }
    }
    appendSection("PACKAGE INSTALLS", section, lines);
  }

  private static void renderLoggingChanges(List<SessionSecurityProfile> profiles, List<String> lines) {
    List<String> section = new ArrayList<>();
    for (SessionSecurityProfile profile : profiles) {
      for (LoggingConfigChange change : profile.loggingChanges()) {
        section.add("  [" + profile.sessionId() + "] " + change.configKeyHint()
            + (change.disablesLogging() ? " (DISABLES LOGGING)" : "")
            + " (" + change.streamKind().label() + ":" + change.lineNumber() + ")");
      }
    }
    appendSection("LOGGING CHANGES", section, lines);
  }

  private static void renderWarnings(List<SessionSecurityProfile> profiles, List<String> lines) {
    List<String> section = new ArrayList<>();
    for (SessionSecurityProfile profile : profiles) {
      for (String warning : profile.warnings()) {
        section.add("  [" + profile.sessionId() + "] " + warning);
      }
    }
    appendSection("WARNINGS", section, lines);
  }

  private static void appendSection(String title, List<String> body, List<String> lines) {
    if (body.isEmpty()) {
      return;
    }
    lines.add("");
    lines.add(title);
    lines.add(RULE);
    lines.addAll(body);
  }
}
