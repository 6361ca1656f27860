package ca.gc.cra.warden.application.report;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.domain.report.Report;
import ca.gc.cra.warden.domain.report.SessionSecurityProfile;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import ca.gc.cra.warden.domain.trust.TrustPattern;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Assembles the run {@link Report} from session profiles.
 *
 * <p>Counts always cover every profile; {@code externalOnly} narrows the profile list only. Profiles
 * are ordered by start time ascending with unknown start times last, then by session id.</p>
 *
 * @since 0.1.0
 */
public final class ReportBuilder {
  /** Deterministic report order. */
  public static final Comparator<SessionSecurityProfile> ORDER =
      Comparator.comparing(
              (SessionSecurityProfile p) -> p.startTime().orElse(null),
              Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
          .thenComparing(SessionSecurityProfile::sessionId);

  private final ClockPort clock;

  /**
   * Creates a builder stamping reports with the given clock.
   *
   * @param clock report time source
   */
  public ReportBuilder(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the report.
   *
   * @param profiles every analyzed session, in any order
   * @param catalog catalog used for classification
   * @param externalOnly whether to keep only profiles with external activity
   * @return immutable report
   */
  public Report build(Collection<SessionSecurityProfile> profiles, TrustCatalog catalog, boolean externalOnly) {
    Objects.requireNonNull(profiles, "profiles");
    Objects.requireNonNull(catalog, "catalog");
    List<SessionSecurityProfile> ordered = new ArrayList<>(profiles);
    ordered.sort(ORDER);

    int external = 0;
    int withConnections = 0;
    int withInstalls = 0;
    int withLogging = 0;
    int withDisabledLogging = 0;
    List<SessionSecurityProfile> visible = new ArrayList<>(ordered.size());
    for (SessionSecurityProfile profile : ordered) {
      boolean hasExternal = profile.hasExternalActivity();
      if (hasExternal) {
        external++;
      }
      if (!profile.connections().isEmpty()) {
        withConnections++;
      }
      if (!profile.packageInstalls().isEmpty()) {
        withInstalls++;
      }
      if (!profile.loggingChanges().isEmpty()) {
        withLogging++;
      }
      if (profile.disablesLogging()) {
        withDisabledLogging++;
      }
      if (!externalOnly || hasExternal) {
        visible.add(profile);
      }
    }

    List<String> patterns = catalog.patterns().stream().map(TrustPattern::pattern).toList();
    return new Report(
        clock.now(),
        ordered.size(),
        external,
        catalog.size(),
        patterns,
        withConnections,
        withInstalls,
        withLogging,
        withDisabledLogging,
        externalOnly,
        visible);
  }
}
