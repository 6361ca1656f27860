package ca.gc.cra.warden.application.aggregate;

import ca.gc.cra.warden.domain.events.ConnectionReference;
import ca.gc.cra.warden.domain.report.ClassifiedConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collapses sightings of the same endpoint within one session.
 *
 * <p>Two references are duplicates when the hosts are equal, the effective ports (explicit, else the
 * scheme's well-known port) are equal or either is unknown, and the schemes are equal or either is
 * absent. A merged entry keeps the slot of its first sighting and retains the first most fully
 * qualified reference seen. Not thread-safe; one instance per session.</p>
 */
final class ConnectionDeduplicator {
  private final List<ClassifiedConnection> retained = new ArrayList<>();

  void add(ClassifiedConnection candidate) {
    ConnectionReference incoming = candidate.reference();
    for (int i = 0; i < retained.size(); i++) {
      ClassifiedConnection existing = retained.get(i);
      if (compatible(existing.reference(), incoming)) {
        ConnectionReference keep = qualification(incoming) > qualification(existing.reference())
            ? incoming
            : existing.reference();
        retained.set(i, existing.merged(keep, existing.occurrences() + candidate.occurrences()));
        return;
      }
    }
    retained.add(candidate);
  }

  List<ClassifiedConnection> connections() {
    return List.copyOf(retained);
  }

  static boolean compatible(ConnectionReference a, ConnectionReference b) {
    if (!a.host().equals(b.host())) {
      return false;
    }
    Optional<Integer> portA = effectivePort(a);
    Optional<Integer> portB = effectivePort(b);
    if (portA.isPresent() && portB.isPresent() && !portA.get().equals(portB.get())) {
      return false;
    }
    return a.scheme().isEmpty() || b.scheme().isEmpty() || a.scheme().get().equals(b.scheme().get());
  }

  private static Optional<Integer> effectivePort(ConnectionReference reference) {
    return reference.port().or(() -> DefaultPorts.forScheme(reference.scheme()));
  }

  private static int qualification(ConnectionReference reference) {
    return (reference.scheme().isPresent() ? 1 : 0) + (reference.port().isPresent() ? 1 : 0);
  }
}
