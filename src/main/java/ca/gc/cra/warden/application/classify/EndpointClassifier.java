package ca.gc.cra.warden.application.classify;

import ca.gc.cra.warden.domain.events.ConnectionReference;
import ca.gc.cra.warden.domain.report.ClassifiedConnection;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import ca.gc.cra.warden.domain.trust.TrustDecision;
import ca.gc.cra.warden.domain.trust.TrustPattern;
import java.util.Objects;

/**
 * Labels a connection reference trusted or external using an explicit {@link TrustCatalog}.
 *
 * <p>Pure and idempotent: the same reference and catalog always yield the same classification.</p>
 *
 * @since 0.1.0
 */
public final class EndpointClassifier {

  /**
   * Creates a classifier.
   */
  public EndpointClassifier() {}

  /**
   * Classifies a single reference.
   *
   * @param reference connection found by the parser
   * @param catalog trust catalog for this run
   * @return classification with one occurrence
   */
  public ClassifiedConnection classify(ConnectionReference reference, TrustCatalog catalog) {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(catalog, "catalog");
    String host = TrustPattern.normalizeHost(reference.host());
    ConnectionReference normalized = host.equals(reference.host())
        ? reference
        : new ConnectionReference(host, reference.port(), reference.scheme(),
            reference.rawLine(), reference.lineNumber(), reference.streamKind());
    TrustDecision decision = catalog.classify(host);
    return new ClassifiedConnection(normalized, decision.trusted(), decision.matchedPattern(), 1);
  }
}
