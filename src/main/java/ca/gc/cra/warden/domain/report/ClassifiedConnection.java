package ca.gc.cra.warden.domain.report;

import ca.gc.cra.warden.domain.events.ConnectionReference;
import ca.gc.cra.warden.domain.trust.TrustPattern;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection reference with its trust classification.
 *
 * @param reference the retained (most fully qualified) sighting
 * @param trusted whether the host matched the trust catalog
 * @param matchedPattern the matching pattern when trusted
 * @param occurrences number of raw references merged into this entry, at least one
 * @since 0.1.0
 */
public record ClassifiedConnection(
    ConnectionReference reference,
    boolean trusted,
    Optional<TrustPattern> matchedPattern,
    int occurrences) {

  public ClassifiedConnection {
    Objects.requireNonNull(reference, "reference");
    matchedPattern = Objects.requireNonNullElse(matchedPattern, Optional.empty());
    if (occurrences < 1) {
      throw new IllegalArgumentException("occurrences must be >= 1");
    }
  }

  /**
   * Returns the normalized host.
   *
   * @return host
   */
  public String host() {
    return reference.host();
  }

  /**
   * Returns a copy with a different retained reference and occurrence count.
   *
   * @param replacement reference to retain
   * @param newOccurrences merged occurrence count
   * @return updated connection
   */
  public ClassifiedConnection merged(ConnectionReference replacement, int newOccurrences) {
    return new ClassifiedConnection(replacement, trusted, matchedPattern, newOccurrences);
  }
}
