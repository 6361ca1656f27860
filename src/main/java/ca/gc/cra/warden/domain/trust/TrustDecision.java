package ca.gc.cra.warden.domain.trust;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of looking a host up in the {@link TrustCatalog}.
 *
 * @param trusted whether any pattern matched
 * @param matchedPattern the pattern that matched, present iff {@code trusted}
 * @since 0.1.0
 */
public record TrustDecision(boolean trusted, Optional<TrustPattern> matchedPattern) {

  /** Decision for hosts no pattern matched. */
  public static final TrustDecision EXTERNAL = new TrustDecision(false, Optional.empty());

  public TrustDecision {
    Objects.requireNonNull(matchedPattern, "matchedPattern");
    if (trusted != matchedPattern.isPresent()) {
      throw new IllegalArgumentException("matchedPattern must be present iff trusted");
    }
  }

  static TrustDecision trustedBy(TrustPattern pattern) {
    return new TrustDecision(true, Optional.of(pattern));
  }
}
