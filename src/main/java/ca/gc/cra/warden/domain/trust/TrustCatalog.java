package ca.gc.cra.warden.domain.trust;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable set of trusted-domain patterns used to separate platform traffic from
 * external endpoints.
 * <p><strong>Why:</strong> Every session is classified against the same catalog, so the catalog is built
 * once per run and then only read.</p>
 * <p><strong>Role:</strong> Domain service shared by the endpoint classifier and all analysis workers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate and normalize patterns at load time; reject empty catalogs.</li>
 *   <li>Answer case-insensitive lookups: exact patterns first, then wildcards in load order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after {@link #load(Collection)}; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> Exact lookups are hash-based; wildcard lookups scan the wildcard list.</p>
 *
 * @since 0.1.0
 */
public final class TrustCatalog {
  private final List<TrustPattern> patterns;
  private final Map<String, TrustPattern> exact;
  private final List<TrustPattern> wildcards;

  private TrustCatalog(List<TrustPattern> patterns) {
    Map<String, TrustPattern> exactMap = new LinkedHashMap<>();
    List<TrustPattern> wildcardList = new ArrayList<>();
    for (TrustPattern pattern : patterns) {
      if (pattern.kind() == TrustPattern.Kind.EXACT) {
        exactMap.put(pattern.pattern(), pattern);
      } else {
        wildcardList.add(pattern);
      }
    }
    this.patterns = List.copyOf(patterns);
    this.exact = Map.copyOf(exactMap);
    this.wildcards = List.copyOf(wildcardList);
  }

  /**
   * Builds a catalog from raw pattern strings. Duplicates collapse; load order is kept.
   *
   * @param rawPatterns pattern text such as {@code *.notebook.windows.net}
   * @return immutable catalog
   * @throws IllegalArgumentException when no patterns are supplied or any pattern is invalid
   */
  public static TrustCatalog load(Collection<String> rawPatterns) {
    Objects.requireNonNull(rawPatterns, "rawPatterns");
    Map<String, TrustPattern> unique = new LinkedHashMap<>();
    for (String raw : rawPatterns) {
      TrustPattern pattern = TrustPattern.parse(raw);
      unique.putIfAbsent(pattern.pattern(), pattern);
    }
    if (unique.isEmpty()) {
      throw new IllegalArgumentException("trusted domain catalog must contain at least one pattern");
    }
    return new TrustCatalog(new ArrayList<>(unique.values()));
  }

  /**
   * Classifies a host. Empty or {@code null} hosts are external.
   *
   * @param host host name or IP literal in any case
   * @return trust decision naming the matching pattern when trusted
   */
  public TrustDecision classify(String host) {
    String normalized = TrustPattern.normalizeHost(host);
    if (normalized.isEmpty()) {
      return TrustDecision.EXTERNAL;
    }
    TrustPattern exactMatch = exact.get(normalized);
    if (exactMatch != null) {
      return TrustDecision.trustedBy(exactMatch);
    }
    for (TrustPattern wildcard : wildcards) {
      if (wildcard.matches(normalized)) {
        return TrustDecision.trustedBy(wildcard);
      }
    }
    return TrustDecision.EXTERNAL;
  }

  /**
   * Returns the distinct patterns in load order.
   *
   * @return immutable pattern list
   */
  public List<TrustPattern> patterns() {
    return patterns;
  }

  /**
   * Returns the number of distinct patterns.
   *
   * @return pattern count, always positive
   */
  public int size() {
    return patterns.size();
  }
}
