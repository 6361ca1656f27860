package ca.gc.cra.warden.domain.trust;

import ca.gc.cra.warden.validation.Net;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the trust catalog: either an exact host or a {@code *.suffix} wildcard.
 *
 * @param pattern normalized pattern text ({@code host} or {@code *.suffix}), lower-case
 * @param kind how the pattern matches
 * @since 0.1.0
 */
public record TrustPattern(String pattern, Kind kind) {

  private static final String WILDCARD_PREFIX = "*.";

  /** Matching strategy for a pattern. */
  public enum Kind {
    /** Matches the identical host only. */
    EXACT,
    /** Matches hosts ending in {@code .suffix} with at least one extra label. */
    WILDCARD_SUFFIX
  }

  public TrustPattern {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Parses and validates user-supplied pattern text.
   *
   * @param raw pattern such as {@code api.fabric.microsoft.com} or {@code *.notebook.windows.net}
   * @return normalized pattern
   * @throws IllegalArgumentException when the pattern is blank or not a valid host or wildcard
   */
  public static TrustPattern parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("trusted domain pattern must not be blank");
    }
    String normalized = normalizeHost(raw);
    if (normalized.startsWith(WILDCARD_PREFIX)) {
      String suffix = normalized.substring(WILDCARD_PREFIX.length());
      if (suffix.indexOf('*') >= 0 || !Net.isValidHost(suffix)) {
        throw new IllegalArgumentException("invalid wildcard trusted domain pattern: " + raw.trim());
      }
      return new TrustPattern(WILDCARD_PREFIX + suffix, Kind.WILDCARD_SUFFIX);
    }
    if (normalized.indexOf('*') >= 0 || !Net.isValidHost(normalized)) {
      throw new IllegalArgumentException("invalid trusted domain pattern: " + raw.trim());
    }
    return new TrustPattern(normalized, Kind.EXACT);
  }

  /**
   * Tests a normalized host against this pattern.
   *
   * @param host host already passed through {@link #normalizeHost(String)}
   * @return {@code true} when the host matches
   */
  public boolean matches(String host) {
    if (host == null || host.isEmpty()) {
      return false;
    }
    if (kind == Kind.EXACT) {
      return pattern.equals(host);
    }
    String dottedSuffix = pattern.substring(1);
    return host.length() > dottedSuffix.length() && host.endsWith(dottedSuffix);
  }

  /**
   * Canonical host form used on both sides of matching: trimmed, lower-case, trailing dots and
   * IPv6 brackets removed.
   *
   * @param host raw host; {@code null} becomes empty
   * @return normalized host
   */
  public static String normalizeHost(String host) {
    if (host == null) {
      return "";
    }
    String h = host.trim().toLowerCase(Locale.ROOT);
    if (h.startsWith("[") && h.endsWith("]") && h.length() >= 2) {
      h = h.substring(1, h.length() - 1);
    }
    int end = h.length();
    while (end > 0 && h.charAt(end - 1) == '.') {
      end--;
    }
    return h.substring(0, end);
  }

  @Override
  public String toString() {
    return pattern;
  }
}
