package ca.gc.cra.warden.application.parse;

import ca.gc.cra.warden.domain.events.ConnectionReference;
import ca.gc.cra.warden.domain.log.StreamKind;
import ca.gc.cra.warden.domain.trust.TrustPattern;
import ca.gc.cra.warden.validation.Net;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds endpoint references on a single log line.
 *
 * <p>Two detectors run per line: URL-like substrings ({@code scheme://[userinfo@]host[:port]},
 * including {@code jdbc:driver://}) and bare {@code host[:port]} tokens following connection
 * phrases or HTTP verbs. Bare tokens inside an already matched URL are ignored.</p>
 */
final class ConnectionExtractor {
  private static final Pattern URL = Pattern.compile(
      "(?i)(?<![A-Za-z0-9+.-])((?:jdbc:)?[a-z][a-z0-9+.-]*)://"
          + "(\\[[0-9A-Fa-f:.]*\\](?::[^\\s/?#'\"<>,;()\\[\\]{}|\\\\^`]*)?"
          + "|[^\\s/?#'\"<>,;()\\[\\]{}|\\\\^`]*)");
  private static final Pattern MARKER = Pattern.compile(
      "(?i)\\b(?:connecting to|connected to|established connection to|connection to"
          + "|remote address|destination)\\s*[:=]?\\s*"
          + "|\\b(?-i:GET|POST|PUT|DELETE|PATCH|HEAD)\\s+");
  private static final Pattern TOKEN = Pattern.compile("[^\\s,;]+");
  private static final String LEADING_JUNK = "\"'(<`";
  private static final String TRAILING_JUNK = ".,;:)\"'>`!";

  /** Connections found on the line plus whether any candidate was malformed. */
  record Result(List<ConnectionReference> connections, boolean malformed) {}

  Result extract(String line, String sanitizedLine, int lineNumber, StreamKind streamKind) {
    List<Positioned> found = new ArrayList<>();
    List<int[]> urlSpans = new ArrayList<>();
    boolean malformed = false;

    Matcher url = URL.matcher(line);
    while (url.find()) {
      urlSpans.add(new int[] {url.start(), url.end()});
      String scheme = url.group(1).toLowerCase(Locale.ROOT);
      String authority = stripJunk(url.group(2));
      int at = authority.lastIndexOf('@');
      if (at >= 0) {
        authority = authority.substring(at + 1);
      }
      if (authority.isEmpty()) {
        continue;
      }
      Endpoint endpoint = parseEndpoint(authority);
      if (endpoint == null) {
        malformed = true;
        continue;
      }
      found.add(new Positioned(url.start(), new ConnectionReference(
          endpoint.host(), endpoint.port(), Optional.of(scheme), sanitizedLine, lineNumber, streamKind)));
    }

    Matcher marker = MARKER.matcher(line);
    while (marker.find()) {
      int tokenStart = marker.end();
      if (insideSpan(urlSpans, tokenStart)) {
        continue;
      }
      Matcher token = TOKEN.matcher(line).region(tokenStart, line.length());
      if (!token.lookingAt()) {
        continue;
      }
      String candidate = stripJunk(token.group());
      if (candidate.isEmpty() || candidate.startsWith("/") || candidate.contains("://")) {
        continue;
      }
      int slash = candidate.indexOf('/');
      if (slash > 0) {
        candidate = candidate.substring(0, slash);
      }
      Endpoint endpoint = parseEndpoint(candidate);
      if (endpoint == null) {
        if (looksLikeHostPort(candidate)) {
          malformed = true;
        }
        continue;
      }
      if (endpoint.port().isEmpty() && endpoint.host().indexOf('.') < 0 && !Net.isIpLiteral(endpoint.host())) {
        continue;
      }
      found.add(new Positioned(tokenStart, new ConnectionReference(
          endpoint.host(), endpoint.port(), Optional.empty(), sanitizedLine, lineNumber, streamKind)));
    }

    found.sort(Comparator.comparingInt(Positioned::position));
    return new Result(found.stream().map(Positioned::reference).toList(), malformed);
  }

  /**
   * Parses {@code host}, {@code host:port} or {@code [v6]:port}.
   *
   * @return endpoint, or {@code null} when the host is invalid or the port is out of range
   */
  static Endpoint parseEndpoint(String authority) {
    String host;
    String portText = null;
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      if (close < 0) {
        return null;
      }
      host = authority.substring(1, close);
      String rest = authority.substring(close + 1);
      if (rest.startsWith(":")) {
        portText = rest.substring(1);
      } else if (!rest.isEmpty()) {
        return null;
      }
    } else {
      int colon = authority.lastIndexOf(':');
      if (colon >= 0 && authority.indexOf(':') != colon) {
        // unbracketed IPv6
        host = authority;
      } else if (colon >= 0) {
        host = authority.substring(0, colon);
        portText = authority.substring(colon + 1);
      } else {
        host = authority;
      }
    }
    host = TrustPattern.normalizeHost(host);
    if (host.isEmpty() || !Net.isValidHost(host)) {
      return null;
    }
    Optional<Integer> port = Optional.empty();
    if (portText != null && !portText.isEmpty()) {
      Integer parsed = parsePort(portText);
      if (parsed == null) {
        return null;
      }
      port = Optional.of(parsed);
    }
    return new Endpoint(host, port);
  }

  private static Integer parsePort(String text) {
    if (text.length() > 5) {
      return null;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        return null;
      }
    }
    int value = Integer.parseInt(text);
    return value >= 1 && value <= 65535 ? value : null;
  }

  private static boolean looksLikeHostPort(String candidate) {
    int colon = candidate.lastIndexOf(':');
    return colon > 0 && colon < candidate.length() - 1 && candidate.indexOf('.') >= 0;
  }

  private static boolean insideSpan(List<int[]> spans, int index) {
    for (int[] span : spans) {
      if (index >= span[0] && index < span[1]) {
        return true;
      }
    }
    return false;
  }

  private static String stripJunk(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && LEADING_JUNK.indexOf(token.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && TRAILING_JUNK.indexOf(token.charAt(end - 1)) >= 0) {
      end--;
    }
    return token.substring(start, end);
  }

  record Endpoint(String host, Optional<Integer> port) {}

  private record Positioned(int position, ConnectionReference reference) {}
}
