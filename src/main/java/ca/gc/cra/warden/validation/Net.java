package ca.gc.cra.warden.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Host-name and IP-literal checks shared by the trust catalog and the log parser.
 *
 * <p>The boolean forms never throw, so they can run on every token of untrusted log text.</p>
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a host name or IP literal and returns it trimmed.
   *
   * @param name parameter name for diagnostics
   * @param host candidate host; IPv6 literals may be bracketed
   * @return trimmed host
   * @throws IllegalArgumentException when the host is blank or malformed
   */
  public static String requireHost(String name, String host) {
    String sanitized = Strings.requireNonBlank(name, host);
    if (!isValidHost(sanitized)) {
      throw new IllegalArgumentException(name + " is not a valid host name or IP literal: " + sanitized);
    }
    return sanitized;
  }

  /**
   * Checks a host name (ASCII/Punycode labels), dotted IPv4 or IPv6 literal.
   *
   * @param host candidate host; IPv6 literals may be bracketed
   * @return {@code true} when well-formed
   */
  public static boolean isValidHost(String host) {
    if (host == null || host.isEmpty()) {
      return false;
    }
    if (isIpLiteral(host)) {
      return true;
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      // dotted-quad shape with an octet > 255
      return false;
    }
    return isValidHostname(host);
  }

  /**
   * Checks for an IPv4 dotted quad or an IPv6 literal (bracketed or not).
   *
   * @param host candidate
   * @return {@code true} for a valid IP literal
   */
  public static boolean isIpLiteral(String host) {
    if (host == null || host.isEmpty()) {
      return false;
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      return validIpv4Octets(host);
    }
    String candidate = host;
    if (candidate.startsWith("[") && candidate.endsWith("]") && candidate.length() > 2) {
      candidate = candidate.substring(1, candidate.length() - 1);
    }
    if (candidate.indexOf(':') < 0 || !IPV6_CHARS.matcher(candidate).matches()) {
      return false;
    }
    try {
      return InetAddress.getByName(candidate) instanceof Inet6Address;
    } catch (UnknownHostException ex) {
      return false;
    }
  }

  private static boolean isValidHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      return false;
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      if (!validLabel(host, start, end)) {
        return false;
      }
      if (dot == -1) {
        return true;
      }
      start = dot + 1;
      if (start == len) {
        return false;
      }
    }
  }

  // length 1..63, alnum at both ends, alnum/'-'/'_' inside
  private static boolean validLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      return false;
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      return false;
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-' || c == '_')) {
        return false;
      }
    }
    return true;
  }

  private static boolean validIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      if (Integer.parseInt(part) > 255) {
        return false;
      }
    }
    return true;
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
