package ca.gc.cra.warden.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Hygiene helpers applied to raw session-log lines before they are stored in
 * events, written to reports or logged.
 * <p><strong>Why:</strong> Session logs routinely carry SAS signatures, bearer tokens and connection
 * strings; reports must not repeat them.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 text to a byte budget while preserving readability.</li>
 *   <li>Mask credential values in {@code key=value} pairs and bearer headers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
      "(?i)\\b(sig|sv_sig|token|access_token|refresh_token|client_secret|secret|password|passwd|pwd"
          + "|accountkey|sharedaccesskey|sharedaccesssignature|api[_-]?key)(\\s*[=:]\\s*)([^&;,\\s\"']+)");
  private static final Pattern BEARER = Pattern.compile("(?i)\\b(bearer)\\s+[A-Za-z0-9._~+/=-]+");

  /** Byte budget applied to raw lines carried in events. */
  public static final int MAX_LINE_BYTES = 512;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Masks credential values such as {@code sig=...}, {@code AccountKey=...} or {@code Bearer ...}.
   *
   * @param value text to scrub; {@code null} results in {@code "<null>"}
   * @return text with secret values replaced by {@code [REDACTED]}
   */
  public static String redactSecrets(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    Matcher assignment = SECRET_ASSIGNMENT.matcher(value);
    String scrubbed = assignment.replaceAll(m ->
        Matcher.quoteReplacement(m.group(1) + m.group(2) + REDACTED_PLACEHOLDER));
    Matcher bearer = BEARER.matcher(scrubbed);
    return bearer.replaceAll(m -> Matcher.quoteReplacement(m.group(1) + " " + REDACTED_PLACEHOLDER));
  }

  /**
   * Prepares a raw log line for storage: trims, redacts secrets and truncates to {@link #MAX_LINE_BYTES}.
   *
   * @param line raw line
   * @return sanitized line
   */
  public static String sanitizeLine(String line) {
    if (line == null) {
      return "";
    }
    return truncate(redactSecrets(line.strip()), MAX_LINE_BYTES);
  }
}
