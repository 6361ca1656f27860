package ca.gc.cra.warden.domain.events;

import ca.gc.cra.warden.domain.log.StreamKind;
import java.util.Objects;
import java.util.Optional;

/**
 * Network endpoint mentioned on a log line.
 *
 * @param host normalized lower-case host name or IP literal (IPv6 without brackets)
 * @param port explicit port when present on the line
 * @param scheme lower-case URL scheme when present (for example {@code https}, {@code jdbc:sqlserver})
 * @param rawLine the line the reference was found on, redacted and truncated
 * @param lineNumber 1-based line number
 * @param streamKind originating stream
 * @since 0.1.0
 */
public record ConnectionReference(
    String host,
    Optional<Integer> port,
    Optional<String> scheme,
    String rawLine,
    int lineNumber,
    StreamKind streamKind) implements LogEvent {

  /**
   * Validates required fields.
   */
  public ConnectionReference {
    Objects.requireNonNull(host, "host");
    port = Objects.requireNonNullElse(port, Optional.empty());
    scheme = Objects.requireNonNullElse(scheme, Optional.empty());
    rawLine = rawLine == null ? "" : rawLine;
    Objects.requireNonNull(streamKind, "streamKind");
  }

  /**
   * Renders the endpoint as {@code host[:port]}, bracketing IPv6 literals that carry a port.
   *
   * @return display form of the endpoint
   */
  public String endpoint() {
    if (port.isEmpty()) {
      return host;
    }
    String h = host.indexOf(':') >= 0 ? '[' + host + ']' : host;
    return h + ':' + port.get();
  }
}
