package ca.gc.cra.warden.domain.log;

import java.util.Locale;
import java.util.Optional;

/**
 * Identifies which of the three per-session log streams a line came from.
 *
 * <p>Declaration order is the canonical merge order used when a session's streams are combined.</p>
 *
 * @since 0.1.0
 */
public enum StreamKind {
  /** Livy session log (driver launch, session state transitions). */
  LIVY("livy"),
  /** Driver standard output. */
  STDOUT("stdout"),
  /** Driver standard error. */
  STDERR("stderr");

  private final String label;

  StreamKind(String label) {
    this.label = label;
  }

  /**
   * Returns the lower-case label used in reports and log lines.
   *
   * @return stream label such as {@code livy}
   */
  public String label() {
    return label;
  }

  /**
   * Infers the stream kind from a downloaded file name such as {@code driver_stderr.log}.
   *
   * @param fileName file name or path; may be {@code null}
   * @return matching stream kind, or empty when the name does not identify a stream
   */
  public static Optional<StreamKind> fromFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return Optional.empty();
    }
    String normalized = fileName.replace('\\', '/');
    int slash = normalized.lastIndexOf('/');
    String name = (slash >= 0 ? normalized.substring(slash + 1) : normalized).toLowerCase(Locale.ROOT);
    if (name.contains("stderr")) {
      return Optional.of(STDERR);
    }
    if (name.contains("stdout")) {
      return Optional.of(STDOUT);
    }
    if (name.contains("livy")) {
      return Optional.of(LIVY);
    }
    return Optional.empty();
  }
}
