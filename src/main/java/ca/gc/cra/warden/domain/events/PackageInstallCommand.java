package ca.gc.cra.warden.domain.events;

import ca.gc.cra.warden.domain.log.StreamKind;
import java.util.List;
import java.util.Objects;

/**
 * Package installation observed on a log line.
 *
 * @param manager package manager family
 * @param rawCommand the line carrying the command, redacted and truncated
 * @param packages requested package specifiers in command order; may be empty
 * @param lineNumber 1-based line number
 * @param streamKind originating stream
 * @since 0.1.0
 */
public record PackageInstallCommand(
    PackageManager manager,
    String rawCommand,
    List<String> packages,
    int lineNumber,
    StreamKind streamKind) implements LogEvent {

  /**
   * Validates fields and freezes the package list.
   */
  public PackageInstallCommand {
    Objects.requireNonNull(manager, "manager");
    rawCommand = rawCommand == null ? "" : rawCommand;
    packages = packages == null ? List.of() : List.copyOf(packages);
    Objects.requireNonNull(streamKind, "streamKind");
  }
}
