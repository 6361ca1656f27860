package ca.gc.cra.warden.domain.events;

import ca.gc.cra.warden.domain.log.StreamKind;

/**
 * Typed, line-level observation extracted from a raw log stream.
 *
 * <p>The variant set is closed: a line produces connection references, package installs, logging
 * configuration changes, or a single {@link Unrecognized} marker when nothing matched.</p>
 *
 * @since 0.1.0
 */
public sealed interface LogEvent
    permits ConnectionReference, PackageInstallCommand, LoggingConfigChange, Unrecognized {

  /**
   * Returns the 1-based line number within the originating stream.
   *
   * @return line number
   */
  int lineNumber();

  /**
   * Returns the stream the event was extracted from.
   *
   * @return stream kind
   */
  StreamKind streamKind();
}
