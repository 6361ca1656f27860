package ca.gc.cra.warden.application.port;

import java.time.Instant;

/**
 * Supplies the wall-clock time stamped on reports.
 *
 * <p>Tests inject a fixed clock so generated reports are reproducible.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.warden.infrastructure.time.SystemClockAdapter
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current time
   */
  Instant now();
}
