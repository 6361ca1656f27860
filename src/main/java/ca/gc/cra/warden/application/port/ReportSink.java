package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.report.Report;
import java.io.IOException;

/**
 * Driven port that persists or displays a finished report.
 *
 * @since 0.1.0
 */
public interface ReportSink {
  /**
   * Writes the report.
   *
   * @param report report to serialize
   * @throws IOException when the destination cannot be written
   */
  void write(Report report) throws IOException;
}
