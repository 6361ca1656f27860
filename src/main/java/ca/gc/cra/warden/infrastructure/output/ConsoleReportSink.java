package ca.gc.cra.warden.infrastructure.output;

import ca.gc.cra.warden.application.port.ReportSink;
import ca.gc.cra.warden.domain.report.Report;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Prints the text rendering of a report line by line to a caller-supplied printer (the CLI console).
 *
 * @since 0.1.0
 */
public final class ConsoleReportSink implements ReportSink {
  private final TextReportRenderer renderer;
  private final Consumer<String> printer;

  /**
   * Creates a console sink.
   *
   * @param renderer text renderer
   * @param printer receives each rendered line
   */
  public ConsoleReportSink(TextReportRenderer renderer, Consumer<String> printer) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.printer = Objects.requireNonNull(printer, "printer");
  }

  @Override
  public void write(Report report) {
    Objects.requireNonNull(report, "report");
    renderer.render(report).forEach(printer);
  }
}
