package ca.gc.cra.warden.infrastructure.output;

import ca.gc.cra.warden.application.port.ReportSink;
import ca.gc.cra.warden.domain.report.Report;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the text rendering of a report to a UTF-8 file, replacing any previous content.
 *
 * @since 0.1.0
 */
public final class TextFileReportSink implements ReportSink {
  private static final Logger log = LoggerFactory.getLogger(TextFileReportSink.class);

  private final TextReportRenderer renderer;
  private final Path target;

  /**
   * Creates a text file sink.
   *
   * @param renderer text renderer
   * @param target destination file, validated by the caller
   */
  public TextFileReportSink(TextReportRenderer renderer, Path target) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public void write(Report report) throws IOException {
    Objects.requireNonNull(report, "report");
    Files.write(target, renderer.render(report), StandardCharsets.UTF_8);
    log.info("Text report written to {}", target);
  }
}
