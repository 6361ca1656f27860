package ca.gc.cra.warden.infrastructure.output;

import ca.gc.cra.warden.application.port.ReportSink;
import ca.gc.cra.warden.domain.events.LoggingConfigChange;
import ca.gc.cra.warden.domain.events.PackageInstallCommand;
import ca.gc.cra.warden.domain.log.SessionMetadata;
import ca.gc.cra.warden.domain.report.ClassifiedConnection;
import ca.gc.cra.warden.domain.report.Report;
import ca.gc.cra.warden.domain.report.SessionSecurityProfile;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes a {@link Report} to a pretty-printed JSON file.
 * <p><strong>Role:</strong> Driven adapter behind {@link ReportSink}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the report fields under their record names ({@code generatedAt}, {@code totalSessions},
 *   {@code sessionsWithExternalActivity}, {@code trustedDomainCount}, {@code profiles}, ...).</li>
 *   <li>Write absent optional values as JSON {@code null}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One write at a time per instance.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportSink implements ReportSink {
  private static final Logger log = LoggerFactory.getLogger(JsonReportSink.class);
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory factory = new JsonFactory();
  private final Path target;

  /**
   * Creates a JSON sink.
   *
   * @param target destination file, validated by the caller
   */
  public JsonReportSink(Path target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public void write(Report report) throws IOException {
    Objects.requireNonNull(report, "report");
    try (OutputStream out = Files.newOutputStream(target)) {
      write(report, out);
    }
    log.info("JSON report written to {}", target);
  }

  /**
   * Serializes the report to a stream without closing it.
   *
   * @param report report to serialize
   * @param out destination stream
   * @throws IOException when writing fails
   */
  void write(Report report, OutputStream out) throws IOException {
    JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    gen.useDefaultPrettyPrinter();
    gen.writeStartObject();
    gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
    gen.writeStringField("generatedAt", report.generatedAt().toString());
    gen.writeNumberField("totalSessions", report.totalSessions());
    gen.writeNumberField("sessionsWithExternalActivity", report.sessionsWithExternalActivity());
    gen.writeNumberField("trustedDomainCount", report.trustedDomainCount());
    gen.writeArrayFieldStart("trustedDomains");
    for (String pattern : report.trustedDomains()) {
      gen.writeString(pattern);
    }
    gen.writeEndArray();
    gen.writeNumberField("sessionsWithConnections", report.sessionsWithConnections());
    gen.writeNumberField("sessionsWithPackageInstalls", report.sessionsWithPackageInstalls());
    gen.writeNumberField("sessionsWithLoggingChanges", report.sessionsWithLoggingChanges());
    gen.writeNumberField("sessionsWithDisabledLogging", report.sessionsWithDisabledLogging());
    gen.writeBooleanField("externalOnly", report.externalOnly());
    gen.writeArrayFieldStart("profiles");
    for (SessionSecurityProfile profile : report.profiles()) {
      writeProfile(gen, profile);
    }
    gen.writeEndArray();
    gen.writeEndObject();
    gen.writeRaw('\n');
    gen.close();
  }

  private static void writeProfile(JsonGenerator gen, SessionSecurityProfile profile) throws IOException {
    SessionMetadata metadata = profile.metadata();
    gen.writeStartObject();
    gen.writeStringField("sessionId", profile.sessionId());
    gen.writeStringField("notebookId", profile.notebookId());
    writeOptional(gen, "notebookName", metadata.notebookName());
    writeOptional(gen, "workspaceId", metadata.workspaceId());
    writeOptional(gen, "workspaceName", metadata.workspaceName());
    writeOptional(gen, "sparkApplicationId", metadata.sparkApplicationId());
    writeOptional(gen, "appUrl", metadata.appUrl());
    writeOptional(gen, "startTime", profile.startTime().map(Object::toString));
    gen.writeStringField("status", profile.status());
    gen.writeBooleanField("hasExternalActivity", profile.hasExternalActivity());
    gen.writeNumberField("parseWarnings", profile.parseWarnings());

    gen.writeArrayFieldStart("connections");
    for (ClassifiedConnection connection : profile.connections()) {
      gen.writeStartObject();
      gen.writeStringField("host", connection.host());
      if (connection.reference().port().isPresent()) {
        gen.writeNumberField("port", connection.reference().port().get());
      } else {
        gen.writeNullField("port");
      }
      writeOptional(gen, "scheme", connection.reference().scheme());
      gen.writeBooleanField("trusted", connection.trusted());
      writeOptional(gen, "matchedPattern", connection.matchedPattern().map(Object::toString));
      gen.writeNumberField("occurrences", connection.occurrences());
      gen.writeStringField("streamKind", connection.reference().streamKind().label());
      gen.writeNumberField("lineNumber", connection.reference().lineNumber());
      gen.writeStringField("rawLine", connection.reference().rawLine());
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("packageInstalls");
    for (PackageInstallCommand install : profile.packageInstalls()) {
      gen.writeStartObject();
      gen.writeStringField("manager", install.manager().name().toLowerCase(Locale.ROOT));
      gen.writeArrayFieldStart("packages");
      for (String name : install.packages()) {
        gen.writeString(name);
      }
      gen.writeEndArray();
      gen.writeStringField("rawCommand", install.rawCommand());
      gen.writeStringField("streamKind", install.streamKind().label());
      gen.writeNumberField("lineNumber", install.lineNumber());
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("loggingChanges");
    for (LoggingConfigChange change : profile.loggingChanges()) {
      gen.writeStartObject();
      gen.writeStringField("configKeyHint", change.configKeyHint());
      gen.writeBooleanField("disablesLogging", change.disablesLogging());
      gen.writeStringField("rawLine", change.rawLine());
      gen.writeStringField("streamKind", change.streamKind().label());
      gen.writeNumberField("lineNumber", change.lineNumber());
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("warnings");
    for (String warning : profile.warnings()) {
      gen.writeString(warning);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeOptional(JsonGenerator gen, String field, Optional<String> value) throws IOException {
    if (value.isPresent()) {
      gen.writeStringField(field, value.get());
    } else {
      gen.writeNullField(field);
    }
  }
}
