package ca.gc.cra.warden.infrastructure.bundle;

import ca.gc.cra.warden.application.port.LogBundleSource;
import ca.gc.cra.warden.domain.log.LogBundle;
import ca.gc.cra.warden.domain.log.RawLogFile;
import ca.gc.cra.warden.domain.log.SessionMetadata;
import ca.gc.cra.warden.domain.log.StreamKind;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LogBundleSource} reading the consolidated JSON index written by the
 * session-log download step.
 * <p><strong>Why:</strong> The download step leaves one index plus per-session Livy, stdout and stderr
 * files on disk; this adapter turns them into {@link LogBundle}s.</p>
 * <p><strong>Role:</strong> Driven adapter on the input side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse {@code metadata} and {@code log_summaries} with the Jackson streaming API.</li>
 *   <li>Infer stream kinds from file names and resolve relative paths against the index directory.</li>
 *   <li>Record unreadable or unrecognized files as bundle retrieval warnings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; {@link #load()} may be invoked repeatedly.</p>
 * <p><strong>Observability:</strong> Logs skipped entries at WARN and file reads at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class ConsolidatedLogIndexReader implements LogBundleSource {
  private static final Logger log = LoggerFactory.getLogger(ConsolidatedLogIndexReader.class);

  private static final List<Function<String, Instant>> TIMESTAMP_FORMATS = List.of(
      Instant::parse,
      value -> OffsetDateTime.parse(value).toInstant(),
      value -> LocalDateTime.parse(value.replace(' ', 'T')).toInstant(ZoneOffset.UTC));

  private final JsonFactory factory = new JsonFactory();
  private final Path indexFile;

  /**
   * Creates a reader for the given index.
   *
   * @param indexFile consolidated index JSON
   */
  public ConsolidatedLogIndexReader(Path indexFile) {
    this.indexFile = Objects.requireNonNull(indexFile, "indexFile");
  }

  /**
   * Reads the index and every referenced log file.
   *
   * @return bundles in index order
   * @throws IOException when the index cannot be read or is not valid JSON
   * @throws IllegalArgumentException when the index lacks a {@code log_summaries} array
   */
  @Override
  public List<LogBundle> load() throws IOException {
    Map<String, Object> root = readIndex();
    Map<String, Object> metadata = asMap(root.get("metadata"));
    Object summaries = root.get("log_summaries");
    if (!(summaries instanceof List<?> entries)) {
      throw new IllegalArgumentException("log index " + indexFile + " has no log_summaries array");
    }
    Path baseDir = indexFile.toAbsolutePath().getParent();
    List<LogBundle> bundles = new ArrayList<>(entries.size());
    int position = 0;
    for (Object entry : entries) {
      position++;
      Map<String, Object> summary = asMap(entry);
      Optional<String> sessionId = text(summary, "livy_id");
      if (sessionId.isEmpty()) {
        log.warn("Skipping log summary #{} in {}: no livy_id", position, indexFile);
        continue;
      }
      bundles.add(toBundle(sessionId.get(), summary, metadata, baseDir));
    }
    return List.copyOf(bundles);
  }

  private LogBundle toBundle(
      String sessionId, Map<String, Object> summary, Map<String, Object> indexMetadata, Path baseDir) {
    List<String> warnings = new ArrayList<>();
    Optional<Instant> startTime = firstTimestamp(summary, "start_time", "submit_time", "download_timestamp");
    SessionMetadata metadata = new SessionMetadata(
        sessionId,
        text(summary, "notebook_id").orElse(""),
        text(summary, "notebook_name"),
        text(summary, "workspace_id").or(() -> text(indexMetadata, "workspace_id")),
        text(summary, "workspace_name").or(() -> text(indexMetadata, "workspace_name")),
        text(summary, "spark_application_id"),
        text(summary, "app_url"),
        startTime,
        text(summary, "state").or(() -> text(summary, "status")).orElse(""));

    Map<StreamKind, RawLogFile> streams = new EnumMap<>(StreamKind.class);
    for (Path file : listedFiles(summary, baseDir, warnings)) {
      Optional<StreamKind> kind = StreamKind.fromFileName(file.getFileName().toString());
      if (kind.isEmpty()) {
        warnings.add("unrecognized log file " + file.getFileName());
        continue;
      }
      if (streams.containsKey(kind.get())) {
        warnings.add("duplicate " + kind.get().label() + " file " + file.getFileName() + " ignored");
        continue;
      }
      try {
        byte[] bytes = Files.readAllBytes(file);
        // String(byte[], UTF_8) substitutes malformed input
        streams.put(kind.get(), new RawLogFile(sessionId, kind.get(), new String(bytes, StandardCharsets.UTF_8)));
        log.debug("Read {} bytes of {} log for session {}", bytes.length, kind.get().label(), sessionId);
      } catch (IOException ex) {
        warnings.add(kind.get().label() + " file unreadable: " + file + " (" + ex.getClass().getSimpleName() + ")");
      }
    }
    return new LogBundle(metadata, streams, warnings);
  }

  private List<Path> listedFiles(Map<String, Object> summary, Path baseDir, List<String> warnings) {
    List<Path> files = new ArrayList<>();
    Object listed = summary.get("downloaded_files");
    if (listed instanceof List<?> names) {
      for (Object name : names) {
        if (name == null || name.toString().isBlank()) {
          continue;
        }
        resolve(baseDir, name.toString()).ifPresentOrElse(files::add,
            () -> warnings.add("invalid log file path " + name));
      }
      return files;
    }
    Optional<Path> tempDir = text(summary, "temp_directory").flatMap(dir -> resolve(baseDir, dir));
    if (tempDir.isPresent() && Files.isDirectory(tempDir.get())) {
      try (Stream<Path> entries = Files.list(tempDir.get())) {
        entries.filter(Files::isRegularFile).sorted().forEach(files::add);
      } catch (IOException ex) {
        warnings.add("log directory unreadable: " + tempDir.get());
      }
    } else {
      warnings.add("no log files listed");
    }
    return files;
  }

  private static Optional<Path> resolve(Path baseDir, String raw) {
    try {
      Path path = Path.of(raw);
      if (!path.isAbsolute() && baseDir != null) {
        path = baseDir.resolve(path);
      }
      return Optional.of(path.normalize());
    } catch (InvalidPathException ex) {
      return Optional.empty();
    }
  }

  private static Optional<Instant> firstTimestamp(Map<String, Object> summary, String... keys) {
    for (String key : keys) {
      Optional<Instant> parsed = text(summary, key).flatMap(ConsolidatedLogIndexReader::parseInstant);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return Optional.empty();
  }

  /**
   * Accepts ISO-8601 instants, offset date-times and zone-less local date-times (read as UTC).
   *
   * @param raw timestamp text
   * @return parsed instant, or empty when unparseable
   */
  static Optional<Instant> parseInstant(String raw) {
    String value = raw.trim();
    for (Function<String, Instant> format : TIMESTAMP_FORMATS) {
      try {
        return Optional.of(format.apply(value));
      } catch (DateTimeParseException ex) {
        log.trace("Timestamp '{}' not in format: {}", value, ex.getMessage());
      }
    }
    log.debug("Unparseable timestamp '{}'", value);
    return Optional.empty();
  }

  private static Optional<String> text(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  private static Map<String, Object> asMap(Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return copy;
  }

  private Map<String, Object> readIndex() throws IOException {
    try (InputStream in = Files.newInputStream(indexFile);
        JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("log index " + indexFile + " must be a JSON object");
      }
      return readObject(parser);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
