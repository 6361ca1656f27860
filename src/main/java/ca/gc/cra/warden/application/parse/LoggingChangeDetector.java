package ca.gc.cra.warden.application.parse;

import ca.gc.cra.warden.domain.events.LoggingConfigChange;
import ca.gc.cra.warden.domain.log.StreamKind;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes runtime logging reconfiguration (Python {@code logging}, log4j properties, Spark log level).
 */
final class LoggingChangeDetector {
  private static final List<String> MARKERS = List.of(
      "logging.basicConfig",
      "logging.disable",
      "dictConfig",
      "fileConfig",
      "Configurator.setRootLevel",
      "Configurator.setAllLevels",
      "Configurator.setLevel",
      "setLogLevel",
      "setLevel",
      "addHandler",
      "removeHandler",
      "log4j.rootLogger",
      "log4j.rootCategory",
      "log4j.logger.",
      "rootLogger.level",
      "spark.sql.adaptive.logLevel",
      "spark.log.level");
  private static final Pattern MARKER = Pattern.compile(
      MARKERS.stream().map(Pattern::quote).reduce((a, b) -> a + "|" + b).orElseThrow());
  private static final Pattern DISABLING = Pattern.compile(
      "(?i)\\b(off|disable|disabled|none|critical|fatal|false)\\b");
  // Only level-bearing positions count: call arguments, level keywords, property values.
  private static final Pattern CALL_LEVEL = Pattern.compile(
      "(?i)\\b(?:disable|setLevel|setLogLevel|setRootLevel|setAllLevels)\\s*\\(([^)]*)\\)");
  private static final Pattern KEYWORD_LEVEL = Pattern.compile(
      "(?i)\\blevel[\"']?\\s*[=:]\\s*[\"']?([\\w.]+)");
  private static final Pattern PROPERTY_LEVEL = Pattern.compile(
      "(?i)(?:rootLogger\\.level|rootLogger|rootCategory|log4j\\.logger\\.[\\w.$-]+|spark\\.log\\.level"
          + "|spark\\.sql\\.adaptive\\.logLevel)\\s*[=:]\\s*([\\w.]+)");
  private static final Pattern NUMERIC_LEVEL = Pattern.compile("\\d{1,4}");
  private static final int PYTHON_CRITICAL = 50;
  // Spark prints this hint on every driver start; it is not a configuration change.
  private static final String SPARK_HINT = "To adjust logging level use";

  Optional<LoggingConfigChange> detect(
      String line, String sanitizedLine, int lineNumber, StreamKind streamKind) {
    if (line.contains(SPARK_HINT)) {
      return Optional.empty();
    }
    Matcher marker = MARKER.matcher(line);
    if (!marker.find()) {
      return Optional.empty();
    }
    String tail = line.substring(marker.start());
    boolean disables = disablesLogging(tail);
    return Optional.of(
        new LoggingConfigChange(sanitizedLine, marker.group(), disables, lineNumber, streamKind));
  }

  private static boolean disablesLogging(String text) {
    Matcher call = CALL_LEVEL.matcher(text);
    while (call.find()) {
      String arguments = call.group(1).trim();
      // logging.disable() with no argument defaults to CRITICAL
      if (arguments.isEmpty() && call.group().regionMatches(true, 0, "disable", 0, 7)) {
        return true;
      }
      if (isDisablingLevel(arguments)) {
        return true;
      }
    }
    Matcher keyword = KEYWORD_LEVEL.matcher(text);
    while (keyword.find()) {
      if (isDisablingLevel(keyword.group(1))) {
        return true;
      }
    }
    Matcher property = PROPERTY_LEVEL.matcher(text);
    while (property.find()) {
      if (isDisablingLevel(property.group(1))) {
        return true;
      }
    }
    return false;
  }

  private static boolean isDisablingLevel(String value) {
    String trimmed = value.trim();
    if (NUMERIC_LEVEL.matcher(trimmed).matches()) {
      return Integer.parseInt(trimmed) >= PYTHON_CRITICAL;
    }
    return DISABLING.matcher(trimmed).find() && !trimmed.toUpperCase(Locale.ROOT).contains("NOTSET");
  }
}
