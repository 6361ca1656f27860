package ca.gc.cra.warden.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import java.util.Set;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts WARDEN's own log verbosity for CLI-driven runs.
 * <p><strong>Role:</strong> Adapter-side utility that bridges the {@code --verbose} flag and the
 * {@code logLevel} setting to the Logback root logger.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root level from configuration text such as {@code warn}.
   *
   * @param level level name, case-insensitive; blank leaves the current level untouched
   * @throws IllegalArgumentException when the name is not a Logback level
   */
  public static void applyLevel(String level) {
    if (level == null || level.isBlank()) {
      return;
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    if (!LEVELS.contains(normalized)) {
      throw new IllegalArgumentException("logLevel must be one of " + LEVELS + " (was " + level.trim() + ")");
    }
    applyRootLevel(Level.toLevel(normalized));
  }

  private static void applyRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
