package ca.gc.cra.mimetic.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI-driven sessions.
 * <p><strong>Why:</strong> Operators tuning a live session need DEBUG output (dropped frames, per-send
 * outcomes) without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger level to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, e.g. {@code ca.gc.cra.mimetic.application.pipeline}
   * @param level level name; unknown names fall back to DEBUG as Logback does
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      Level requested = Level.toLevel(level, Level.DEBUG);
      if (!requested.equals(target.getLevel())) {
        target.setLevel(requested);
      }
      return true;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
