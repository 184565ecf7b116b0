package ca.gc.cra.pglo.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Runtime adjustments to the Logback configuration.
 *
 * @since PGLO 0.1-doc
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG, which turns on per-call traces for handles and scopes.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
      return;
    }
    log.warn("Cannot enable verbose logging on {}", factory.getClass().getName());
  }

  /**
   * Reports the effective root level.
   *
   * @return level name, or {@code null} without Logback
   */
  public static String rootLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      return root.getEffectiveLevel().toString();
    }
    return null;
  }
}
