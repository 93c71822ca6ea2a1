package ca.gc.cra.ftrace.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels from command-line flags.
 *
 * <p>Only Logback supports the runtime change; other SLF4J bindings keep their configured levels and a warning is
 * logged.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /** Raises the root logger to DEBUG for {@code --verbose}. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Returns the current root level name, or {@code null} when the binding is not Logback.
   *
   * @return level name such as {@code INFO}
   */
  public static String rootLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Level level = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
      return level == null ? null : level.toString();
    }
    return null;
  }

  static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Cannot change log level; backend {} does not support it", factory.getClass().getName());
  }
}
