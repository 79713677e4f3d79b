package ca.gc.cra.flapline.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts FLAPLINE logging verbosity at runtime from CLI flags.
 * <p><strong>Role:</strong> Adapter-side utility bridging {@code --verbose} to the Logback root logger.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI bootstrap, before workers start.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since FLAPLINE 0.1
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the root logger threshold to DEBUG so channel and pool lifecycle events become visible.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger to the named level.
   *
   * @param levelName Logback level name such as {@code INFO} or {@code TRACE}; unknown names map to DEBUG
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setRootLevel(String levelName) {
    return setRootLevel(Level.toLevel(levelName, Level.DEBUG));
  }

  private static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
