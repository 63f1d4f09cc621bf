package io.xrdinfo.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.xrdinfo.config.Verbosity;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI-driven invocations.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} while diagnosing a failing source or
 * gateway, without editing {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility bridging CLI flags to the Logback backend. The core never calls it;
 * client verbosity is passed explicitly through {@link io.xrdinfo.config.ClientSettings}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
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

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    apply(Verbosity.DEBUG);
  }

  /**
   * Maps a client verbosity onto the root logger level.
   *
   * @param verbosity requested verbosity
   */
  public static void apply(Verbosity verbosity) {
    Level level = switch (verbosity) {
      case QUIET -> Level.WARN;
      case NORMAL -> Level.INFO;
      case DEBUG -> Level.DEBUG;
    };
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
