package io.github.pathfind.cli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts logging from command line flags.
 */
public final class LoggingConfigurator {

  /**
   * Logger raised by {@link #enableVerboseLogging()}.
   */
  public static final String PATHFIND_LOGGER = "io.github.pathfind";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
  }

  /**
   * Log pathfind's own messages at DEBUG.
   */
  public static void enableVerboseLogging() {
    final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext) {
      final Logger logger = ((LoggerContext) factory).getLogger(PATHFIND_LOGGER);
      logger.setLevel(Level.DEBUG);
      log.debug("verbose logging enabled");
      return;
    }
    log.warn("Verbose logging requested but {} doesn't support changing levels", factory.getClass().getName());
  }
}
