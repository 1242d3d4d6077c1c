package com.gentoro.clm.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single access point for loggers. Levels declared under {@code logging.level.*} in the
 * application configuration are pushed into the Logback context on start-up.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.root} and {@code logging.level.<logger-name>} entries.
   *
   * @param configuration the application configuration, may be null
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      // Another SLF4J backend is bound; nothing to adjust.
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      if (value == null || value.isBlank()) {
        continue;
      }
      String loggerName = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }
  }
}
