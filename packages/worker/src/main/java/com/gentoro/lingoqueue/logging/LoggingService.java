package com.gentoro.lingoqueue.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying log levels from configuration.
 *
 * <p>Levels are read from {@code logging.level} (root logger) and {@code logging.levels.<name>}
 * (individual loggers, e.g. {@code logging.levels.com.gentoro.lingoqueue.queue: DEBUG}).
 */
public final class LoggingService {
  private static final String ROOT_KEY = "logging.level";
  private static final String LOGGERS_PREFIX = "logging.levels";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    String rootLevel = configuration.getString(ROOT_KEY, null);
    if (rootLevel != null && !rootLevel.isBlank()) {
      context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(rootLevel.trim(), Level.INFO));
    }

    Configuration levels = configuration.subset(LOGGERS_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String level = levels.getString(name, null);
      if (level != null && !level.isBlank()) {
        context.getLogger(name).setLevel(Level.toLevel(level.trim(), Level.INFO));
      }
    }
  }
}
