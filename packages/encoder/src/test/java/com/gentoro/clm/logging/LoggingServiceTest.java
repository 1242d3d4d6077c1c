package com.gentoro.clm.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static final String NAME = "com.gentoro.clm.logging.sample";

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final Level rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

  @AfterEach
  void restore() {
    context.getLogger(NAME).setLevel(null);
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
  }

  @Test
  void testApplyConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level." + NAME, "debug");
    config.setProperty("logging.level.root", "ERROR");
    config.setProperty("clm.language", "en");

    LoggingService.applyConfiguration(config);

    assertEquals(Level.DEBUG, context.getLogger(NAME).getLevel());
    assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
  }

  @Test
  void testUnknownLevelFallsBackToInfo() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level." + NAME, "chatty");

    LoggingService.applyConfiguration(config);

    assertEquals(Level.INFO, context.getLogger(NAME).getLevel());
  }

  @Test
  void testNullConfiguration() {
    LoggingService.applyConfiguration(null);

    assertNull(context.getLogger(NAME).getLevel());
  }

  @Test
  void testGetLogger() {
    org.slf4j.Logger logger = LoggingService.getLogger(LoggingServiceTest.class);

    assertEquals(LoggingServiceTest.class.getName(), logger.getName());
  }
}
