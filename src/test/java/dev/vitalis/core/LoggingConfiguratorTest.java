/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {
  @Test
  void appliesConfiguredLogLevel() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.INFO);

    LogbackConfigurator.configure(context, new Config.Log(false, "DEBUG"));
    assertEquals(Level.DEBUG, root.getLevel());

    LogbackConfigurator.configure(context, new Config.Log(false, "error"));
    assertEquals(Level.ERROR, root.getLevel());

    context.stop();
  }

  @Test
  void unknownLevelFallsBackToInfo() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.WARN);

    LogbackConfigurator.configure(context, new Config.Log(false, "chatty"));
    assertEquals(Level.INFO, root.getLevel());

    context.stop();
  }

  @Test
  void reconfiguringReplacesTheConsoleAppender() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    LogbackConfigurator.configure(context, new Config.Log(false, "INFO"));
    var plain = root.getAppender(LogbackConfigurator.CONSOLE_APPENDER);
    assertNotNull(plain);

    LogbackConfigurator.configure(context, new Config.Log(true, "INFO"));
    var json = root.getAppender(LogbackConfigurator.CONSOLE_APPENDER);
    assertInstanceOf(ConsoleAppender.class, json);
    var encoder = ((ConsoleAppender<ILoggingEvent>) json).getEncoder();
    assertInstanceOf(LayoutWrappingEncoder.class, encoder);
    assertInstanceOf(
        VitalisJsonLayout.class, ((LayoutWrappingEncoder<ILoggingEvent>) encoder).getLayout());

    context.stop();
  }

  @Test
  void nullSettingsAreIgnored() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.WARN);

    LogbackConfigurator.configure(context, null);
    assertEquals(Level.WARN, root.getLevel());
    assertNull(root.getAppender(LogbackConfigurator.CONSOLE_APPENDER));

    context.stop();
  }

  @Test
  void replacesEveryConsoleAppenderSoEventsPrintOnce() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    ConsoleAppender<ILoggingEvent> fromXml = new ConsoleAppender<>();
    fromXml.setName("STDOUT");
    fromXml.setContext(context);
    root.addAppender(fromXml);
    ListAppender<ILoggingEvent> capture = new ListAppender<>();
    capture.setName("capture");
    capture.setContext(context);
    capture.start();
    root.addAppender(capture);

    LogbackConfigurator.configure(context, new Config.Log(false, "INFO"));
    LogbackConfigurator.configure(context, new Config.Log(true, "INFO"));

    assertNull(root.getAppender("STDOUT"));
    assertFalse(fromXml.isStarted());
    List<String> names = new ArrayList<>();
    root.iteratorForAppenders().forEachRemaining(a -> names.add(a.getName()));
    assertEquals(List.of("capture", LogbackConfigurator.CONSOLE_APPENDER), names);

    context.stop();
  }

  @Test
  void poolLoggerStaysQuietUnlessVitalisIsQuieter() {
    LoggerContext context = new LoggerContext();
    context.start();

    LogbackConfigurator.configure(context, new Config.Log(false, "DEBUG"));
    assertEquals(Level.WARN, context.getLogger(LogbackConfigurator.POOL_LOGGER).getLevel());

    LogbackConfigurator.configure(context, new Config.Log(false, "ERROR"));
    assertEquals(Level.ERROR, context.getLogger(LogbackConfigurator.POOL_LOGGER).getLevel());

    context.stop();
  }

  @Test
  void missingSettingsAreNotApplied() {
    assertFalse(LoggingConfigurator.configure(null));
  }
}
