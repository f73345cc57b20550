/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Rebuilds the console output of a Logback context from {@link Config.Log}.
 *
 * <p>The root level follows {@code level}; the shared {@code "vitalis"} logger inherits it. Every
 * console appender on the root (including the one from {@code logback.xml}) is replaced by a single
 * {@value #CONSOLE_APPENDER} appender, so each event is printed exactly once. Hikari stays at WARN
 * unless Vitalis itself is quieter.
 */
final class LogbackConfigurator {
  static final String CONSOLE_APPENDER = "vitalis-console";
  static final String POOL_LOGGER = "com.zaxxer.hikari";
  private static final String PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LogbackConfigurator() {}

  static void configure(LoggerContext context, Config.Log settings) {
    if (context == null || settings == null) {
      return;
    }
    Level level = Level.toLevel(normalized(settings.level()), Level.INFO);
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(level);
    Level poolLevel = level.isGreaterOrEqual(Level.WARN) ? level : Level.WARN;
    context.getLogger(POOL_LOGGER).setLevel(poolLevel);

    for (Appender<ILoggingEvent> console : consoleAppenders(root)) {
      root.detachAppender(console);
      console.stop();
    }
    Encoder<ILoggingEvent> encoder =
        settings.json() ? jsonEncoder(context) : patternEncoder(context);
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    console.setEncoder(encoder);
    console.start();
    root.addAppender(console);
  }

  private static String normalized(String level) {
    return level == null ? "" : level.trim().toUpperCase(Locale.ROOT);
  }

  private static List<Appender<ILoggingEvent>> consoleAppenders(Logger root) {
    List<Appender<ILoggingEvent>> found = new ArrayList<>();
    for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); ) {
      Appender<ILoggingEvent> appender = it.next();
      if (appender instanceof ConsoleAppender || CONSOLE_APPENDER.equals(appender.getName())) {
        found.add(appender);
      }
    }
    return found;
  }

  private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();
    return encoder;
  }

  private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
    VitalisJsonLayout layout = new VitalisJsonLayout();
    layout.setContext(context);
    layout.start();
    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }
}
