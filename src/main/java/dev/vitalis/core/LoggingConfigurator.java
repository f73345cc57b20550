/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code core.log} block at boot and on every reload of {@code vitalis.json5}.
 *
 * <p>Only Logback is reconfigured. A host that binds SLF4J to another backend keeps its own setup
 * and the block is ignored.
 */
public final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private LoggingConfigurator() {}

  /**
   * @return {@code true} when the settings were applied to the running backend
   */
  public static boolean configure(Config.Log settings) {
    if (settings == null) {
      return false;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      LOG.debug("(vitalis) log settings ignored; backend is {}", factory.getClass().getName());
      return false;
    }
    try {
      LogbackConfigurator.configure((LoggerContext) factory, settings);
    } catch (RuntimeException e) {
      LOG.warn("(vitalis) op={} message={}", "log.configure", e.getMessage(), e);
      return false;
    }
    LOG.info("(vitalis) logging level={} json={}", settings.level(), settings.json());
    return true;
  }
}
