/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

/**
 * Application context handed to every module at setup time.
 *
 * <p>Created once at boot by {@link CoreServices#start}; there is no static accessor. Call {@link
 * #shutdown()} after modules stopped to close every world and release executors.
 */
public interface Services {

  /**
   * Core configuration in effect.
   *
   * @return the core configuration
   */
  Config config();

  /**
   * Store for module configuration documents.
   *
   * @return the config store rooted at the config directory
   */
  dev.vitalis.core.config.ConfigStore configs();

  /**
   * Live world contexts.
   *
   * @return the world registry
   */
  dev.vitalis.core.world.WorldRegistry worlds();

  /**
   * Typed service lookup shared by modules.
   *
   * @return the service registry
   */
  ServiceRegistry registry();

  /**
   * Event bus for transitions and other core events.
   *
   * @return the event bus
   */
  EventBus events();

  /**
   * Executor for persistence work so ticks never wait on disk.
   *
   * @return the shared I/O executor
   */
  java.util.concurrent.ExecutorService ioExecutor();

  /** Closes worlds, drains the I/O executor and stops the event bus. Idempotent. */
  void shutdown();
}
