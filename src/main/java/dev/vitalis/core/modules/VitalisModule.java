/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import java.util.List;

/**
 * Defines a Vitalis runtime module. Modules encapsulate optional subsystems such as the player
 * directory or the metabolism simulation and run through three phases driven by {@link
 * ModuleManager}: {@code setup} and {@code start} in dependency order, {@code shutdown} in reverse.
 */
public interface VitalisModule {
  /**
   * Unique stable identifier for this module, lower-case (for example {@code "metabolism"}).
   *
   * @return module identifier
   */
  String id();

  /**
   * Identifiers of modules that must be active before this one starts.
   *
   * @return dependency identifiers, empty by default
   */
  default List<String> dependencies() {
    return List.of();
  }

  /**
   * Allocates resources. Must not call other modules.
   *
   * @param context module execution context
   * @throws Exception if setup fails; the module is isolated and its dependents are skipped
   */
  default void setup(ModuleContext context) throws Exception {}

  /**
   * Starts the module. Implementations register listeners and publish services here. Modules that
   * decline activation return {@link ModuleActivation#skipped(String)} with a human-readable
   * reason.
   *
   * @param context module execution context
   * @return activation result signalling whether the module is active
   * @throws Exception if startup fails; the module is isolated and other modules continue
   */
  ModuleActivation start(ModuleContext context) throws Exception;

  /**
   * Releases resources and unregisters listeners. Also called to roll back a failed {@code setup}
   * or {@code start}, so implementations must tolerate partially initialised state.
   *
   * @param context module execution context
   * @throws Exception if cleanup fails; the failure is logged and shutdown continues
   */
  void shutdown(ModuleContext context) throws Exception;
}
