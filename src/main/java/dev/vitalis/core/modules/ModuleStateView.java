/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import java.util.Optional;
import java.util.Set;

/** Read-only view of module states. */
public interface ModuleStateView {
  /** Whether the module identifier is currently active. */
  boolean isActive(String moduleId);

  /** Returns the set of active module identifiers. */
  Set<String> activeModules();

  /** Lifecycle state, empty for unknown identifiers. */
  Optional<ModuleState> state(String moduleId);

  /** Returns an optional published service for the requested type. */
  <T> Optional<T> service(Class<T> type);
}
