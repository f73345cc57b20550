/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import dev.vitalis.core.Config;
import dev.vitalis.core.Services;
import java.util.Objects;
import java.util.Optional;

/** Execution context handed to one {@link VitalisModule} during lifecycle events. */
public final class ModuleContext {
  private final String moduleId;
  private final Services services;
  private final ModuleStateView modules;

  ModuleContext(String moduleId, Services services, ModuleStateView modules) {
    this.moduleId = Objects.requireNonNull(moduleId, "moduleId");
    this.services = Objects.requireNonNull(services, "services");
    this.modules = Objects.requireNonNull(modules, "modules");
  }

  /** Identifier of the module this context belongs to. */
  public String moduleId() {
    return moduleId;
  }

  /** Returns the core configuration. */
  public Config config() {
    return services.config();
  }

  /** Provides access to the shared service container. */
  public Services services() {
    return services;
  }

  /** Whether another module is currently active. */
  public boolean isModuleActive(String otherId) {
    return modules.isActive(otherId);
  }

  /** Looks up a service published by the core or another module. */
  public <T> Optional<T> service(Class<T> type) {
    return services.registry().find(type);
  }

  /**
   * Publishes a service owned by this module. It is withdrawn automatically when the module fails
   * or stops.
   */
  public <T> void publishService(Class<T> type, T service) {
    services.registry().publish(moduleId, type, service);
  }
}
