/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.core.Services;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates module lifecycle and exposes module state.
 *
 * <p>Requested modules are ordered by their dependencies, then every module is set up, then every
 * module is started. A module that throws is marked {@link ModuleState#FAILED}, rolled back and
 * isolated: modules depending on it are not started, every other module continues. Shutdown runs
 * in reverse start order and never stops on a failing module.
 */
public final class ModuleManager implements AutoCloseable, ModuleStateView {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final Services services;
  private final Map<String, VitalisModule> modules = new LinkedHashMap<>();
  private final Map<String, ModuleState> states = new HashMap<>();
  private final Map<String, String> reasons = new HashMap<>();
  private final Map<String, ModuleContext> contexts = new HashMap<>();
  private final List<VitalisModule> startOrder = new ArrayList<>();
  private boolean started;

  public ModuleManager(Services services) {
    this.services = Objects.requireNonNull(services, "services");
  }

  /**
   * Registers a module instance ahead of {@link #start}. Requested identifiers without a registered
   * instance are created from {@link ModuleRegistry}.
   */
  public synchronized void register(VitalisModule module) {
    Objects.requireNonNull(module, "module");
    if (started) {
      throw new IllegalStateException("modules already started");
    }
    if (modules.putIfAbsent(module.id(), module) != null) {
      throw new IllegalArgumentException("Duplicate module id: " + module.id());
    }
    states.put(module.id(), ModuleState.REGISTERED);
  }

  /**
   * Sets up and starts the requested module identifiers.
   *
   * @throws ModuleCycleException when dependencies form a cycle; nothing has been started then
   * @throws IllegalArgumentException for identifiers that are neither registered nor built in
   */
  public synchronized void start(Set<String> requested) {
    if (started) {
      throw new IllegalStateException("modules already started");
    }
    Objects.requireNonNull(requested, "requested");

    List<VitalisModule> selected = new ArrayList<>();
    for (String id : requested) {
      if (!modules.containsKey(id)) {
        register(newModuleInstance(id));
      }
      selected.add(modules.get(id));
    }
    List<VitalisModule> ordered = ModuleGraph.order(selected);
    started = true;

    for (VitalisModule module : ordered) {
      String blocker = blockingDependency(module, ModuleState.SETUP);
      if (blocker != null) {
        isolate(module, blocker, false);
        continue;
      }
      try {
        module.setup(context(module));
        states.put(module.id(), ModuleState.SETUP);
      } catch (Exception e) {
        fail(module, "setup", e);
      }
    }

    for (VitalisModule module : ordered) {
      if (states.get(module.id()) != ModuleState.SETUP) {
        continue;
      }
      String blocker = blockingDependency(module, ModuleState.ACTIVE);
      if (blocker != null) {
        isolate(module, blocker, true);
        continue;
      }
      try {
        ModuleActivation activation = module.start(context(module));
        if (activation.isActivated()) {
          states.put(module.id(), ModuleState.ACTIVE);
          startOrder.add(module);
          LOG.info("(vitalis) module '{}' started", module.id());
        } else {
          String reason = activation.reason();
          reasons.put(module.id(), reason);
          rollback(module);
          states.put(module.id(), ModuleState.SKIPPED);
          LOG.info("(vitalis) module '{}' skipped: {}", module.id(), reason);
        }
      } catch (Exception e) {
        fail(module, "start", e);
      }
    }
  }

  private VitalisModule newModuleInstance(String id) {
    return ModuleRegistry.create(id)
        .orElseThrow(() -> new IllegalArgumentException("Unknown module id: " + id));
  }

  private ModuleContext context(VitalisModule module) {
    return contexts.computeIfAbsent(module.id(), id -> new ModuleContext(id, services, this));
  }

  /** First dependency that has not reached {@code required}, or null. */
  private String blockingDependency(VitalisModule module, ModuleState required) {
    for (String dependency : module.dependencies()) {
      if (states.get(dependency) != required) {
        return dependency;
      }
    }
    return null;
  }

  private void isolate(VitalisModule module, String dependency, boolean rollback) {
    ModuleState dependencyState = states.get(dependency);
    if (rollback) {
      rollback(module);
    }
    if (dependencyState == ModuleState.SKIPPED) {
      String reason = "dependency '" + dependency + "' skipped";
      reasons.put(module.id(), reason);
      states.put(module.id(), ModuleState.SKIPPED);
      LOG.info("(vitalis) module '{}' skipped: {}", module.id(), reason);
      return;
    }
    String reason =
        dependencyState == null
            ? "dependency '" + dependency + "' not enabled"
            : "dependency '" + dependency + "' failed";
    reasons.put(module.id(), reason);
    states.put(module.id(), ModuleState.FAILED);
    LOG.warn(
        "(vitalis) code={} op={} module={} message={}",
        ErrorCode.MODULE_LIFECYCLE_FAILED,
        "module.dependency",
        module.id(),
        reason);
  }

  private void fail(VitalisModule module, String phase, Exception e) {
    reasons.put(module.id(), phase + " failed: " + e.getMessage());
    states.put(module.id(), ModuleState.FAILED);
    LOG.error(
        "(vitalis) code={} op={} module={} message={}",
        ErrorCode.MODULE_LIFECYCLE_FAILED,
        "module." + phase,
        module.id(),
        e.getMessage(),
        e);
    rollback(module);
  }

  private void rollback(VitalisModule module) {
    try {
      module.shutdown(context(module));
    } catch (Exception suppressed) {
      LOG.debug(
          "(vitalis) module '{}' cleanup issue: {}",
          module.id(),
          suppressed.getMessage(),
          suppressed);
    }
    services.registry().clearOwner(module.id());
  }

  @Override
  public synchronized void close() {
    List<VitalisModule> shutdownOrder = new ArrayList<>(startOrder);
    Collections.reverse(shutdownOrder);
    for (VitalisModule module : shutdownOrder) {
      try {
        module.shutdown(context(module));
      } catch (Exception e) {
        LOG.warn(
            "(vitalis) code={} op={} module={} message={}",
            ErrorCode.MODULE_LIFECYCLE_FAILED,
            "module.shutdown",
            module.id(),
            e.getMessage(),
            e);
      }
      services.registry().clearOwner(module.id());
      states.put(module.id(), ModuleState.STOPPED);
      LOG.info("(vitalis) module '{}' stopped", module.id());
    }
    startOrder.clear();
  }

  @Override
  public synchronized boolean isActive(String moduleId) {
    return states.get(moduleId) == ModuleState.ACTIVE;
  }

  @Override
  public synchronized Set<String> activeModules() {
    Set<String> active = new LinkedHashSet<>();
    for (VitalisModule module : startOrder) {
      active.add(module.id());
    }
    return Collections.unmodifiableSet(active);
  }

  @Override
  public synchronized Optional<ModuleState> state(String moduleId) {
    return Optional.ofNullable(states.get(moduleId));
  }

  /** Why a module was skipped or failed. */
  public synchronized Optional<String> reason(String moduleId) {
    return Optional.ofNullable(reasons.get(moduleId));
  }

  @Override
  public <T> Optional<T> service(Class<T> type) {
    return services.registry().find(type);
  }
}
