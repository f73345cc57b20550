/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis;

import dev.vitalis.api.ActivitySource;
import dev.vitalis.api.Players;
import dev.vitalis.api.StatSummarySink;
import dev.vitalis.api.StatVector;
import dev.vitalis.api.Vitals;
import dev.vitalis.api.events.VitalsEvents;
import dev.vitalis.core.Config;
import dev.vitalis.core.CoreServices;
import dev.vitalis.core.LoggingConfigurator;
import dev.vitalis.core.Services;
import dev.vitalis.core.config.ConfigStore;
import dev.vitalis.core.modules.ModuleCycleException;
import dev.vitalis.core.modules.ModuleManager;
import dev.vitalis.modules.metabolism.MetabolismService;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vitalis entry point for a host runtime.
 *
 * <p>Boot sequence:
 *
 * <ol>
 *   <li>Load core config (writes the JSON5 template if missing)
 *   <li>Configure logging from the {@code log} block
 *   <li>Start services (world registry, event bus, I/O executor)
 *   <li>Publish the host's activity source and summary sink
 *   <li>Set up and start the enabled modules in dependency order
 * </ol>
 *
 * <p>The host forwards world and player lifecycle through {@link #onWorldAdded}, {@link
 * #onWorldRemoved}, {@link #onPlayerJoin} and {@link #onPlayerLeave}, and calls {@link #close()}
 * when it stops.
 */
public final class VitalisRuntime implements Vitals, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  /** Owner id for services supplied by the host. */
  public static final String HOST_OWNER = "host";

  private final Services services;
  private final ModuleManager modules;
  private final AutoCloseable logReload;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private VitalisRuntime(Services services, ModuleManager modules, AutoCloseable logReload) {
    this.services = services;
    this.modules = modules;
    this.logReload = logReload;
  }

  /**
   * Boots Vitalis with SQLite storage.
   *
   * @param configDir directory holding {@code vitalis.json5} and module documents
   * @param activity per-tick activity classification supplied by the host
   * @param summaries receives human-readable stat summaries
   * @throws ModuleCycleException when module dependencies form a cycle; nothing is left running
   */
  public static VitalisRuntime boot(
      Path configDir, ActivitySource activity, StatSummarySink summaries) {
    LOG.info("(vitalis) booting Vitalis 1.0.0");
    ConfigStore configs = new ConfigStore(configDir);
    Config cfg = Config.load(configs);
    LoggingConfigurator.configure(cfg.log());
    return start(CoreServices.start(cfg, configs), activity, summaries);
  }

  /**
   * Starts modules on already running services. Ownership of {@code services} passes to the
   * runtime.
   */
  public static VitalisRuntime start(
      Services services, ActivitySource activity, StatSummarySink summaries) {
    Objects.requireNonNull(services, "services");
    services.registry().publish(HOST_OWNER, ActivitySource.class, activity);
    services.registry().publish(HOST_OWNER, StatSummarySink.class, summaries);
    AutoCloseable logReload =
        services.configs().onReload(Config.SCHEMA, cfg -> LoggingConfigurator.configure(cfg.log()));

    ModuleManager modules = new ModuleManager(services);
    try {
      modules.start(services.config().modules().enabledIds());
    } catch (RuntimeException e) {
      LOG.error("(vitalis) module boot aborted: {}", e.getMessage());
      modules.close();
      services.shutdown();
      throw e;
    }
    LOG.info("(vitalis) initialized modules={}", modules.activeModules());
    return new VitalisRuntime(services, modules, logReload);
  }

  /** Registers a world loaded by the host. */
  public void onWorldAdded(UUID worldId, String name) {
    services.worlds().getOrCreate(worldId, name);
  }

  /** Tears a world down: final flush of every module, then storage is closed. */
  public void onWorldRemoved(UUID worldId) {
    services.worlds().remove(worldId);
  }

  public void onPlayerJoin(UUID worldId, UUID playerId) {
    services.worlds().playerJoined(worldId, playerId);
  }

  public void onPlayerLeave(UUID worldId, UUID playerId) {
    services.worlds().playerLeft(worldId, playerId);
  }

  @Override
  public Optional<StatVector> getStats(UUID playerId) {
    return metabolism().flatMap(m -> m.getStats(playerId));
  }

  @Override
  public Set<String> getActiveEffects(UUID playerId) {
    return metabolism().map(m -> m.getActiveEffects(playerId)).orElse(Set.of());
  }

  @Override
  public CompletableFuture<Void> forceFlush(UUID worldId) {
    return metabolism()
        .map(m -> m.forceFlush(worldId))
        .orElseGet(() -> CompletableFuture.completedFuture(null));
  }

  /**
   * Adds to (or, when negative, drains) a stat at the next tick of the world.
   *
   * @return {@code false} when metabolism is inactive or the world is unknown
   */
  public boolean restore(UUID worldId, UUID playerId, String stat, double amount) {
    return metabolism().map(m -> m.restore(worldId, playerId, stat, amount)).orElse(false);
  }

  /**
   * @throws IllegalArgumentException for a module id without a config document
   */
  @Override
  public void reloadConfig(String moduleId) {
    if (moduleId == null) {
      services.configs().reloadAll();
      LOG.info("(vitalis) reloaded {}", services.configs().names());
      return;
    }
    services.configs().reload(moduleId);
    LOG.info("(vitalis) reloaded {}", moduleId);
  }

  /** Player directory, when the players module is active. */
  public Optional<Players> players() {
    return services.registry().find(Players.class);
  }

  /** Subscription point for effect transitions. */
  public VitalsEvents events() {
    return services.events();
  }

  public ModuleManager modules() {
    return modules;
  }

  public Services services() {
    return services;
  }

  private Optional<MetabolismService> metabolism() {
    return services.registry().find(MetabolismService.class);
  }

  /** Stops modules in reverse order, then closes every world and the executors. Idempotent. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      logReload.close();
    } catch (Exception e) {
      LOG.debug("(vitalis) reload callback removal failed: {}", e.getMessage());
    }
    try {
      modules.close();
    } finally {
      services.shutdown();
    }
    LOG.info("(vitalis) stopped");
  }
}
