/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import dev.vitalis.api.events.VitalsEvents;
import dev.vitalis.core.config.ConfigStore;
import dev.vitalis.core.storage.SqliteWorldStorage;
import dev.vitalis.core.world.StorageOpener;
import dev.vitalis.core.world.WorldRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires together the shared services and owns their executors. */
public final class CoreServices implements Services {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  /** Owner id for services published by the core itself. */
  public static final String CORE_OWNER = "core";

  private final Config config;
  private final ConfigStore configs;
  private final WorldRegistry worlds;
  private final ServiceRegistry registry;
  private final EventBus events;
  private final ExecutorService io;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  private CoreServices(
      Config config,
      ConfigStore configs,
      WorldRegistry worlds,
      ServiceRegistry registry,
      EventBus events,
      ExecutorService io) {
    this.config = config;
    this.configs = configs;
    this.worlds = worlds;
    this.registry = registry;
    this.events = events;
    this.io = io;
  }

  /**
   * Starts core services with SQLite-backed world storage.
   *
   * @param cfg core configuration
   * @param configs store holding module documents
   * @return service container
   */
  public static Services start(Config cfg, ConfigStore configs) {
    return start(cfg, configs, worldId -> SqliteWorldStorage.open(worldId, cfg.storage()));
  }

  /**
   * Starts core services with a custom storage opener.
   *
   * @param cfg core configuration
   * @param configs store holding module documents
   * @param opener opens a world's storage on first use
   * @return service container
   */
  public static Services start(Config cfg, ConfigStore configs, StorageOpener opener) {
    EventBus events = new EventBus();
    ExecutorService io = Executors.newFixedThreadPool(cfg.runtime().ioThreads(), ioThreads());
    WorldRegistry worlds = new WorldRegistry(opener);
    ServiceRegistry registry = new ServiceRegistry();
    registry.publish(CORE_OWNER, ConfigStore.class, configs);
    registry.publish(CORE_OWNER, WorldRegistry.class, worlds);
    registry.publish(CORE_OWNER, VitalsEvents.class, events);
    LOG.info(
        "(vitalis) core services started dataDir={} ioThreads={}",
        cfg.storage().dataDir(),
        cfg.runtime().ioThreads());
    return new CoreServices(cfg, configs, worlds, registry, events, io);
  }

  private static ThreadFactory ioThreads() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "vitalis-io-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  @Override
  public Config config() {
    return config;
  }

  @Override
  public ConfigStore configs() {
    return configs;
  }

  @Override
  public WorldRegistry worlds() {
    return worlds;
  }

  @Override
  public ServiceRegistry registry() {
    return registry;
  }

  @Override
  public EventBus events() {
    return events;
  }

  @Override
  public ExecutorService ioExecutor() {
    return io;
  }

  @Override
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    try {
      worlds.close();
    } catch (RuntimeException e) {
      LOG.warn("(vitalis) world shutdown issue: {}", e.getMessage(), e);
    }
    io.shutdown();
    try {
      if (!io.awaitTermination(config.runtime().flushTimeoutMs(), TimeUnit.MILLISECONDS)) {
        LOG.warn(
            "(vitalis) io executor did not drain within {}ms; abandoning pending writes",
            config.runtime().flushTimeoutMs());
        io.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      io.shutdownNow();
    }
    events.close();
    registry.clearOwner(CORE_OWNER);
    LOG.info("(vitalis) core services stopped");
  }
}
