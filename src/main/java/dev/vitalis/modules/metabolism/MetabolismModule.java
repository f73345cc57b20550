/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.ActivitySource;
import dev.vitalis.api.StatSummarySink;
import dev.vitalis.api.StorageException;
import dev.vitalis.api.storage.WorldStorage;
import dev.vitalis.core.Services;
import dev.vitalis.core.modules.ModuleActivation;
import dev.vitalis.core.modules.ModuleContext;
import dev.vitalis.core.modules.VitalisModule;
import dev.vitalis.core.world.WorldContext;
import dev.vitalis.core.world.WorldListener;
import dev.vitalis.modules.players.PlayersModule;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates hunger, thirst and energy (or whatever stats {@code metabolism.json5} defines) per
 * player and world.
 *
 * <p>Each world gets its own {@link MetabolismWorld} when it is registered. Worlds whose storage or
 * schema is unusable keep simulating in memory only. Config reloads reach every world at its next
 * tick.
 */
public final class MetabolismModule implements VitalisModule {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  public static final String ID = "metabolism";

  private final Map<UUID, MetabolismWorld> worlds = new ConcurrentHashMap<>();
  private volatile MetabolismConfig config;
  private Services services;
  private ActivitySource activity;
  private StatSummarySink summaries;
  private AutoCloseable worldListener;
  private AutoCloseable reloadHandle;

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<String> dependencies() {
    return List.of(PlayersModule.ID);
  }

  @Override
  public void setup(ModuleContext context) {
    services = context.services();
    config = services.configs().load(MetabolismConfig.SCHEMA);
  }

  @Override
  public ModuleActivation start(ModuleContext context) {
    if (!config.enabled()) {
      return ModuleActivation.skipped("disabled in " + MetabolismConfig.NAME + ".json5");
    }
    activity = context.service(ActivitySource.class).orElse(ActivitySource.idle());
    summaries = context.service(StatSummarySink.class).orElse(StatSummarySink.discard());
    reloadHandle = services.configs().onReload(MetabolismConfig.SCHEMA, this::applyConfig);
    worldListener = services.worlds().addListener(new Listener());
    for (WorldContext world : services.worlds().contexts()) {
      attach(world);
    }
    context.publishService(MetabolismService.class, new MetabolismService(worlds));
    LOG.info(
        "(vitalis) metabolism enabled stats={} effects={}",
        config.stats().size(),
        config.effects().size());
    return ModuleActivation.activated();
  }

  @Override
  public void shutdown(ModuleContext context) throws Exception {
    try {
      closeHandle(worldListener);
      closeHandle(reloadHandle);
    } finally {
      worldListener = null;
      reloadHandle = null;
      long timeout = services == null ? 0L : services.config().runtime().flushTimeoutMs();
      for (UUID worldId : List.copyOf(worlds.keySet())) {
        detach(worldId, timeout);
      }
    }
  }

  private void applyConfig(MetabolismConfig next) {
    if (next.enabled() != config.enabled()) {
      LOG.warn("(vitalis) metabolism.enabled changed; takes effect after restart");
    }
    config = next;
    for (MetabolismWorld world : worlds.values()) {
      world.updateConfig(next);
    }
  }

  private MetabolismWorld attach(WorldContext world) {
    return worlds.computeIfAbsent(
        world.worldId(), id -> world.moduleState(ID, MetabolismWorld.class, () -> open(world)));
  }

  private void detach(UUID worldId, long timeoutMs) {
    MetabolismWorld world = worlds.remove(worldId);
    if (world != null) {
      world.shutdown(timeoutMs);
    }
  }

  private MetabolismWorld open(WorldContext world) {
    MetabolismRepository repository = null;
    Optional<WorldStorage> storage = world.storage();
    if (storage.isPresent()) {
      try {
        MetabolismRepository candidate = new MetabolismRepository(storage.get());
        candidate.migrate();
        repository = candidate;
      } catch (StorageException e) {
        LOG.error(
            "(vitalis) code={} op={} world={} mode=in-memory message={}",
            e.code(),
            "metabolism.schema",
            world.worldId(),
            e.getMessage());
      }
    }
    MetabolismRepository store = repository;
    FlushQueue flushes =
        new FlushQueue(
            services.ioExecutor(),
            (key, values) -> store.save(key.playerId(), values, System.currentTimeMillis()));
    MetabolismConfig current = config;
    MetabolismEngine engine =
        new MetabolismEngine(
            world.worldId(),
            current,
            store != null,
            flushes,
            activity,
            summaries,
            services.events()::fireEffectTransition);
    MetabolismWorld simulated =
        new MetabolismWorld(
            world.worldId(),
            engine,
            store,
            flushes,
            services.ioExecutor(),
            MetabolismWorld.newTicker(world.worldId()),
            System::currentTimeMillis);
    simulated.start();
    return simulated;
  }

  private static void closeHandle(AutoCloseable handle) throws Exception {
    if (handle != null) {
      handle.close();
    }
  }

  private final class Listener implements WorldListener {
    @Override
    public void onWorldAdded(WorldContext world) {
      attach(world);
    }

    @Override
    public void onWorldRemoving(WorldContext world) {
      detach(world.worldId(), services.config().runtime().flushTimeoutMs());
      world.removeModuleState(ID);
    }

    @Override
    public void onPlayerJoin(WorldContext world, UUID playerId) {
      attach(world).join(playerId);
    }

    @Override
    public void onPlayerLeave(WorldContext world, UUID playerId) {
      MetabolismWorld simulated = worlds.get(world.worldId());
      if (simulated != null) {
        simulated.leave(playerId);
      }
    }
  }
}
