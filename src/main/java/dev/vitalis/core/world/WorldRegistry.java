/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.world;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks live worlds. A context is created on first reference and torn down on removal: listeners
 * see {@code onWorldRemoving} first, then storage is closed.
 *
 * <p>A failing listener is logged and skipped so one module cannot block another's teardown.
 */
public final class WorldRegistry implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final ConcurrentHashMap<UUID, WorldContext> worlds = new ConcurrentHashMap<>();
  private final List<WorldListener> listeners = new CopyOnWriteArrayList<>();
  private final StorageOpener opener;

  public WorldRegistry(StorageOpener opener) {
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  /**
   * Returns the context of a world, creating it when absent.
   *
   * @param worldId world UUID
   * @param name display name used in logs, may be null
   */
  public WorldContext getOrCreate(UUID worldId, String name) {
    Objects.requireNonNull(worldId, "worldId");
    WorldContext existing = worlds.get(worldId);
    if (existing != null) {
      return existing;
    }
    WorldContext created = new WorldContext(worldId, name, opener);
    WorldContext raced = worlds.putIfAbsent(worldId, created);
    if (raced != null) {
      return raced;
    }
    LOG.info("(vitalis) world={} name={} registered", worldId, created.name());
    notifyListeners("world.added", worldId, l -> l.onWorldAdded(created), false);
    return created;
  }

  public Optional<WorldContext> find(UUID worldId) {
    return Optional.ofNullable(worlds.get(worldId));
  }

  public Optional<WorldContext> findByName(String name) {
    return worlds.values().stream().filter(w -> w.name().equals(name)).findFirst();
  }

  /** Snapshot of all live worlds. */
  public Collection<WorldContext> contexts() {
    return List.copyOf(worlds.values());
  }

  /**
   * Removes a world. Listeners are notified in reverse registration order, then the context is
   * closed.
   *
   * @return {@code false} when the world was not registered
   */
  public boolean remove(UUID worldId) {
    WorldContext context = worlds.remove(worldId);
    if (context == null) {
      return false;
    }
    notifyListeners("world.removing", worldId, l -> l.onWorldRemoving(context), true);
    context.close();
    LOG.info("(vitalis) world={} removed", worldId);
    return true;
  }

  /** Forwards a join, registering the world if needed. */
  public void playerJoined(UUID worldId, UUID playerId) {
    Objects.requireNonNull(playerId, "playerId");
    WorldContext context = getOrCreate(worldId, null);
    notifyListeners("player.join", worldId, l -> l.onPlayerJoin(context, playerId), false);
  }

  /** Forwards a leave. Unknown worlds are ignored. */
  public void playerLeft(UUID worldId, UUID playerId) {
    Objects.requireNonNull(playerId, "playerId");
    WorldContext context = worlds.get(worldId);
    if (context == null) {
      LOG.debug("(vitalis) world={} player={} leave for unknown world", worldId, playerId);
      return;
    }
    notifyListeners("player.leave", worldId, l -> l.onPlayerLeave(context, playerId), true);
  }

  /**
   * Adds a listener.
   *
   * @return handle whose {@code close()} removes it
   */
  public AutoCloseable addListener(WorldListener listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  /** Removes every world. */
  public void clear() {
    for (UUID worldId : List.copyOf(worlds.keySet())) {
      remove(worldId);
    }
  }

  @Override
  public void close() {
    clear();
  }

  private void notifyListeners(
      String op, UUID worldId, Consumer<WorldListener> call, boolean reverse) {
    List<WorldListener> ordered = new ArrayList<>(listeners);
    if (reverse) {
      Collections.reverse(ordered);
    }
    for (WorldListener listener : ordered) {
      try {
        call.accept(listener);
      } catch (RuntimeException e) {
        LOG.warn(
            "(vitalis) op={} world={} listener={} message={}",
            op,
            worldId,
            listener.getClass().getSimpleName(),
            e.getMessage(),
            e);
      }
    }
  }
}
