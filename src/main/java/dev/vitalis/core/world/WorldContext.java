/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.world;

import dev.vitalis.api.StorageException;
import dev.vitalis.api.storage.WorldStorage;
import dev.vitalis.core.storage.PlayerDirectory;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything Vitalis holds for one world: its lazily opened storage and one state object per
 * module.
 *
 * <p>Storage is opened at most once. When opening fails the context stays usable in degraded mode:
 * {@link #storage()} returns empty and modules keep their state in memory only.
 */
public final class WorldContext implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final UUID worldId;
  private final String name;
  private final StorageOpener opener;
  private final Map<String, Object> moduleState = new ConcurrentHashMap<>();
  private final Object storageLock = new Object();
  private WorldStorage storage;
  private PlayerDirectory players;
  private StorageException storageFailure;
  private boolean closed;

  WorldContext(UUID worldId, String name, StorageOpener opener) {
    this.worldId = Objects.requireNonNull(worldId, "worldId");
    this.name = name != null ? name : worldId.toString();
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  public UUID worldId() {
    return worldId;
  }

  public String name() {
    return name;
  }

  /**
   * Storage of this world, opened on first call.
   *
   * @return storage, or empty when the world is degraded or already closed
   */
  public Optional<WorldStorage> storage() {
    synchronized (storageLock) {
      if (closed || storageFailure != null) {
        return Optional.empty();
      }
      if (storage == null) {
        try {
          storage = opener.open(worldId);
        } catch (StorageException e) {
          storageFailure = e;
          LOG.error(
              "(vitalis) code={} op={} world={} mode=in-memory message={}",
              e.code(),
              "world.storage",
              worldId,
              e.getMessage());
          return Optional.empty();
        }
      }
      return Optional.of(storage);
    }
  }

  /**
   * Player directory of this world.
   *
   * @return directory, or empty when storage is unavailable
   */
  public Optional<PlayerDirectory> players() {
    Optional<WorldStorage> opened = storage();
    synchronized (storageLock) {
      if (opened.isEmpty() || closed) {
        return Optional.empty();
      }
      if (players == null) {
        players = new PlayerDirectory(opened.get());
      }
      return Optional.of(players);
    }
  }

  /** Whether storage could not be opened and the world runs in memory only. */
  public boolean degraded() {
    synchronized (storageLock) {
      return storageFailure != null;
    }
  }

  /** Failure that put the world into degraded mode. */
  public Optional<StorageException> storageFailure() {
    synchronized (storageLock) {
      return Optional.ofNullable(storageFailure);
    }
  }

  /**
   * Module-private state, created on first access.
   *
   * @param moduleId owning module
   * @param type expected type
   * @param factory creates the state when absent
   */
  public <T> T moduleState(String moduleId, Class<T> type, Supplier<T> factory) {
    Objects.requireNonNull(factory, "factory");
    Object state =
        moduleState.computeIfAbsent(
            moduleId, id -> Objects.requireNonNull(factory.get(), "module state"));
    return type.cast(state);
  }

  /** Existing module state, without creating it. */
  public <T> Optional<T> findModuleState(String moduleId, Class<T> type) {
    Object state = moduleState.get(moduleId);
    return type.isInstance(state) ? Optional.of(type.cast(state)) : Optional.empty();
  }

  /** Detaches module state so the module can tear it down. */
  public Optional<Object> removeModuleState(String moduleId) {
    return Optional.ofNullable(moduleState.remove(moduleId));
  }

  /** Whether {@link #close()} ran. */
  public boolean isClosed() {
    synchronized (storageLock) {
      return closed;
    }
  }

  /** Drops module state and closes storage. Runs once. */
  @Override
  public void close() {
    WorldStorage toClose;
    synchronized (storageLock) {
      if (closed) {
        return;
      }
      closed = true;
      toClose = storage;
      storage = null;
      players = null;
    }
    if (!moduleState.isEmpty()) {
      LOG.debug("(vitalis) world={} dropping state of modules {}", worldId, moduleState.keySet());
    }
    moduleState.clear();
    if (toClose != null) {
      toClose.close();
    }
  }
}
