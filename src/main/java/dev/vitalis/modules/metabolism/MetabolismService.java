/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.StatVector;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Read and adjust metabolism state of online players. Published by {@link MetabolismModule} while
 * it is active.
 *
 * <p>Lookups read the snapshot of the most recent tick and never wait for the simulation.
 */
public final class MetabolismService {
  private final Map<UUID, MetabolismWorld> worlds;

  MetabolismService(Map<UUID, MetabolismWorld> worlds) {
    this.worlds = worlds;
  }

  /** Current stats of a player in whichever world simulates them. */
  public Optional<StatVector> getStats(UUID playerId) {
    for (MetabolismWorld world : worlds.values()) {
      Optional<StatVector> stats = world.snapshot(playerId);
      if (stats.isPresent()) {
        return stats;
      }
    }
    return Optional.empty();
  }

  /** Current stats of a player in one world. */
  public Optional<StatVector> getStats(UUID worldId, UUID playerId) {
    MetabolismWorld world = worlds.get(worldId);
    return world == null ? Optional.empty() : world.snapshot(playerId);
  }

  /** Active effect names of a player, empty when none or unknown. */
  public Set<String> getActiveEffects(UUID playerId) {
    for (MetabolismWorld world : worlds.values()) {
      if (world.snapshot(playerId).isPresent()) {
        return world.activeEffects(playerId);
      }
    }
    return Set.of();
  }

  /**
   * Writes every dirty player of a world now.
   *
   * @return future completing once the writes finished; already complete for unknown worlds
   */
  public CompletableFuture<Void> forceFlush(UUID worldId) {
    MetabolismWorld world = worlds.get(worldId);
    return world == null ? CompletableFuture.completedFuture(null) : world.flushNow();
  }

  /**
   * Adds {@code amount} (negative to drain) to a stat at the start of the next tick, clamped to the
   * stat's bounds. Used for food and drink.
   *
   * @return {@code false} when the world is not simulated
   * @throws IllegalArgumentException when {@code amount} is not finite
   */
  public boolean restore(UUID worldId, UUID playerId, String stat, double amount) {
    MetabolismWorld world = worlds.get(worldId);
    if (world == null) {
      return false;
    }
    world.restore(playerId, stat, amount);
    return true;
  }
}
