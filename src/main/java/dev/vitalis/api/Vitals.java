/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Surface exposed to the host runtime.
 *
 * <p>Lookups read the snapshot published at the end of the most recent tick and never block on the
 * simulation.
 */
public interface Vitals {

  /**
   * Current stats for an online player.
   *
   * @param playerId player UUID
   * @return latest snapshot, or empty when the player is not simulated in any world
   */
  Optional<StatVector> getStats(UUID playerId);

  /**
   * Names of all effects currently active for the player.
   *
   * @param playerId player UUID
   * @return effect names, empty when none or unknown player
   */
  Set<String> getActiveEffects(UUID playerId);

  /**
   * Persists every dirty stat vector of a world.
   *
   * @param worldId world UUID
   * @return future completing once the writes finished (immediately for unknown worlds)
   */
  CompletableFuture<Void> forceFlush(UUID worldId);

  /**
   * Re-reads configuration from disk.
   *
   * @param moduleId module document to reload, or {@code null} for every document
   */
  void reloadConfig(String moduleId);
}
