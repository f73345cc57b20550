/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.world;

import java.util.UUID;

/**
 * Receives world and player lifecycle notifications from {@link WorldRegistry}. Listeners run on
 * the caller's thread and must hand long work to an executor.
 */
public interface WorldListener {

  default void onWorldAdded(WorldContext world) {}

  /** Called before the world's storage is closed. */
  default void onWorldRemoving(WorldContext world) {}

  default void onPlayerJoin(WorldContext world, UUID playerId) {}

  default void onPlayerLeave(WorldContext world, UUID playerId) {}
}
