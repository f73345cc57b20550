/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.Optional;
import java.util.UUID;

/** Per-world player directory backed by the {@code players} table. */
public interface Players {

  /**
   * Looks up a player's directory row in a world.
   *
   * @param worldId world UUID
   * @param playerId player UUID
   * @return record, or empty when the player never joined that world or storage is unavailable
   */
  Optional<PlayerRecord> find(UUID worldId, UUID playerId);

  /**
   * Snapshot of a player row.
   *
   * @param id player UUID
   * @param firstSeen epoch millis of the first recorded session
   * @param lastSeen epoch millis of the most recent join or leave
   */
  record PlayerRecord(UUID id, long firstSeen, long lastSeen) {}
}
