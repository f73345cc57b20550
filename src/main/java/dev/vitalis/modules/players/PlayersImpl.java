/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.players;

import dev.vitalis.api.Players;
import dev.vitalis.api.StorageException;
import dev.vitalis.core.world.WorldContext;
import dev.vitalis.core.world.WorldRegistry;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Players} over the directory of each live world. */
final class PlayersImpl implements Players {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final WorldRegistry worlds;

  PlayersImpl(WorldRegistry worlds) {
    this.worlds = worlds;
  }

  @Override
  public Optional<PlayerRecord> find(UUID worldId, UUID playerId) {
    try {
      return worlds.find(worldId).flatMap(WorldContext::players).flatMap(d -> d.find(playerId));
    } catch (StorageException e) {
      LOG.warn(
          "(vitalis) code={} op={} world={} player={} message={}",
          e.code(),
          "players.find",
          worldId,
          playerId,
          e.getMessage());
      return Optional.empty();
    }
  }
}
