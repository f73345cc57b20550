/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.players;

import dev.vitalis.api.StorageException;
import dev.vitalis.core.storage.PlayerDirectory;
import dev.vitalis.core.world.WorldContext;
import dev.vitalis.core.world.WorldListener;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Records joins and leaves off the caller's thread. */
final class DirectoryListener implements WorldListener {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final Executor io;
  private final LongSupplier clock;

  DirectoryListener(Executor io, LongSupplier clock) {
    this.io = io;
    this.clock = clock;
  }

  @Override
  public void onPlayerJoin(WorldContext world, UUID playerId) {
    long now = clock.getAsLong();
    submit("players.join", world, playerId, d -> d.recordJoin(playerId, now));
  }

  @Override
  public void onPlayerLeave(WorldContext world, UUID playerId) {
    long now = clock.getAsLong();
    submit("players.leave", world, playerId, d -> d.recordLeave(playerId, now));
  }

  private void submit(
      String op, WorldContext world, UUID playerId, Consumer<PlayerDirectory> write) {
    try {
      io.execute(
          () -> {
            Optional<PlayerDirectory> directory = world.players();
            if (directory.isEmpty()) {
              LOG.debug(
                  "(vitalis) op={} world={} player={} skipped: no storage",
                  op,
                  world.worldId(),
                  playerId);
              return;
            }
            try {
              write.accept(directory.get());
            } catch (StorageException e) {
              LOG.warn(
                  "(vitalis) code={} op={} world={} player={} message={}",
                  e.code(),
                  op,
                  world.worldId(),
                  playerId,
                  e.getMessage());
            }
          });
    } catch (RejectedExecutionException e) {
      LOG.debug(
          "(vitalis) op={} world={} player={} dropped; io executor stopped",
          op,
          world.worldId(),
          playerId);
    }
  }
}
