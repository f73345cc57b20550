/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.players;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.Players.PlayerRecord;
import dev.vitalis.api.StorageException;
import dev.vitalis.core.Config;
import dev.vitalis.core.storage.SqliteWorldStorage;
import dev.vitalis.core.world.WorldRegistry;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for the player directory listener and lookup. */
final class PlayersModuleTest {
  private final AtomicLong clock = new AtomicLong(1_000L);

  @Test
  void joinsAndLeavesAreRecordedPerWorld(@TempDir Path dir) {
    Config.Storage settings = new Config.Storage(dir, 1_000, 2, 1);
    try (WorldRegistry worlds = new WorldRegistry(id -> SqliteWorldStorage.open(id, settings))) {
      worlds.addListener(new DirectoryListener(Runnable::run, clock::get));
      PlayersImpl players = new PlayersImpl(worlds);
      UUID overworld = UUID.randomUUID();
      UUID nether = UUID.randomUUID();
      UUID player = UUID.randomUUID();
      worlds.getOrCreate(overworld, "overworld");
      worlds.getOrCreate(nether, "nether");

      worlds.playerJoined(overworld, player);
      clock.set(9_000L);
      worlds.playerLeft(overworld, player);

      PlayerRecord record = players.find(overworld, player).orElseThrow();
      assertEquals(1_000L, record.firstSeen());
      assertEquals(9_000L, record.lastSeen());
      assertTrue(players.find(nether, player).isEmpty());
      assertTrue(players.find(UUID.randomUUID(), player).isEmpty());
    }
  }

  @Test
  void degradedWorldSkipsDirectoryWrites() {
    try (WorldRegistry worlds =
        new WorldRegistry(
            id -> {
              throw new StorageException(ErrorCode.STORAGE_CORRUPT, "not a database");
            })) {
      worlds.addListener(new DirectoryListener(Runnable::run, clock::get));
      UUID world = UUID.randomUUID();
      UUID player = UUID.randomUUID();
      worlds.getOrCreate(world, "broken");

      worlds.playerJoined(world, player);

      assertTrue(worlds.find(world).orElseThrow().degraded());
      assertTrue(new PlayersImpl(worlds).find(world, player).isEmpty());
    }
  }
}
