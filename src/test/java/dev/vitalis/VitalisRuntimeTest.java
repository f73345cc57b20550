/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.vitalis.api.ActivitySource;
import dev.vitalis.api.StatSummarySink;
import dev.vitalis.api.StatVector;
import dev.vitalis.core.modules.ModuleState;
import dev.vitalis.modules.metabolism.MetabolismModule;
import dev.vitalis.modules.players.PlayersModule;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Boots the whole runtime against a temporary config and data directory. */
class VitalisRuntimeTest {
  private static final StatSummarySink NO_SUMMARIES = (world, player, summary) -> {};

  private static void writeConfig(Path configDir, Path dataDir, boolean metabolism)
      throws Exception {
    Files.createDirectories(configDir);
    Files.writeString(
        configDir.resolve("vitalis.json5"),
        "{ configVersion: 1, core: { storage: { dataDir: \""
            + dataDir.toString().replace('\\', '/')
            + "\", writeTimeoutMs: 2000 } } }");
    Files.writeString(
        configDir.resolve("metabolism.json5"),
        "{ configVersion: 3, enabled: "
            + metabolism
            + ", tickPeriodMs: 50, flushEveryTicks: 1,"
            + " stats: { hunger: { ratePerMinute: 1.0 } } }");
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      assertTrue(System.nanoTime() < deadline, "condition not met within 10s");
      Thread.sleep(10);
    }
  }

  private static double hunger(VitalisRuntime runtime, UUID player) {
    Optional<StatVector> stats = runtime.getStats(player);
    return stats.map(s -> s.value("hunger").orElse(Double.NaN)).orElse(Double.NaN);
  }

  @Test
  void statsSurviveARestart(@TempDir Path dir) throws Exception {
    Path configDir = dir.resolve("config");
    writeConfig(configDir, dir.resolve("data"), true);
    UUID world = UUID.randomUUID();
    UUID player = UUID.randomUUID();

    try (VitalisRuntime runtime =
        VitalisRuntime.boot(configDir, ActivitySource.idle(), NO_SUMMARIES)) {
      assertEquals(Optional.of(ModuleState.ACTIVE), runtime.modules().state(PlayersModule.ID));
      assertEquals(Optional.of(ModuleState.ACTIVE), runtime.modules().state(MetabolismModule.ID));
      runtime.onWorldAdded(world, "overworld");
      runtime.onPlayerJoin(world, player);
      await(() -> runtime.getStats(player).isPresent());

      assertTrue(runtime.restore(world, player, "hunger", -40.0));
      await(() -> hunger(runtime, player) < 61.0);
      runtime.forceFlush(world).get(5, TimeUnit.SECONDS);
      await(() -> runtime.players().flatMap(p -> p.find(world, player)).isPresent());
      runtime.onPlayerLeave(world, player);
    }

    try (VitalisRuntime runtime =
        VitalisRuntime.boot(configDir, ActivitySource.idle(), NO_SUMMARIES)) {
      runtime.onWorldAdded(world, "overworld");
      runtime.onPlayerJoin(world, player);
      await(() -> runtime.getStats(player).isPresent());

      double restored = hunger(runtime, player);
      assertTrue(restored < 61.0, "hunger after restart was " + restored);
      assertTrue(restored > 50.0, "hunger after restart was " + restored);
      assertTrue(Files.exists(dir.resolve("data").resolve(world.toString()).resolve("vitalis.db")));
    }
  }

  @Test
  void disabledMetabolismIsSkipped(@TempDir Path dir) throws Exception {
    Path configDir = dir.resolve("config");
    writeConfig(configDir, dir.resolve("data"), false);
    UUID world = UUID.randomUUID();
    UUID player = UUID.randomUUID();

    try (VitalisRuntime runtime =
        VitalisRuntime.boot(configDir, ActivitySource.idle(), NO_SUMMARIES)) {
      assertEquals(Optional.of(ModuleState.SKIPPED), runtime.modules().state(MetabolismModule.ID));
      runtime.onWorldAdded(world, "overworld");
      runtime.onPlayerJoin(world, player);

      assertTrue(runtime.getStats(player).isEmpty());
      assertTrue(runtime.getActiveEffects(player).isEmpty());
      assertTrue(runtime.forceFlush(world).isDone());
      assertFalse(runtime.restore(world, player, "hunger", 5.0));
    }
  }
}
