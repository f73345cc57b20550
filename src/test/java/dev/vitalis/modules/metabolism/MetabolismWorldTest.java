/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.vitalis.api.ActivitySource;
import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.core.Config;
import dev.vitalis.core.storage.SqliteWorldStorage;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetabolismWorldTest {
  private static final MetabolismConfig CONFIG =
      new MetabolismConfig(
          true,
          1000,
          30,
          1.0,
          List.of(new StatDefinition("hunger", true, 0.0, 100.0, 100.0, 1.0, Map.of())),
          List.of());

  private final UUID worldId = UUID.randomUUID();
  private final UUID player = UUID.randomUUID();
  private final AtomicLong clock = new AtomicLong();

  private MetabolismEngine engine(boolean persistent, FlushQueue flushes) {
    return new MetabolismEngine(
        worldId,
        CONFIG,
        persistent,
        flushes,
        ActivitySource.idle(),
        (world, playerId, summary) -> {},
        event -> {});
  }

  private MetabolismWorld world(
      MetabolismEngine engine, MetabolismRepository repository, FlushQueue flushes) {
    return world(engine, repository, flushes, MetabolismWorld.newTicker(worldId));
  }

  private MetabolismWorld world(
      MetabolismEngine engine,
      MetabolismRepository repository,
      FlushQueue flushes,
      ScheduledExecutorService ticker) {
    return new MetabolismWorld(
        worldId, engine, repository, flushes, Runnable::run, ticker, clock::get);
  }

  private static void hold(ScheduledExecutorService ticker, CountDownLatch gate) {
    ticker.execute(
        () -> {
          try {
            gate.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
  }

  private double hunger(MetabolismWorld world) {
    return world.snapshot(player).orElseThrow().value("hunger").getAsDouble();
  }

  @Test
  void leaveWritesAndRejoinLoadsStoredValues(@TempDir Path dir) throws Exception {
    try (SqliteWorldStorage storage =
        SqliteWorldStorage.open(worldId, new Config.Storage(dir, 1_000, 2, 3))) {
      MetabolismRepository repository = new MetabolismRepository(storage);
      repository.migrate();
      FlushQueue flushes =
          new FlushQueue(
              Runnable::run, (key, values) -> repository.save(key.playerId(), values, clock.get()));
      MetabolismEngine engine = engine(true, flushes);
      MetabolismWorld world = world(engine, repository, flushes);

      world.join(player).get(5, TimeUnit.SECONDS);
      assertEquals(100.0, hunger(world));

      clock.set(60_000L);
      engine.tick(clock.get());
      world.leave(player).get(5, TimeUnit.SECONDS);

      assertTrue(world.snapshot(player).isEmpty());
      assertEquals(Map.of("hunger", 99.0), repository.load(player).orElseThrow());

      world.join(player).get(5, TimeUnit.SECONDS);
      assertEquals(99.0, hunger(world));

      assertTrue(world.shutdown(2_000L));
      assertTrue(world.snapshot(player).isEmpty());
    }
  }

  @Test
  void rejoinQueuedBehindLeaveSeesTheFinalWrite(@TempDir Path dir) throws Exception {
    try (SqliteWorldStorage storage =
        SqliteWorldStorage.open(worldId, new Config.Storage(dir, 1_000, 2, 3))) {
      MetabolismRepository repository = new MetabolismRepository(storage);
      repository.migrate();
      FlushQueue flushes =
          new FlushQueue(
              Runnable::run, (key, values) -> repository.save(key.playerId(), values, clock.get()));
      MetabolismEngine engine = engine(true, flushes);
      ScheduledExecutorService ticker = MetabolismWorld.newTicker(worldId);
      MetabolismWorld world = world(engine, repository, flushes, ticker);

      world.join(player).get(5, TimeUnit.SECONDS);
      clock.set(60_000L);
      engine.tick(clock.get());

      CountDownLatch gate = new CountDownLatch(1);
      hold(ticker, gate);
      CompletableFuture<Void> left = world.leave(player);
      CompletableFuture<Void> joined = world.join(player);
      gate.countDown();

      left.get(5, TimeUnit.SECONDS);
      joined.get(5, TimeUnit.SECONDS);
      assertEquals(99.0, hunger(world));
      assertTrue(world.shutdown(2_000L));
    }
  }

  @Test
  void rejoinAfterFailedWriteKeepsTheUnwrittenValues(@TempDir Path dir) throws Exception {
    try (SqliteWorldStorage storage =
        SqliteWorldStorage.open(worldId, new Config.Storage(dir, 1_000, 2, 3))) {
      MetabolismRepository repository = new MetabolismRepository(storage);
      repository.migrate();
      FlushQueue flushes =
          new FlushQueue(
              Runnable::run,
              (key, values) -> {
                throw new StorageException(ErrorCode.STORAGE_BUSY, "writer busy");
              });
      MetabolismEngine engine = engine(true, flushes);
      MetabolismWorld world = world(engine, repository, flushes);

      world.join(player).get(5, TimeUnit.SECONDS);
      clock.set(60_000L);
      engine.tick(clock.get());
      world.leave(player).get(5, TimeUnit.SECONDS);

      assertTrue(repository.load(player).isEmpty());
      world.join(player).get(5, TimeUnit.SECONDS);
      assertEquals(99.0, hunger(world));
      world.shutdown(500L);
    }
  }

  @Test
  void inMemoryWorldResumesSuspendedPlayer() throws Exception {
    FlushQueue flushes =
        new FlushQueue(
            Runnable::run,
            (key, values) -> {
              throw new AssertionError("in-memory world must not write");
            });
    MetabolismEngine engine = engine(false, flushes);
    MetabolismWorld world = world(engine, null, flushes);

    world.join(player).get(5, TimeUnit.SECONDS);
    clock.set(60_000L);
    engine.tick(clock.get());
    world.leave(player).get(5, TimeUnit.SECONDS);

    clock.set(600_000L);
    world.join(player).get(5, TimeUnit.SECONDS);

    assertEquals(99.0, hunger(world));
    assertTrue(world.shutdown(2_000L));
  }

  @Test
  void failedLoadLeavesPlayerUnsimulated(@TempDir Path dir) throws Exception {
    SqliteWorldStorage storage =
        SqliteWorldStorage.open(worldId, new Config.Storage(dir, 1_000, 2, 3));
    MetabolismRepository repository = new MetabolismRepository(storage);
    repository.migrate();
    storage.close();
    FlushQueue flushes = new FlushQueue(Runnable::run, (key, values) -> {});
    MetabolismWorld world = world(engine(true, flushes), repository, flushes);

    world.join(player).get(5, TimeUnit.SECONDS);

    assertTrue(world.snapshot(player).isEmpty());
    assertTrue(world.shutdown(2_000L));
  }

  @Test
  void joinAfterShutdownIsIgnored() throws Exception {
    FlushQueue flushes = new FlushQueue(Runnable::run, (key, values) -> {});
    MetabolismWorld world = world(engine(false, flushes), null, flushes);

    assertTrue(world.shutdown(2_000L));
    world.join(player).get(5, TimeUnit.SECONDS);

    assertTrue(world.snapshot(player).isEmpty());
  }
}
