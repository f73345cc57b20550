/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StatVector;
import dev.vitalis.api.StorageException;
import dev.vitalis.modules.metabolism.FlushQueue.FlushKey;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one world's {@link MetabolismEngine} on a dedicated single-thread scheduler.
 *
 * <p>The scheduler guarantees at most one tick in flight; a slow tick delays the next one. Joins,
 * leaves and flushes are marshalled onto the same thread, loads and writes run on the shared I/O
 * executor.
 */
final class MetabolismWorld {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final UUID worldId;
  private final MetabolismEngine engine;
  private final MetabolismRepository repository;
  private final FlushQueue flushes;
  private final Executor io;
  private final ScheduledExecutorService ticker;
  private final LongSupplier clock;
  private final Map<UUID, Long> sessions = new ConcurrentHashMap<>();
  private final AtomicLong sessionCounter = new AtomicLong();
  private ScheduledFuture<?> ticking;
  private long periodMs;
  private volatile boolean stopped;

  /**
   * @param repository store of this world, or null to simulate in memory only
   */
  MetabolismWorld(
      UUID worldId,
      MetabolismEngine engine,
      MetabolismRepository repository,
      FlushQueue flushes,
      Executor io,
      ScheduledExecutorService ticker,
      LongSupplier clock) {
    this.worldId = worldId;
    this.engine = engine;
    this.repository = repository;
    this.flushes = flushes;
    this.io = io;
    this.ticker = ticker;
    this.clock = clock;
  }

  /** Single daemon thread named after the world. */
  static ScheduledExecutorService newTicker(UUID worldId) {
    return Executors.newSingleThreadScheduledExecutor(
        r -> {
          Thread t = new Thread(r, "vitalis-tick-" + worldId);
          t.setDaemon(true);
          return t;
        });
  }

  UUID worldId() {
    return worldId;
  }

  boolean persistent() {
    return repository != null;
  }

  synchronized void start() {
    schedule(engine.config().tickPeriodMs());
    LOG.info(
        "(vitalis) world={} metabolism running periodMs={} persistent={}",
        worldId,
        periodMs,
        persistent());
  }

  private void schedule(long period) {
    if (ticking != null) {
      ticking.cancel(false);
    }
    periodMs = period;
    ticking = ticker.scheduleAtFixedRate(this::tickSafely, period, period, TimeUnit.MILLISECONDS);
  }

  private void tickSafely() {
    try {
      engine.tick(clock.getAsLong());
    } catch (RuntimeException e) {
      LOG.error(
          "(vitalis) op={} world={} message={}", "metabolism.tick", worldId, e.getMessage(), e);
    }
  }

  /**
   * Starts a session. Waits, behind any leave already queued on the tick thread, for the write of
   * the previous session, then loads the stored vector on the I/O executor and activates the player
   * on the tick thread unless the player left meanwhile. Values whose write failed win over the
   * stored ones.
   *
   * @return future completing once the player is simulated (or the join was abandoned)
   */
  CompletableFuture<Void> join(UUID playerId) {
    if (stopped) {
      return CompletableFuture.completedFuture(null);
    }
    long token = sessionCounter.incrementAndGet();
    sessions.put(playerId, token);
    if (repository == null) {
      return onTickThread(() -> activate(playerId, token, Optional.empty()));
    }
    FlushKey key = new FlushKey(worldId, playerId);
    // a leave queued before this join registers its final write on the tick thread
    return flatten(onTickThread(() -> flushes.pending(key)))
        .thenApplyAsync(ignored -> latest(key), io)
        .handle(
            (loaded, e) -> {
              if (e != null) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.warn(
                    "(vitalis) code={} op={} world={} player={} message={}",
                    cause instanceof StorageException se ? se.code() : null,
                    "metabolism.load",
                    worldId,
                    playerId,
                    cause.getMessage());
                sessions.remove(playerId, token);
                return CompletableFuture.<Void>completedFuture(null);
              }
              return onTickThread(() -> activate(playerId, token, loaded));
            })
        .thenCompose(MetabolismWorld::orCompleted);
  }

  private Optional<Map<String, Double>> latest(FlushKey key) {
    return flushes.unwritten(key).or(() -> repository.load(key.playerId()));
  }

  private Void activate(UUID playerId, long token, Optional<Map<String, Double>> loaded) {
    Long current = sessions.get(playerId);
    if (current == null || current != token) {
      LOG.debug("(vitalis) world={} player={} left before activation", worldId, playerId);
      return null;
    }
    engine.activate(playerId, loaded, clock.getAsLong());
    return null;
  }

  /**
   * Ends a session: the player is suspended on the tick thread and written immediately.
   *
   * @return future of the final write
   */
  CompletableFuture<Void> leave(UUID playerId) {
    sessions.remove(playerId);
    return flatten(onTickThread(() -> engine.suspend(playerId)));
  }

  /** Writes every dirty player now. */
  CompletableFuture<Void> flushNow() {
    return flatten(onTickThread(engine::flushDirty));
  }

  void restore(UUID playerId, String stat, double amount) {
    engine.restore(playerId, stat, amount);
  }

  /** New tunables take effect at the next tick; a changed period reschedules the ticks. */
  synchronized void updateConfig(MetabolismConfig config) {
    engine.updateConfig(config);
    if (!stopped && config.tickPeriodMs() != periodMs) {
      schedule(config.tickPeriodMs());
      LOG.info("(vitalis) world={} metabolism periodMs={}", worldId, periodMs);
    }
  }

  Optional<StatVector> snapshot(UUID playerId) {
    return engine.snapshot(playerId);
  }

  Set<String> activeEffects(UUID playerId) {
    return engine.activeEffects(playerId);
  }

  /**
   * Stops ticking, lets an in-flight tick finish, writes every player a final time and waits for
   * the writes.
   *
   * @return {@code false} when writes were still pending at the deadline
   */
  boolean shutdown(long timeoutMs) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    synchronized (this) {
      if (stopped) {
        return true;
      }
      stopped = true;
      if (ticking != null) {
        ticking.cancel(false);
      }
    }
    sessions.clear();
    boolean drained = true;
    CompletableFuture<Void> finalWrites = flatten(onTickThread(engine::terminateAll));
    ticker.shutdown();
    try {
      finalWrites.get(remaining(deadline), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      drained = false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      drained = false;
    } catch (ExecutionException e) {
      LOG.warn(
          "(vitalis) op={} world={} message={}",
          "metabolism.shutdown",
          worldId,
          e.getCause().getMessage());
    }
    drained &= flushes.awaitIdle(worldId, remaining(deadline));
    try {
      if (!ticker.awaitTermination(remaining(deadline), TimeUnit.MILLISECONDS)) {
        ticker.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      ticker.shutdownNow();
    }
    if (!drained) {
      LOG.warn(
          "(vitalis) code={} op={} world={} message={}",
          ErrorCode.STORAGE_BUSY,
          "metabolism.shutdown",
          worldId,
          "pending writes not finished within " + timeoutMs + "ms");
    } else {
      LOG.info("(vitalis) world={} metabolism stopped", worldId);
    }
    return drained;
  }

  private static long remaining(long deadline) {
    return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
  }

  private static CompletableFuture<Void> flatten(
      CompletableFuture<CompletableFuture<Void>> nested) {
    return nested.thenCompose(MetabolismWorld::orCompleted);
  }

  private static CompletableFuture<Void> orCompleted(CompletableFuture<Void> future) {
    return future == null ? CompletableFuture.completedFuture(null) : future;
  }

  private <T> CompletableFuture<T> onTickThread(Supplier<T> work) {
    try {
      return CompletableFuture.supplyAsync(work, ticker);
    } catch (RejectedExecutionException e) {
      LOG.debug("(vitalis) world={} metabolism stopped; work dropped", worldId);
      return CompletableFuture.completedFuture(null);
    }
  }
}
