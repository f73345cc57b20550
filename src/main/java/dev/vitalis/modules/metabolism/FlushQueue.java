/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.StorageException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-behind bookkeeping: which players changed since their last write and which writes are
 * still running.
 *
 * <p>Writes for the same key run one after another on the I/O executor, in submission order. A
 * failed write is logged, its key marked dirty again and its values kept until a later write of
 * the key succeeds. Kept values outlive the player's session: {@link #retryFailed} writes them for
 * players no longer simulated and {@link #unwritten} hands them to a rejoining player.
 */
final class FlushQueue {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  /** Identity of one persisted stat vector. */
  record FlushKey(UUID worldId, UUID playerId) {
    FlushKey {
      Objects.requireNonNull(worldId, "worldId");
      Objects.requireNonNull(playerId, "playerId");
    }
  }

  /** Persists one vector. Runs on the I/O executor. */
  @FunctionalInterface
  interface Writer {
    void write(FlushKey key, Map<String, Double> values);
  }

  private final Set<FlushKey> dirty = ConcurrentHashMap.newKeySet();
  private final ConcurrentHashMap<FlushKey, Map<String, Double>> failed =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<FlushKey, CompletableFuture<Void>> inFlight =
      new ConcurrentHashMap<>();
  private final Executor io;
  private final Writer writer;

  FlushQueue(Executor io, Writer writer) {
    this.io = Objects.requireNonNull(io, "io");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  void markDirty(FlushKey key) {
    dirty.add(key);
  }

  boolean isDirty(FlushKey key) {
    return dirty.contains(key) || failed.containsKey(key);
  }

  /** Values of the last failed write of a key, empty once a later write succeeded. */
  Optional<Map<String, Double>> unwritten(FlushKey key) {
    return Optional.ofNullable(failed.get(key));
  }

  /**
   * Writes again every failed vector of a world that no newer write replaced.
   *
   * @return future completing when those writes finished
   */
  CompletableFuture<Void> retryFailed(UUID worldId) {
    List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (Map.Entry<FlushKey, Map<String, Double>> entry : failed.entrySet()) {
      if (entry.getKey().worldId().equals(worldId)) {
        futures.add(flush(entry.getKey(), entry.getValue()));
      }
    }
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
  }

  /**
   * Queues a write of {@code values} behind any write already running for the key. Clears the
   * dirty mark and supersedes values kept from an earlier failed write.
   *
   * @return future completing when this write finished; it never completes exceptionally
   */
  CompletableFuture<Void> flush(FlushKey key, Map<String, Double> values) {
    Map<String, Double> copy = Map.copyOf(values);
    dirty.remove(key);
    failed.remove(key);
    CompletableFuture<Void> next =
        inFlight.compute(
            key,
            (k, previous) -> {
              CompletableFuture<Void> base =
                  previous == null ? CompletableFuture.completedFuture(null) : previous;
              return base.thenRunAsync(() -> write(k, copy), io)
                  .exceptionally(
                      e -> {
                        LOG.warn(
                            "(vitalis) op={} world={} player={} write not scheduled: {}",
                            "metabolism.flush",
                            k.worldId(),
                            k.playerId(),
                            e.getMessage());
                        keep(k, copy);
                        return null;
                      });
            });
    next.whenComplete((ignored, e) -> inFlight.remove(key, next));
    return next;
  }

  private void write(FlushKey key, Map<String, Double> values) {
    try {
      writer.write(key, values);
      failed.remove(key);
    } catch (StorageException e) {
      keep(key, values);
      LOG.warn(
          "(vitalis) code={} op={} world={} player={} message={}",
          e.code(),
          "metabolism.flush",
          key.worldId(),
          key.playerId(),
          e.getMessage());
    } catch (RuntimeException e) {
      keep(key, values);
      LOG.warn(
          "(vitalis) op={} world={} player={} message={}",
          "metabolism.flush",
          key.worldId(),
          key.playerId(),
          e.getMessage(),
          e);
    }
  }

  private void keep(FlushKey key, Map<String, Double> values) {
    failed.put(key, values);
    dirty.add(key);
  }

  /** Future of the write currently queued for a key, completed when none. */
  CompletableFuture<Void> pending(FlushKey key) {
    CompletableFuture<Void> running = inFlight.get(key);
    return running == null ? CompletableFuture.completedFuture(null) : running;
  }

  /** Completes once every write of a world queued so far finished. */
  CompletableFuture<Void> idle(UUID worldId) {
    List<CompletableFuture<Void>> futures = new ArrayList<>();
    inFlight.forEach(
        (key, future) -> {
          if (key.worldId().equals(worldId)) {
            futures.add(future);
          }
        });
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
  }

  /**
   * Waits for every queued write of a world.
   *
   * @return {@code false} when writes were still running at the deadline
   */
  boolean awaitIdle(UUID worldId, long timeoutMs) {
    try {
      idle(worldId).get(timeoutMs, TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      LOG.debug("(vitalis) world={} flush wait ended with {}", worldId, e.getCause().toString());
      return true;
    }
  }
}
