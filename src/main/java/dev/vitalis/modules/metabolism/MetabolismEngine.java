/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.ActivityClassificationUnavailableException;
import dev.vitalis.api.ActivitySource;
import dev.vitalis.api.ActivityState;
import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StatSummarySink;
import dev.vitalis.api.StatVector;
import dev.vitalis.api.events.VitalsEvents.Change;
import dev.vitalis.api.events.VitalsEvents.EffectTransitionEvent;
import dev.vitalis.modules.metabolism.FlushQueue.FlushKey;
import dev.vitalis.modules.metabolism.effects.EffectTracker;
import dev.vitalis.modules.metabolism.effects.HysteresisController.Transition;
import dev.vitalis.modules.metabolism.summary.StatSummaryFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stat simulation of one world.
 *
 * <p>Every method except {@link #snapshot}, {@link #activeEffects}, {@link #restore} and {@link
 * #updateConfig} must be called from the world's tick thread. Those four are safe from any thread:
 * lookups read the snapshot published at the end of the last tick, the others queue work for the
 * next tick.
 *
 * <p>Persistence is write-behind: a tick marks changed players dirty and every {@code
 * flushEveryTicks} ticks the dirty ones are handed to the {@link FlushQueue}. Suspension and
 * termination always write immediately. A non-persistent engine (world without storage) keeps
 * suspended players in memory instead.
 */
final class MetabolismEngine {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final UUID worldId;
  private final boolean persistent;
  private final FlushQueue flushes;
  private final ActivitySource activity;
  private final StatSummarySink summaries;
  private final Consumer<EffectTransitionEvent> transitions;
  private final StatSummaryFormatter formatter;

  private final AtomicReference<MetabolismConfig> pendingConfig = new AtomicReference<>();
  private final ConcurrentLinkedQueue<Restore> restores = new ConcurrentLinkedQueue<>();
  private final Map<UUID, PlayerStats> players = new LinkedHashMap<>();
  private final Map<UUID, StatVector> snapshots = new ConcurrentHashMap<>();
  private final Map<UUID, Set<String>> effectSnapshots = new ConcurrentHashMap<>();

  private MetabolismConfig config;
  private long ticks;

  MetabolismEngine(
      UUID worldId,
      MetabolismConfig config,
      boolean persistent,
      FlushQueue flushes,
      ActivitySource activity,
      StatSummarySink summaries,
      Consumer<EffectTransitionEvent> transitions) {
    this.worldId = Objects.requireNonNull(worldId, "worldId");
    this.config = Objects.requireNonNull(config, "config");
    this.persistent = persistent;
    this.flushes = Objects.requireNonNull(flushes, "flushes");
    this.activity = Objects.requireNonNull(activity, "activity");
    this.summaries = Objects.requireNonNull(summaries, "summaries");
    this.transitions = Objects.requireNonNull(transitions, "transitions");
    this.formatter = new StatSummaryFormatter();
  }

  UUID worldId() {
    return worldId;
  }

  boolean persistent() {
    return persistent;
  }

  MetabolismConfig config() {
    return config;
  }

  /**
   * Starts simulating a player.
   *
   * @param playerId player UUID
   * @param loaded stored values, empty for a first session
   * @param nowMillis time the first elapsed interval is measured from
   */
  void activate(UUID playerId, Optional<Map<String, Double>> loaded, long nowMillis) {
    PlayerStats existing = players.get(playerId);
    if (existing != null) {
      if (existing.state == PlayerSimulationState.SUSPENDED) {
        existing.state = PlayerSimulationState.ACTIVE;
        existing.lastTickMillis = nowMillis;
        LOG.debug("(vitalis) world={} player={} resumed from memory", worldId, playerId);
        publish(existing);
      }
      return;
    }
    PlayerStats stats =
        new PlayerStats(playerId, loaded.orElse(Map.of()), new EffectTracker(config.effects()));
    fillValues(stats);
    stats.state = PlayerSimulationState.ACTIVE;
    stats.lastTickMillis = nowMillis;
    players.put(playerId, stats);
    if (loaded.isEmpty() && persistent) {
      flushes.markDirty(key(stats));
    }
    publish(stats);
  }

  /**
   * Stops simulating a player.
   *
   * @return future of the final write; completed when nothing is written
   */
  CompletableFuture<Void> suspend(UUID playerId) {
    PlayerStats stats = players.get(playerId);
    if (stats == null || stats.state != PlayerSimulationState.ACTIVE) {
      return CompletableFuture.completedFuture(null);
    }
    stats.state = PlayerSimulationState.SUSPENDED;
    snapshots.remove(playerId);
    effectSnapshots.remove(playerId);
    if (!persistent) {
      return CompletableFuture.completedFuture(null);
    }
    players.remove(playerId);
    return flushes.flush(key(stats), stats.values);
  }

  /** Advances every active player to {@code nowMillis}. */
  void tick(long nowMillis) {
    applyPendingConfig();
    drainRestores();
    ticks++;
    for (PlayerStats stats : players.values()) {
      if (stats.state != PlayerSimulationState.ACTIVE) {
        continue;
      }
      try {
        advance(stats, nowMillis);
      } catch (RuntimeException e) {
        LOG.warn(
            "(vitalis) op={} world={} player={} message={}",
            "metabolism.tick",
            worldId,
            stats.playerId,
            e.getMessage(),
            e);
      }
    }
    if (persistent && ticks % config.flushEveryTicks() == 0) {
      flushDirty();
    }
  }

  /** Queues an adjustment applied at the start of the next tick. */
  void restore(UUID playerId, String stat, double amount) {
    if (!Double.isFinite(amount)) {
      throw new IllegalArgumentException("amount must be finite");
    }
    restores.add(new Restore(playerId, Objects.requireNonNull(stat, "stat"), amount));
  }

  /** Swaps the configuration at the start of the next tick. */
  void updateConfig(MetabolismConfig next) {
    pendingConfig.set(Objects.requireNonNull(next, "config"));
  }

  Optional<StatVector> snapshot(UUID playerId) {
    return Optional.ofNullable(snapshots.get(playerId));
  }

  Set<String> activeEffects(UUID playerId) {
    return effectSnapshots.getOrDefault(playerId, Set.of());
  }

  Optional<PlayerSimulationState> state(UUID playerId) {
    PlayerStats stats = players.get(playerId);
    return stats == null ? Optional.empty() : Optional.of(stats.state);
  }

  /** Writes every dirty active player, then retries failed writes of players that left. */
  CompletableFuture<Void> flushDirty() {
    if (!persistent) {
      return CompletableFuture.completedFuture(null);
    }
    List<CompletableFuture<Void>> writes = new ArrayList<>();
    for (PlayerStats stats : players.values()) {
      FlushKey key = key(stats);
      if (flushes.isDirty(key)) {
        writes.add(flushes.flush(key, stats.values));
      }
    }
    writes.add(flushes.retryFailed(worldId));
    return CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0]));
  }

  /** Terminates every player, writing each one a final time. */
  CompletableFuture<Void> terminateAll() {
    applyPendingConfig();
    drainRestores();
    List<CompletableFuture<Void>> writes = new ArrayList<>();
    for (PlayerStats stats : players.values()) {
      stats.state = PlayerSimulationState.TERMINATED;
      if (persistent) {
        writes.add(flushes.flush(key(stats), stats.values));
      }
    }
    players.clear();
    snapshots.clear();
    effectSnapshots.clear();
    if (persistent) {
      writes.add(flushes.retryFailed(worldId));
    }
    return CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0]));
  }

  private void advance(PlayerStats stats, long nowMillis) {
    long elapsedMillis = nowMillis - stats.lastTickMillis;
    if (elapsedMillis <= 0) {
      return;
    }
    stats.lastTickMillis = nowMillis;
    ActivityState current = classify(stats.playerId);
    double seconds = elapsedMillis / 1000.0;
    boolean changed = false;
    for (StatDefinition stat : config.stats()) {
      Double value = stats.values.get(stat.name());
      if (value == null) {
        continue;
      }
      double next = stat.clamp(value - stat.depletion(current, seconds));
      if (Double.compare(next, value) != 0) {
        stats.values.put(stat.name(), next);
        changed = true;
      }
    }
    if (changed && persistent) {
      flushes.markDirty(key(stats));
    }
    publish(stats);
  }

  private ActivityState classify(UUID playerId) {
    try {
      ActivityState state = activity.classify(worldId, playerId);
      return state == null ? ActivityState.IDLE : state;
    } catch (ActivityClassificationUnavailableException e) {
      LOG.debug(
          "(vitalis) code={} world={} player={} message={}",
          ErrorCode.ACTIVITY_CLASSIFICATION_UNAVAILABLE,
          worldId,
          playerId,
          e.getMessage());
      return ActivityState.IDLE;
    } catch (RuntimeException e) {
      LOG.warn(
          "(vitalis) code={} world={} player={} message={}",
          ErrorCode.ACTIVITY_CLASSIFICATION_UNAVAILABLE,
          worldId,
          playerId,
          e.getMessage());
      return ActivityState.IDLE;
    }
  }

  private void drainRestores() {
    Restore restore;
    while ((restore = restores.poll()) != null) {
      PlayerStats stats = players.get(restore.playerId());
      if (stats == null || stats.state != PlayerSimulationState.ACTIVE) {
        LOG.debug(
            "(vitalis) world={} player={} restore dropped; player not active",
            worldId,
            restore.playerId());
        continue;
      }
      Optional<StatDefinition> stat = config.stat(restore.stat());
      Double value = stats.values.get(restore.stat());
      if (stat.isEmpty() || value == null) {
        LOG.debug(
            "(vitalis) world={} player={} restore dropped; stat '{}' not simulated",
            worldId,
            restore.playerId(),
            restore.stat());
        continue;
      }
      stats.values.put(restore.stat(), stat.get().clamp(value + restore.amount()));
      if (persistent) {
        flushes.markDirty(key(stats));
      }
      publish(stats);
    }
  }

  private void applyPendingConfig() {
    MetabolismConfig next = pendingConfig.getAndSet(null);
    if (next == null) {
      return;
    }
    config = next;
    for (PlayerStats stats : players.values()) {
      try {
        for (Map.Entry<String, Double> entry : stats.values.entrySet()) {
          stats.stored.put(entry.getKey(), entry.getValue());
        }
        stats.values.clear();
        fillValues(stats);
        stats.effects = stats.effects.rebuild(config.effects());
        if (stats.state == PlayerSimulationState.ACTIVE) {
          publish(stats);
        }
      } catch (RuntimeException e) {
        LOG.warn(
            "(vitalis) op={} world={} player={} message={}",
            "metabolism.reload",
            worldId,
            stats.playerId,
            e.getMessage(),
            e);
      }
    }
    LOG.info("(vitalis) world={} metabolism config applied", worldId);
  }

  /** Enabled stats take their previous value (stored or in memory), clamped, or the default. */
  private void fillValues(PlayerStats stats) {
    for (StatDefinition stat : config.stats()) {
      if (!stat.enabled()) {
        continue;
      }
      Double previous = stats.stored.get(stat.name());
      stats.values.put(stat.name(), previous == null ? stat.initial() : stat.clamp(previous));
    }
  }

  private void publish(PlayerStats stats) {
    StatVector vector = new StatVector(stats.values);
    for (EffectTracker.Change change : stats.effects.evaluate(vector)) {
      transitions.accept(
          new EffectTransitionEvent(
              worldId,
              stats.playerId,
              change.effect().name(),
              change.effect().group(),
              change.transition() == Transition.ENTERED ? Change.ENTERED : Change.EXITED,
              change.value(),
              stats.effects.label(change.effect().group()).orElse(null)));
    }
    snapshots.put(stats.playerId, vector);
    Set<String> active = new LinkedHashSet<>(stats.effects.activeEffects());
    effectSnapshots.put(stats.playerId, Collections.unmodifiableSet(active));

    String summary = formatter.format(config.stats(), vector, stats.effects.labels());
    if (!summary.equals(stats.lastSummary)) {
      stats.lastSummary = summary;
      try {
        summaries.publish(worldId, stats.playerId, summary);
      } catch (RuntimeException e) {
        LOG.debug(
            "(vitalis) world={} player={} summary sink failed: {}",
            worldId,
            stats.playerId,
            e.getMessage());
      }
    }
  }

  private FlushKey key(PlayerStats stats) {
    return new FlushKey(worldId, stats.playerId);
  }

  private record Restore(UUID playerId, String stat, double amount) {}
}
