/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.modules.metabolism.effects.EffectTracker;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Mutable simulation record of one player. Owned by the world's tick thread. */
final class PlayerStats {
  final UUID playerId;
  /** Enabled stats, in configuration order. */
  final Map<String, Double> values = new LinkedHashMap<>();
  /** Values loaded from storage, consulted when a disabled stat is enabled again. */
  final Map<String, Double> stored;
  EffectTracker effects;
  PlayerSimulationState state = PlayerSimulationState.UNINITIALIZED;
  long lastTickMillis;
  String lastSummary;

  PlayerStats(UUID playerId, Map<String, Double> stored, EffectTracker effects) {
    this.playerId = playerId;
    this.stored = new LinkedHashMap<>(stored);
    this.effects = effects;
  }
}
