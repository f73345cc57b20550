/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.UUID;

/**
 * Fire-and-forget channel for human-readable stat summaries (HUD lines, action bars).
 *
 * <p>Called from the tick thread; implementations must not block.
 */
@FunctionalInterface
public interface StatSummarySink {
  void publish(UUID worldId, UUID playerId, String summary);

  /** Sink that discards every summary. */
  static StatSummarySink discard() {
    return (worldId, playerId, summary) -> {};
  }
}
