/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.UUID;

/**
 * Host-provided movement classifier, queried once per player per tick from the world's tick
 * thread.
 *
 * <p>Implementations may return {@code null} or throw {@link
 * ActivityClassificationUnavailableException} when no signal is available; the engine treats both
 * as {@link ActivityState#IDLE}.
 */
@FunctionalInterface
public interface ActivitySource {
  ActivityState classify(UUID worldId, UUID playerId);

  /** Source that always reports idle. */
  static ActivitySource idle() {
    return (worldId, playerId) -> ActivityState.IDLE;
  }
}
