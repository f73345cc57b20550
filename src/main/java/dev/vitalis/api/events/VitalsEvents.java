/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api.events;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Core events emitted by Vitalis.
 *
 * <p>Handlers are invoked asynchronously and in order per player. Each registration returns an
 * {@link AutoCloseable} that unsubscribes the handler.
 */
public interface VitalsEvents {

  /**
   * Subscribes to effect transitions.
   *
   * @param handler callback receiving transitions
   * @return handle whose {@code close()} unsubscribes
   */
  AutoCloseable onEffectTransition(Consumer<EffectTransitionEvent> handler);

  /** Direction of an effect transition. */
  enum Change {
    ENTERED,
    EXITED
  }

  /**
   * Emitted when a threshold effect activates or deactivates.
   *
   * @param worldId world UUID
   * @param playerId player UUID
   * @param effect effect name, e.g. {@code "starving"}
   * @param group effect group, e.g. {@code "hunger"}
   * @param change entered or exited
   * @param value stat value that triggered the transition
   * @param groupLabel most severe effect still active in the group after this transition, or
   *     {@code null} when none
   */
  record EffectTransitionEvent(
      UUID worldId,
      UUID playerId,
      String effect,
      String group,
      Change change,
      double value,
      String groupLabel) {}
}
