/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

/**
 * Lifecycle of one player inside one world's engine.
 *
 * <p>{@code UNINITIALIZED -> ACTIVE -> SUSPENDED -> ACTIVE ... -> TERMINATED}
 */
public enum PlayerSimulationState {
  UNINITIALIZED,
  ACTIVE,
  /** Disconnected; excluded from ticks. */
  SUSPENDED,
  /** World or engine torn down. */
  TERMINATED
}
