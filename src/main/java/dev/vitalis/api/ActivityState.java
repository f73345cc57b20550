/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.Locale;
import java.util.Optional;

/** Discrete movement classification supplied by the host for each tick. */
public enum ActivityState {
  IDLE,
  WALKING,
  SPRINTING,
  SWIMMING,
  COMBAT;

  /** Lowercase key used in configuration documents. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a configuration key such as {@code "sprinting"}.
   *
   * @param key case-insensitive activity name
   * @return matching state, or empty when unknown
   */
  public static Optional<ActivityState> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String normalized = key.trim().toUpperCase(Locale.ROOT);
    for (ActivityState state : values()) {
      if (state.name().equals(normalized)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }
}
