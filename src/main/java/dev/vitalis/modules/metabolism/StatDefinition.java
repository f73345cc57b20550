/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.ActivityState;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables of one simulated stat.
 *
 * @param name stat name, e.g. {@code "hunger"}
 * @param enabled disabled stats are skipped by ticks but keep their stored value
 * @param min lower bound
 * @param max upper bound
 * @param initial value for players without a stored vector
 * @param ratePerMinute points lost per minute at multiplier 1.0
 * @param activityMultipliers per-activity factor; missing activities use 1.0
 */
public record StatDefinition(
    String name,
    boolean enabled,
    double min,
    double max,
    double initial,
    double ratePerMinute,
    Map<ActivityState, Double> activityMultipliers) {

  public StatDefinition {
    Objects.requireNonNull(name, "name");
    activityMultipliers = Map.copyOf(activityMultipliers);
  }

  public double multiplier(ActivityState activity) {
    Double multiplier = activityMultipliers.get(activity);
    return multiplier == null ? 1.0 : multiplier;
  }

  /** Points lost over {@code elapsedSeconds} while performing {@code activity}. */
  public double depletion(ActivityState activity, double elapsedSeconds) {
    return ratePerMinute * multiplier(activity) * elapsedSeconds / 60.0;
  }

  /** Clamps into {@code [min, max]}; NaN maps to {@code min}. */
  public double clamp(double value) {
    if (Double.isNaN(value)) {
      return min;
    }
    return Math.max(min, Math.min(max, value));
  }
}
