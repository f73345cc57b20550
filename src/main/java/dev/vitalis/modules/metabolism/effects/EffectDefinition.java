/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.effects;

import dev.vitalis.modules.metabolism.effects.HysteresisController.Direction;
import java.util.Objects;

/**
 * A named effect driven by one stat.
 *
 * @param name unique effect name, e.g. {@code "starving"}
 * @param stat stat feeding the controller
 * @param group effects sharing a label, e.g. {@code "hunger"}
 * @param severity order inside the group; higher wins the label
 * @param direction which side of the band activates the effect
 * @param enter activation threshold
 * @param exit deactivation threshold
 */
public record EffectDefinition(
    String name,
    String stat,
    String group,
    int severity,
    Direction direction,
    double enter,
    double exit) {

  public EffectDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(stat, "stat");
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(direction, "direction");
  }

  /** Width of the dead zone between the two thresholds. */
  public double band() {
    return Math.abs(exit - enter);
  }

  HysteresisController newController() {
    return new HysteresisController(enter, exit, direction);
  }
}
