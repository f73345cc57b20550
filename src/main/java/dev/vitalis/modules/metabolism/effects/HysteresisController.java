/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.effects;

import java.util.Optional;

/**
 * Threshold state machine with distinct enter and exit boundaries.
 *
 * <p>A {@link Direction#LOW} controller activates once the value falls to {@code enter} and
 * deactivates only once it rises to {@code exit}, where {@code exit > enter}. Values strictly
 * between the two never change the state, so input oscillating inside the band cannot flicker the
 * effect. {@link Direction#HIGH} is the mirror image.
 *
 * <p>Instances are not thread safe; each belongs to one player on one world's tick thread.
 */
public final class HysteresisController {

  /** Which side of the band activates the effect. */
  public enum Direction {
    /** Activates at or below {@code enter}, exits at or above {@code exit}. */
    LOW,
    /** Activates at or above {@code enter}, exits at or below {@code exit}. */
    HIGH
  }

  /** State change reported by {@link #evaluate(double)}. */
  public enum Transition {
    ENTERED,
    EXITED
  }

  private final double enter;
  private final double exit;
  private final Direction direction;
  private boolean active;

  /**
   * @throws IllegalArgumentException when the thresholds are not finite or the exit boundary is
   *     not past the enter boundary in the deactivating direction
   */
  public HysteresisController(double enter, double exit, Direction direction) {
    if (!Double.isFinite(enter) || !Double.isFinite(exit)) {
      throw new IllegalArgumentException("thresholds must be finite");
    }
    if (direction == null) {
      throw new IllegalArgumentException("direction must be provided");
    }
    boolean ordered = direction == Direction.LOW ? exit > enter : exit < enter;
    if (!ordered) {
      throw new IllegalArgumentException(
          "exit " + exit + " must lie " + (direction == Direction.LOW ? "above" : "below")
              + " enter " + enter);
    }
    this.enter = enter;
    this.exit = exit;
    this.direction = direction;
  }

  /**
   * Feeds the next value.
   *
   * @return the transition caused by this value, or empty when the state did not change (always
   *     empty for NaN)
   */
  public Optional<Transition> evaluate(double value) {
    if (Double.isNaN(value)) {
      return Optional.empty();
    }
    if (!active && crossesEnter(value)) {
      active = true;
      return Optional.of(Transition.ENTERED);
    }
    if (active && crossesExit(value)) {
      active = false;
      return Optional.of(Transition.EXITED);
    }
    return Optional.empty();
  }

  private boolean crossesEnter(double value) {
    return direction == Direction.LOW ? value <= enter : value >= enter;
  }

  private boolean crossesExit(double value) {
    return direction == Direction.LOW ? value >= exit : value <= exit;
  }

  public boolean isActive() {
    return active;
  }

  /** Restores a previously held state without emitting a transition. */
  void restore(boolean wasActive) {
    this.active = wasActive;
  }

  public double enter() {
    return enter;
  }

  public double exit() {
    return exit;
  }

  public Direction direction() {
    return direction;
  }
}
