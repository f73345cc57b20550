/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.effects;

import dev.vitalis.api.StatVector;
import dev.vitalis.modules.metabolism.effects.HysteresisController.Transition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * All effect controllers of one player.
 *
 * <p>Controllers are evaluated grouped, lowest severity first, so the most severe active effect of
 * a group is deterministic whenever a single label is needed.
 */
public final class EffectTracker {

  /**
   * One transition caused by a tick.
   *
   * @param effect effect that changed
   * @param transition entered or exited
   * @param value stat value that caused it
   */
  public record Change(EffectDefinition effect, Transition transition, double value) {}

  private static final Comparator<EffectDefinition> EVALUATION_ORDER =
      Comparator.comparing(EffectDefinition::group)
          .thenComparingInt(EffectDefinition::severity)
          .thenComparing(EffectDefinition::name);

  private final List<Slot> slots = new ArrayList<>();

  public EffectTracker(List<EffectDefinition> effects) {
    this(effects, Set.of());
  }

  /**
   * @param effects effect definitions
   * @param active names of effects that stay active without emitting an {@code ENTERED}
   */
  public EffectTracker(List<EffectDefinition> effects, Set<String> active) {
    List<EffectDefinition> sorted = new ArrayList<>(effects);
    sorted.sort(EVALUATION_ORDER);
    for (EffectDefinition effect : sorted) {
      HysteresisController controller = effect.newController();
      controller.restore(active.contains(effect.name()));
      slots.add(new Slot(effect, controller));
    }
  }

  /**
   * Rebuilds this tracker for new definitions, carrying over active flags by effect name.
   *
   * @param effects new definitions
   * @return fresh tracker
   */
  public EffectTracker rebuild(List<EffectDefinition> effects) {
    return new EffectTracker(effects, activeEffects());
  }

  /**
   * Feeds current values to every controller whose stat is present in {@code values}. Stats absent
   * from the vector (disabled) keep their effects frozen.
   *
   * @return transitions in evaluation order
   */
  public List<Change> evaluate(StatVector values) {
    List<Change> changes = new ArrayList<>();
    for (Slot slot : slots) {
      OptionalDouble value = values.value(slot.effect.stat());
      if (value.isEmpty()) {
        continue;
      }
      Optional<Transition> transition = slot.controller.evaluate(value.getAsDouble());
      if (transition.isPresent()) {
        changes.add(new Change(slot.effect, transition.get(), value.getAsDouble()));
      }
    }
    return changes;
  }

  /** Names of active effects in evaluation order. */
  public Set<String> activeEffects() {
    Set<String> active = new LinkedHashSet<>();
    for (Slot slot : slots) {
      if (slot.controller.isActive()) {
        active.add(slot.effect.name());
      }
    }
    return active;
  }

  /** Most severe active effect of a group. */
  public Optional<String> label(String group) {
    String label = null;
    for (Slot slot : slots) {
      if (slot.effect.group().equals(group) && slot.controller.isActive()) {
        label = slot.effect.name();
      }
    }
    return Optional.ofNullable(label);
  }

  /** Most severe active effect of every group that has one, in group order. */
  public Map<String, String> labels() {
    Map<String, String> labels = new LinkedHashMap<>();
    for (Slot slot : slots) {
      if (slot.controller.isActive()) {
        labels.put(slot.effect.group(), slot.effect.name());
      }
    }
    return labels;
  }

  private record Slot(EffectDefinition effect, HysteresisController controller) {}
}
