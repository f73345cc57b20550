/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/** Immutable, ordered snapshot of a player's named stat values in one world. */
public final class StatVector {
  private final Map<String, Double> values;

  public StatVector(Map<String, Double> values) {
    Objects.requireNonNull(values, "values");
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /** Stat names in configuration order. */
  public Set<String> names() {
    return values.keySet();
  }

  /** Value of a stat, or empty when the player has no such stat. */
  public OptionalDouble value(String stat) {
    Double v = values.get(stat);
    return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
  }

  /** Read-only view of all values. */
  public Map<String, Double> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof StatVector other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "StatVector" + values;
  }
}
