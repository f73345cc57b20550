/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.summary;

import dev.vitalis.api.StatVector;
import dev.vitalis.modules.metabolism.StatDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Input of one summary plus the lines written so far. */
public final class SummaryCursor {
  private final List<StatDefinition> stats;
  private final StatVector values;
  private final Map<String, String> labels;
  private final List<String> lines = new ArrayList<>();

  SummaryCursor(List<StatDefinition> stats, StatVector values, Map<String, String> labels) {
    this.stats = stats;
    this.values = values;
    this.labels = labels;
  }

  /** Configured stats in document order. */
  public List<StatDefinition> stats() {
    return stats;
  }

  public StatVector values() {
    return values;
  }

  /** Most severe active effect per group. */
  public Map<String, String> labels() {
    return labels;
  }

  public void line(String text) {
    lines.add(text);
  }

  String text() {
    return String.join("\n", lines);
  }
}
