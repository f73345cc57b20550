/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.summary;

import dev.vitalis.api.StatVector;
import dev.vitalis.modules.metabolism.StatDefinition;
import java.util.List;
import java.util.Map;

/** Composes the human-readable summary from a fixed, ordered list of sections. */
public final class StatSummaryFormatter {
  private final List<SummarySection> sections;

  /** Stat bars followed by effect labels. */
  public StatSummaryFormatter() {
    this(List.of(new StatBarsSection(), new EffectsSection()));
  }

  public StatSummaryFormatter(List<SummarySection> sections) {
    this.sections = List.copyOf(sections);
  }

  public String format(List<StatDefinition> stats, StatVector values, Map<String, String> labels) {
    SummaryCursor cursor = new SummaryCursor(stats, values, labels);
    for (SummarySection section : sections) {
      section.build(cursor);
    }
    return cursor.text();
  }
}
