/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.summary;

import dev.vitalis.modules.metabolism.StatDefinition;
import java.util.Locale;
import java.util.OptionalDouble;

/** One bar per simulated stat, e.g. {@code hunger [########--] 83}. */
public final class StatBarsSection implements SummarySection {
  static final int WIDTH = 10;

  @Override
  public void build(SummaryCursor cursor) {
    for (StatDefinition stat : cursor.stats()) {
      OptionalDouble value = cursor.values().value(stat.name());
      if (value.isEmpty()) {
        continue;
      }
      double fraction = (value.getAsDouble() - stat.min()) / (stat.max() - stat.min());
      int filled = (int) Math.round(Math.max(0.0, Math.min(1.0, fraction)) * WIDTH);
      cursor.line(
          String.format(
              Locale.ROOT,
              "%s [%s%s] %.0f",
              stat.name(),
              "#".repeat(filled),
              "-".repeat(WIDTH - filled),
              value.getAsDouble()));
    }
  }
}
