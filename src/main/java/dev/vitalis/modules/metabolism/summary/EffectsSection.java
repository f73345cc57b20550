/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.summary;

/** Active effect labels, one per group. Writes nothing when no effect is active. */
public final class EffectsSection implements SummarySection {

  @Override
  public void build(SummaryCursor cursor) {
    if (cursor.labels().isEmpty()) {
      return;
    }
    cursor.line("effects: " + String.join(", ", cursor.labels().values()));
  }
}
