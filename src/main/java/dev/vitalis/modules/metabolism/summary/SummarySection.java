/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.summary;

/** One part of the text pushed to the host's summary sink. */
public interface SummarySection {
  void build(SummaryCursor cursor);
}
