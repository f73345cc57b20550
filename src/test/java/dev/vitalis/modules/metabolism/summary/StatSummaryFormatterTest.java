/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism.summary;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.vitalis.api.StatVector;
import dev.vitalis.modules.metabolism.StatDefinition;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatSummaryFormatterTest {
  private static final List<StatDefinition> STATS =
      List.of(
          new StatDefinition("hunger", true, 0.0, 100.0, 100.0, 1.0, Map.of()),
          new StatDefinition("thirst", true, 0.0, 100.0, 100.0, 1.0, Map.of()),
          new StatDefinition("energy", false, 0.0, 100.0, 100.0, 1.0, Map.of()));

  @Test
  void rendersOneBarPerSimulatedStat() {
    Map<String, Double> values = new LinkedHashMap<>();
    values.put("hunger", 83.4);
    values.put("thirst", 0.0);

    String text = new StatSummaryFormatter().format(STATS, new StatVector(values), Map.of());

    assertEquals("hunger [########--] 83\nthirst [----------] 0", text);
  }

  @Test
  void appendsActiveEffectLabels() {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("hunger", "starving");
    labels.put("thirst", "parched");

    String text =
        new StatSummaryFormatter()
            .format(STATS, new StatVector(Map.of("hunger", 20.0)), labels);

    assertEquals("hunger [##--------] 20\neffects: starving, parched", text);
  }

  @Test
  void customSectionsReplaceTheDefaults() {
    SummarySection compact =
        cursor -> cursor.line(String.valueOf(cursor.values().names().size()) + " stats");

    String text =
        new StatSummaryFormatter(List.of(compact))
            .format(STATS, new StatVector(Map.of("hunger", 1.0, "thirst", 2.0)), Map.of());

    assertEquals("2 stats", text);
  }
}
