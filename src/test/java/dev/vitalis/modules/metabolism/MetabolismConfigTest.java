/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import dev.vitalis.api.ActivityState;
import dev.vitalis.core.config.ConfigStore;
import dev.vitalis.core.config.Json5;
import dev.vitalis.modules.metabolism.effects.HysteresisController.Direction;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetabolismConfigTest {
  private static final double EPSILON = 1e-9;

  private static final String V1_DOCUMENT =
      """
      {
        enabled: true,
        saveIntervalSeconds: 60,
        hunger: {
          baseDepletionRateSeconds: 480,
          activityMultipliers: { idle: 1.0, sprinting: 3.0 }
        },
        thirst: { baseDepletionRateSeconds: 200 },
        energy: { enabled: false },
        operatorNote: "keep"
      }
      """;

  @Test
  void defaultsShipThreeStatsAndTwelveEffects() {
    MetabolismConfig cfg = MetabolismConfig.defaults();

    assertTrue(cfg.enabled());
    assertEquals(1000L, cfg.tickPeriodMs());
    assertEquals(30, cfg.flushEveryTicks());
    assertEquals(3, cfg.stats().size());
    assertEquals(12, cfg.effects().size());
    assertEquals(6000.0 / 1440.0, cfg.stat("hunger").orElseThrow().ratePerMinute(), EPSILON);
    assertEquals(0.3, cfg.stat("energy").orElseThrow().multiplier(ActivityState.IDLE));
    assertTrue(
        cfg.effects().stream()
            .filter(e -> e.direction() == Direction.LOW)
            .allMatch(e -> e.band() >= cfg.hysteresisEpsilon()));
  }

  @Test
  void legacyDocumentMigratesToCurrentLayout(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    Files.writeString(store.path(MetabolismConfig.NAME), V1_DOCUMENT);

    MetabolismConfig cfg = store.load(MetabolismConfig.SCHEMA);

    assertTrue(store.lastFailure(MetabolismConfig.NAME).isEmpty());
    assertEquals(6000.0 / 1440.0, cfg.stat("hunger").orElseThrow().ratePerMinute(), EPSILON);
    assertEquals(3.0, cfg.stat("hunger").orElseThrow().multiplier(ActivityState.SPRINTING));
    assertEquals(30.0, cfg.stat("thirst").orElseThrow().ratePerMinute(), EPSILON);
    assertFalse(cfg.stat("energy").orElseThrow().enabled());
    assertEquals(2.5, cfg.stat("energy").orElseThrow().ratePerMinute(), EPSILON);
    assertEquals(60, cfg.flushEveryTicks());
    assertEquals(12, cfg.effects().size());

    JsonObject written = Json5.parse(Files.readString(store.path(MetabolismConfig.NAME)));
    assertEquals(3, written.get(ConfigStore.VERSION_KEY).getAsInt());
    assertEquals("keep", written.get("operatorNote").getAsString());
    assertFalse(written.has("hunger"));
    assertFalse(written.has("saveIntervalSeconds"));
    assertEquals(V1_DOCUMENT, Files.readString(store.backupPath(MetabolismConfig.NAME, 1)));
  }

  @Test
  void rebalanceKeepsCustomRates() {
    JsonObject doc =
        Json5.parse(
            "{ hunger: { baseDepletionRateSeconds: 500 },"
                + " thirst: { baseDepletionRateSeconds: 90 } }");

    JsonObject migrated = MetabolismConfig.rebalanceDepletion(doc);

    assertEquals(
        1440.0, migrated.getAsJsonObject("hunger").get("baseDepletionRateSeconds").getAsDouble());
    assertEquals(
        90.0, migrated.getAsJsonObject("thirst").get("baseDepletionRateSeconds").getAsDouble());
    assertFalse(migrated.has("energy"));
  }

  @Test
  void effectBandNarrowerThanEpsilonIsRejected() {
    JsonObject doc = MetabolismConfig.SCHEMA.defaults();
    doc.addProperty("hysteresisEpsilon", 20.0);

    IllegalStateException error =
        assertThrows(IllegalStateException.class, () -> MetabolismConfig.SCHEMA.decode(doc));
    assertTrue(error.getMessage().contains("exit must lie at least"));
  }

  @Test
  void unknownActivityIsRejected() {
    JsonObject doc = MetabolismConfig.SCHEMA.defaults();
    doc.getAsJsonObject("stats")
        .getAsJsonObject("hunger")
        .getAsJsonObject("activityMultipliers")
        .addProperty("flying", 2.0);

    IllegalStateException error =
        assertThrows(IllegalStateException.class, () -> MetabolismConfig.SCHEMA.decode(doc));
    assertTrue(error.getMessage().contains("flying"));
  }

  @Test
  void effectOnUnknownStatIsRejected() {
    JsonObject doc =
        Json5.parse(
            """
            {
              stats: { hunger: { ratePerMinute: 1.0 } },
              effects: [ { name: "parched", stat: "thirst", enter: 25, exit: 35 } ]
            }
            """);

    assertThrows(IllegalStateException.class, () -> MetabolismConfig.SCHEMA.decode(doc));
  }

  @Test
  void saveRoundTripsTunables(@TempDir Path dir) {
    ConfigStore store = new ConfigStore(dir);
    MetabolismConfig loaded = store.load(MetabolismConfig.SCHEMA);
    MetabolismConfig slower =
        new MetabolismConfig(
            loaded.enabled(),
            2_000L,
            loaded.flushEveryTicks(),
            loaded.hysteresisEpsilon(),
            loaded.stats(),
            loaded.effects());

    store.save(MetabolismConfig.SCHEMA, slower);
    MetabolismConfig reloaded = store.reload(MetabolismConfig.SCHEMA);

    assertEquals(2_000L, reloaded.tickPeriodMs());
    assertEquals(loaded.effects(), reloaded.effects());
    assertEquals(loaded.stats(), reloaded.stats());
  }
}
