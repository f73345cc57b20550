/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import static dev.vitalis.core.config.Json5.optBoolean;
import static dev.vitalis.core.config.Json5.optDouble;
import static dev.vitalis.core.config.Json5.optInt;
import static dev.vitalis.core.config.Json5.optLong;
import static dev.vitalis.core.config.Json5.optObject;
import static dev.vitalis.core.config.Json5.optString;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import dev.vitalis.api.ActivityState;
import dev.vitalis.core.config.ConfigMigration;
import dev.vitalis.core.config.ConfigSchema;
import dev.vitalis.core.config.Json5;
import dev.vitalis.modules.metabolism.effects.EffectDefinition;
import dev.vitalis.modules.metabolism.effects.HysteresisController.Direction;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Metabolism tunables loaded from {@code config/metabolism.json5}.
 *
 * <p>Version history:
 *
 * <ul>
 *   <li>v1: aggressive drain (480s/360s/600s to empty) with top-level stat blocks.
 *   <li>v2: balanced drain (1440s/1080s/2400s); customised values are kept.
 *   <li>v3: stats move under {@code stats{}}, drain is expressed as {@code ratePerMinute}, effects
 *       become configurable.
 * </ul>
 */
public final class MetabolismConfig {

  /** Document name inside the config directory. */
  public static final String NAME = "metabolism";

  /** Version written by this build. */
  public static final int CURRENT_VERSION = 3;

  /** Schema used to load this document through a {@code ConfigStore}. */
  public static final ConfigSchema<MetabolismConfig> SCHEMA = new Schema();

  static final String TEMPLATE =
      """
      // Vitalis metabolism (JSON5 with comments)
      {
        configVersion: 3,
        enabled: true,
        // simulation period per world
        tickPeriodMs: 1000,
        // dirty players are persisted every N ticks; leaving and shutdown always flush
        flushEveryTicks: 30,
        // minimum distance between enter and exit of every effect
        hysteresisEpsilon: 1.0,
        stats: {
          // ratePerMinute: points lost per minute at multiplier 1.0 (6000 / seconds-to-empty)
          hunger: {
            enabled: true, min: 0.0, max: 100.0, initial: 100.0,
            ratePerMinute: 4.166666666666667,
            activityMultipliers: { idle: 1.0, walking: 1.3, sprinting: 2.0, swimming: 1.8, combat: 2.5 }
          },
          thirst: {
            enabled: true, min: 0.0, max: 100.0, initial: 100.0,
            ratePerMinute: 5.555555555555555,
            activityMultipliers: { idle: 1.0, walking: 1.2, sprinting: 1.8, swimming: 1.3, combat: 2.2 }
          },
          energy: {
            enabled: true, min: 0.0, max: 100.0, initial: 100.0,
            ratePerMinute: 2.5,
            activityMultipliers: { idle: 0.3, walking: 1.0, sprinting: 2.0, swimming: 1.6, combat: 2.2 }
          }
        },
        // direction "low" activates at or below enter and clears at or above exit; "high" mirrors
        effects: [
          { name: "peckish", stat: "hunger", group: "hunger", severity: 1, direction: "low", enter: 75.0, exit: 85.0 },
          { name: "hungry", stat: "hunger", group: "hunger", severity: 2, direction: "low", enter: 50.0, exit: 60.0 },
          { name: "starving", stat: "hunger", group: "hunger", severity: 3, direction: "low", enter: 25.0, exit: 35.0 },
          { name: "thirsty", stat: "thirst", group: "thirst", severity: 1, direction: "low", enter: 75.0, exit: 85.0 },
          { name: "parched", stat: "thirst", group: "thirst", severity: 2, direction: "low", enter: 50.0, exit: 60.0 },
          { name: "dehydrated", stat: "thirst", group: "thirst", severity: 3, direction: "low", enter: 25.0, exit: 35.0 },
          { name: "drowsy", stat: "energy", group: "energy", severity: 1, direction: "low", enter: 75.0, exit: 85.0 },
          { name: "tired", stat: "energy", group: "energy", severity: 2, direction: "low", enter: 50.0, exit: 60.0 },
          { name: "exhausted", stat: "energy", group: "energy", severity: 3, direction: "low", enter: 25.0, exit: 35.0 },
          { name: "well_fed", stat: "hunger", group: "well_fed", severity: 1, direction: "high", enter: 90.0, exit: 80.0 },
          { name: "hydrated", stat: "thirst", group: "hydrated", severity: 1, direction: "high", enter: 90.0, exit: 80.0 },
          { name: "energized", stat: "energy", group: "energized", severity: 1, direction: "high", enter: 90.0, exit: 80.0 }
        ]
      }
      """;

  private static final Map<String, Double> V1_SECONDS =
      Map.of("hunger", 480.0, "thirst", 360.0, "energy", 600.0);
  private static final Map<String, Double> V2_SECONDS =
      Map.of("hunger", 1440.0, "thirst", 1080.0, "energy", 2400.0);
  private static final List<String> LEGACY_STATS = List.of("hunger", "thirst", "energy");

  private final boolean enabled;
  private final long tickPeriodMs;
  private final int flushEveryTicks;
  private final double hysteresisEpsilon;
  private final List<StatDefinition> stats;
  private final List<EffectDefinition> effects;

  public MetabolismConfig(
      boolean enabled,
      long tickPeriodMs,
      int flushEveryTicks,
      double hysteresisEpsilon,
      List<StatDefinition> stats,
      List<EffectDefinition> effects) {
    this.enabled = enabled;
    this.tickPeriodMs = tickPeriodMs;
    this.flushEveryTicks = flushEveryTicks;
    this.hysteresisEpsilon = hysteresisEpsilon;
    this.stats = List.copyOf(stats);
    this.effects = List.copyOf(effects);
  }

  /** Built-in defaults. */
  public static MetabolismConfig defaults() {
    return SCHEMA.decode(SCHEMA.defaults());
  }

  public boolean enabled() {
    return enabled;
  }

  public long tickPeriodMs() {
    return tickPeriodMs;
  }

  public int flushEveryTicks() {
    return flushEveryTicks;
  }

  public double hysteresisEpsilon() {
    return hysteresisEpsilon;
  }

  /** All stats in document order, disabled ones included. */
  public List<StatDefinition> stats() {
    return stats;
  }

  public Optional<StatDefinition> stat(String name) {
    return stats.stream().filter(s -> s.name().equals(name)).findFirst();
  }

  public List<EffectDefinition> effects() {
    return effects;
  }

  // v1 -> v2

  static JsonObject rebalanceDepletion(JsonObject doc) {
    for (String stat : LEGACY_STATS) {
      JsonObject block = optObject(doc, stat);
      if (block == null) {
        continue;
      }
      JsonElement current = block.get("baseDepletionRateSeconds");
      double old = V1_SECONDS.get(stat);
      if (current == null
          || current.isJsonNull()
          || Math.abs(current.getAsDouble() - old) <= old * 0.1) {
        block.addProperty("baseDepletionRateSeconds", V2_SECONDS.get(stat));
      }
    }
    return doc;
  }

  // v2 -> v3

  static JsonObject moveStatsAndSeedEffects(JsonObject doc) {
    JsonObject template = Json5.parse(TEMPLATE);
    JsonObject defaultStats = template.getAsJsonObject("stats");
    JsonObject stats = optObject(doc, "stats");
    if (stats == null) {
      stats = new JsonObject();
    }
    for (String stat : LEGACY_STATS) {
      JsonObject converted = defaultStats.getAsJsonObject(stat).deepCopy();
      JsonElement legacy = doc.remove(stat);
      if (legacy != null && legacy.isJsonObject()) {
        JsonObject old = legacy.getAsJsonObject();
        converted.addProperty("enabled", optBoolean(old, "enabled", true));
        double seconds = optDouble(old, "baseDepletionRateSeconds", V2_SECONDS.get(stat));
        if (seconds > 0) {
          converted.addProperty("ratePerMinute", 6000.0 / seconds);
        }
        JsonObject multipliers = optObject(old, "activityMultipliers");
        if (multipliers != null && multipliers.size() > 0) {
          converted.add("activityMultipliers", multipliers.deepCopy());
        }
      }
      if (!stats.has(stat)) {
        stats.add(stat, converted);
      }
    }
    doc.add("stats", stats);

    JsonElement saveInterval = doc.remove("saveIntervalSeconds");
    if (!doc.has("flushEveryTicks")) {
      int ticks =
          saveInterval != null && saveInterval.isJsonPrimitive()
              ? Math.max(1, saveInterval.getAsInt())
              : template.get("flushEveryTicks").getAsInt();
      doc.addProperty("flushEveryTicks", ticks);
    }
    for (String key : List.of("tickPeriodMs", "hysteresisEpsilon", "effects")) {
      if (!doc.has(key)) {
        doc.add(key, template.get(key).deepCopy());
      }
    }
    return doc;
  }

  private static MetabolismConfig parse(JsonObject root) {
    boolean enabled = optBoolean(root, "enabled", true);
    long tickPeriodMs = optLong(root, "tickPeriodMs", 1000L);
    int flushEveryTicks = optInt(root, "flushEveryTicks", 30);
    double epsilon = optDouble(root, "hysteresisEpsilon", 1.0);
    if (tickPeriodMs < 50 || tickPeriodMs > 60_000) {
      throw new IllegalStateException("metabolism.tickPeriodMs must be between 50 and 60000");
    }
    if (flushEveryTicks < 1 || flushEveryTicks > 3_600) {
      throw new IllegalStateException("metabolism.flushEveryTicks must be between 1 and 3600");
    }
    if (!(epsilon > 0) || epsilon > 50) {
      throw new IllegalStateException("metabolism.hysteresisEpsilon must be in (0, 50]");
    }

    JsonObject statsObj = optObject(root, "stats");
    if (statsObj == null || statsObj.size() == 0) {
      throw new IllegalStateException("metabolism.stats must define at least one stat");
    }
    List<StatDefinition> stats = new ArrayList<>();
    for (Map.Entry<String, JsonElement> entry : statsObj.entrySet()) {
      if (!entry.getValue().isJsonObject()) {
        throw new IllegalStateException(
            "metabolism.stats." + entry.getKey() + " must be an object");
      }
      stats.add(parseStat(entry.getKey(), entry.getValue().getAsJsonObject()));
    }

    List<EffectDefinition> effects = new ArrayList<>();
    JsonElement effectsEl = root.get("effects");
    if (effectsEl != null && !effectsEl.isJsonNull()) {
      if (!effectsEl.isJsonArray()) {
        throw new IllegalStateException("metabolism.effects must be an array");
      }
      Set<String> names = new HashSet<>();
      JsonArray array = effectsEl.getAsJsonArray();
      for (int i = 0; i < array.size(); i++) {
        if (!array.get(i).isJsonObject()) {
          throw new IllegalStateException("metabolism.effects[" + i + "] must be an object");
        }
        EffectDefinition effect = parseEffect(i, array.get(i).getAsJsonObject(), stats, epsilon);
        if (!names.add(effect.name())) {
          throw new IllegalStateException(
              "metabolism.effects duplicate name '" + effect.name() + "'");
        }
        effects.add(effect);
      }
    }
    return new MetabolismConfig(enabled, tickPeriodMs, flushEveryTicks, epsilon, stats, effects);
  }

  private static StatDefinition parseStat(String name, JsonObject obj) {
    String key = "metabolism.stats." + name;
    double min = optDouble(obj, "min", 0.0);
    double max = optDouble(obj, "max", 100.0);
    double initial = optDouble(obj, "initial", max);
    double rate = optDouble(obj, "ratePerMinute", 1.0);
    if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
      throw new IllegalStateException(key + ".min must be below max");
    }
    if (initial < min || initial > max) {
      throw new IllegalStateException(key + ".initial must lie within [min, max]");
    }
    if (!Double.isFinite(rate) || rate < 0) {
      throw new IllegalStateException(key + ".ratePerMinute must be a non-negative number");
    }
    Map<ActivityState, Double> multipliers = new EnumMap<>(ActivityState.class);
    JsonObject multObj = optObject(obj, "activityMultipliers");
    if (multObj != null) {
      for (Map.Entry<String, JsonElement> entry : multObj.entrySet()) {
        String activityKey = entry.getKey();
        ActivityState activity =
            ActivityState.fromKey(activityKey)
                .orElseThrow(
                    () ->
                        new IllegalStateException(
                            key
                                + ".activityMultipliers has unknown activity '"
                                + activityKey
                                + "'"));
        double value = entry.getValue().getAsDouble();
        if (!Double.isFinite(value) || value < 0) {
          throw new IllegalStateException(
              key + ".activityMultipliers." + entry.getKey() + " must be a non-negative number");
        }
        multipliers.put(activity, value);
      }
    }
    return new StatDefinition(
        name, optBoolean(obj, "enabled", true), min, max, initial, rate, multipliers);
  }

  private static EffectDefinition parseEffect(
      int index, JsonObject obj, List<StatDefinition> stats, double epsilon) {
    String key = "metabolism.effects[" + index + "]";
    String name = optString(obj, "name", "");
    if (name.isBlank()) {
      throw new IllegalStateException(key + ".name must be provided");
    }
    String stat = optString(obj, "stat", "");
    if (stats.stream().noneMatch(s -> s.name().equals(stat))) {
      throw new IllegalStateException(key + ".stat '" + stat + "' is not a configured stat");
    }
    String directionName = optString(obj, "direction", "low").trim().toLowerCase(Locale.ROOT);
    Direction direction;
    if ("low".equals(directionName)) {
      direction = Direction.LOW;
    } else if ("high".equals(directionName)) {
      direction = Direction.HIGH;
    } else {
      throw new IllegalStateException(key + ".direction must be \"low\" or \"high\"");
    }
    double enter = optDouble(obj, "enter", Double.NaN);
    double exit = optDouble(obj, "exit", Double.NaN);
    if (!Double.isFinite(enter) || !Double.isFinite(exit)) {
      throw new IllegalStateException(key + " requires numeric enter and exit");
    }
    double band = direction == Direction.LOW ? exit - enter : enter - exit;
    if (band < epsilon) {
      throw new IllegalStateException(
          key
              + " ("
              + name
              + ") exit must lie at least "
              + epsilon
              + (direction == Direction.LOW ? " above" : " below")
              + " enter");
    }
    return new EffectDefinition(
        name,
        stat,
        optString(obj, "group", stat),
        optInt(obj, "severity", 1),
        direction,
        enter,
        exit);
  }

  private static JsonObject encodeConfig(MetabolismConfig value) {
    JsonObject root = new JsonObject();
    root.addProperty("enabled", value.enabled);
    root.addProperty("tickPeriodMs", value.tickPeriodMs);
    root.addProperty("flushEveryTicks", value.flushEveryTicks);
    root.addProperty("hysteresisEpsilon", value.hysteresisEpsilon);
    JsonObject stats = new JsonObject();
    for (StatDefinition stat : value.stats) {
      JsonObject obj = new JsonObject();
      obj.addProperty("enabled", stat.enabled());
      obj.addProperty("min", stat.min());
      obj.addProperty("max", stat.max());
      obj.addProperty("initial", stat.initial());
      obj.addProperty("ratePerMinute", stat.ratePerMinute());
      JsonObject multipliers = new JsonObject();
      for (ActivityState activity : ActivityState.values()) {
        Double m = stat.activityMultipliers().get(activity);
        if (m != null) {
          multipliers.addProperty(activity.key(), m);
        }
      }
      obj.add("activityMultipliers", multipliers);
      stats.add(stat.name(), obj);
    }
    root.add("stats", stats);
    JsonArray effects = new JsonArray();
    for (EffectDefinition effect : value.effects) {
      JsonObject obj = new JsonObject();
      obj.addProperty("name", effect.name());
      obj.addProperty("stat", effect.stat());
      obj.addProperty("group", effect.group());
      obj.addProperty("severity", effect.severity());
      obj.addProperty("direction", effect.direction().name().toLowerCase(Locale.ROOT));
      obj.addProperty("enter", effect.enter());
      obj.addProperty("exit", effect.exit());
      effects.add(obj);
    }
    root.add("effects", effects);
    return root;
  }

  private static final class Schema implements ConfigSchema<MetabolismConfig> {
    @Override
    public String name() {
      return NAME;
    }

    @Override
    public Class<MetabolismConfig> type() {
      return MetabolismConfig.class;
    }

    @Override
    public int currentVersion() {
      return CURRENT_VERSION;
    }

    @Override
    public JsonObject defaults() {
      return Json5.parse(TEMPLATE);
    }

    @Override
    public String template() {
      return TEMPLATE;
    }

    @Override
    public List<ConfigMigration> migrations() {
      return List.of(
          new ConfigMigration(
              1,
              2,
              "rebalance depletion (hunger 480s->1440s, thirst 360s->1080s, energy 600s->2400s)",
              MetabolismConfig::rebalanceDepletion),
          new ConfigMigration(
              2,
              3,
              "move stats under stats{}, convert to ratePerMinute, seed effects",
              MetabolismConfig::moveStatsAndSeedEffects));
    }

    @Override
    public MetabolismConfig decode(JsonObject document) {
      return parse(document);
    }

    @Override
    public JsonObject encode(MetabolismConfig value) {
      return encodeConfig(value);
    }
  }
}
