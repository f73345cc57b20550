/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import static dev.vitalis.core.config.Json5.optBoolean;
import static dev.vitalis.core.config.Json5.optInt;
import static dev.vitalis.core.config.Json5.optLong;
import static dev.vitalis.core.config.Json5.optObject;
import static dev.vitalis.core.config.Json5.optString;

import com.google.gson.JsonObject;
import dev.vitalis.core.config.ConfigSchema;
import dev.vitalis.core.config.ConfigStore;
import dev.vitalis.core.config.Json5;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Core runtime configuration loaded from {@code config/vitalis.json5}.
 *
 * <p>The document goes through the same {@link ConfigStore} pipeline as module documents:
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Emits a {@code vitalis.json5.example} snapshot for ops tooling.
 *   <li>Supports an environment override for the data directory ({@code VITALIS_DATA_DIR}).
 *   <li>Parses module toggles plus storage, runtime, and logging blocks.
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Vitalis configuration (JSON5 with comments)
      // Drop into config/vitalis.json5. Environment override: VITALIS_DATA_DIR.
      // Module documents (metabolism.json5) live in the same directory.
      {
        configVersion: 1,
        modules: {
          players: { enabled: true },
          metabolism: { enabled: true }
        },
        core: {
          storage: {
            // one SQLite database per world: <dataDir>/<worldId>/vitalis.db
            dataDir: "./data/vitalis",
            // how long a writer waits for the per-world writer slot
            writeTimeoutMs: 5000,
            poolSize: 4,
            busyRetries: 3
          },
          runtime: {
            // bounded wait for pending flushes on world shutdown and forceFlush
            flushTimeoutMs: 5000,
            ioThreads: 2
          },
          log: {
            json: false,
            level: "INFO"
          }
        }
      }
      """;

  private static final Set<String> LOG_LEVELS =
      Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

  /** Document name inside the config directory. */
  public static final String NAME = "vitalis";

  /** Schema used to load this document through a {@link ConfigStore}. */
  public static final ConfigSchema<Config> SCHEMA = new Schema();

  private final Storage storage;
  private final Runtime runtime;
  private final Modules modules;
  private final Log log;

  public Config(Storage storage, Runtime runtime, Modules modules, Log log) {
    this.storage = storage;
    this.runtime = runtime;
    this.modules = modules;
    this.log = log;
  }

  /**
   * Per-world storage block.
   *
   * @return storage settings
   */
  public Storage storage() {
    return storage;
  }

  /**
   * Runtime behavior (flush timeouts, I/O threads).
   *
   * @return runtime settings
   */
  public Runtime runtime() {
    return runtime;
  }

  /**
   * Module toggles.
   *
   * @return module configuration
   */
  public Modules modules() {
    return modules;
  }

  /**
   * Logging settings.
   *
   * @return log configuration
   */
  public Log log() {
    return log;
  }

  /** Default configuration with a custom data directory. Handy for embedding and tests. */
  public static Config defaults(Path dataDir) {
    Config parsed = SCHEMA.decode(Json5.parse(TEMPLATE));
    Storage s = parsed.storage();
    return new Config(
        new Storage(dataDir, s.writeTimeoutMs(), s.poolSize(), s.busyRetries()),
        parsed.runtime(),
        parsed.modules(),
        parsed.log());
  }

  /**
   * Loads configuration from a store, writing the template if the file does not exist and always
   * refreshing the commented example alongside it.
   *
   * @param store config store rooted at the config directory
   * @return parsed config
   */
  public static Config load(ConfigStore store) {
    return store.load(SCHEMA);
  }

  private static Storage parseStorage(JsonObject storage) {
    String envDir = System.getenv("VITALIS_DATA_DIR");
    String dir = envDir != null ? envDir : optString(storage, "dataDir", "./data/vitalis");
    long writeTimeout = optLong(storage, "writeTimeoutMs", 5_000L);
    int poolSize = optInt(storage, "poolSize", 4);
    int busyRetries = optInt(storage, "busyRetries", 3);
    return new Storage(Path.of(dir), writeTimeout, poolSize, busyRetries);
  }

  private static Runtime parseRuntime(JsonObject runtime) {
    long flushTimeout = optLong(runtime, "flushTimeoutMs", 5_000L);
    int ioThreads = optInt(runtime, "ioThreads", 2);
    return new Runtime(flushTimeout, ioThreads);
  }

  private static Modules parseModules(JsonObject modules) {
    JsonObject players = optObject(modules, "players");
    JsonObject metabolism = optObject(modules, "metabolism");
    return new Modules(
        new Toggle(players == null || optBoolean(players, "enabled", true)),
        new Toggle(metabolism == null || optBoolean(metabolism, "enabled", true)));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, "INFO");
    }
    return new Log(optBoolean(log, "json", false), optString(log, "level", "INFO"));
  }

  private static void validate(Config cfg) {
    validateStorage(cfg.storage());
    validateRuntime(cfg.runtime());
    validateLog(cfg.log());
  }

  private static void validateStorage(Storage storage) {
    if (storage.dataDir() == null || storage.dataDir().toString().isBlank()) {
      throw new IllegalStateException("core.storage.dataDir must be provided");
    }
    if (storage.writeTimeoutMs() < 10 || storage.writeTimeoutMs() > 120_000) {
      throw new IllegalStateException("core.storage.writeTimeoutMs must be between 10 and 120000");
    }
    if (storage.poolSize() < 2 || storage.poolSize() > 32) {
      throw new IllegalStateException("core.storage.poolSize must be between 2 and 32");
    }
    if (storage.busyRetries() < 1 || storage.busyRetries() > 10) {
      throw new IllegalStateException("core.storage.busyRetries must be between 1 and 10");
    }
  }

  private static void validateRuntime(Runtime runtime) {
    if (runtime.flushTimeoutMs() < 100 || runtime.flushTimeoutMs() > 300_000) {
      throw new IllegalStateException("core.runtime.flushTimeoutMs must be between 100 and 300000");
    }
    if (runtime.ioThreads() < 1 || runtime.ioThreads() > 16) {
      throw new IllegalStateException("core.runtime.ioThreads must be between 1 and 16");
    }
  }

  private static void validateLog(Log log) {
    String level = log.level() == null ? "" : log.level().trim().toUpperCase(Locale.ROOT);
    if (!LOG_LEVELS.contains(level)) {
      throw new IllegalStateException("core.log.level must be one of " + LOG_LEVELS);
    }
  }

  /**
   * Per-world storage settings.
   *
   * @param dataDir root directory; each world gets {@code <dataDir>/<worldId>/}
   * @param writeTimeoutMs how long a writer waits for the per-world writer slot
   * @param poolSize maximum pooled connections per world
   * @param busyRetries attempts made by {@code withRetry} for busy errors
   */
  public record Storage(Path dataDir, long writeTimeoutMs, int poolSize, int busyRetries) {}

  /**
   * Runtime settings.
   *
   * @param flushTimeoutMs bounded wait for pending flushes
   * @param ioThreads threads in the shared persistence executor
   */
  public record Runtime(long flushTimeoutMs, int ioThreads) {}

  /** Module toggles. */
  public record Modules(Toggle players, Toggle metabolism) {
    /** Identifiers of all enabled modules. */
    public Set<String> enabledIds() {
      Set<String> ids = new LinkedHashSet<>();
      if (players.enabled()) {
        ids.add("players");
      }
      if (metabolism.enabled()) {
        ids.add("metabolism");
      }
      return ids;
    }
  }

  /** Enabled flag for a module. */
  public record Toggle(boolean enabled) {}

  /**
   * Logging settings.
   *
   * @param json emit structured JSON lines instead of the plain pattern
   * @param level root logger level
   */
  public record Log(boolean json, String level) {}

  private static final class Schema implements ConfigSchema<Config> {
    @Override
    public String name() {
      return NAME;
    }

    @Override
    public Class<Config> type() {
      return Config.class;
    }

    @Override
    public int currentVersion() {
      return 1;
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
    public Config decode(JsonObject root) {
      JsonObject core = optObject(root, "core");
      if (core == null) {
        throw new IllegalStateException("config missing core{} block");
      }
      Config config =
          new Config(
              parseStorage(optObject(core, "storage")),
              parseRuntime(optObject(core, "runtime")),
              parseModules(optObject(root, "modules")),
              parseLog(optObject(core, "log")));
      validate(config);
      return config;
    }

    @Override
    public JsonObject encode(Config value) {
      JsonObject storage = new JsonObject();
      storage.addProperty("dataDir", value.storage().dataDir().toString());
      storage.addProperty("writeTimeoutMs", value.storage().writeTimeoutMs());
      storage.addProperty("poolSize", value.storage().poolSize());
      storage.addProperty("busyRetries", value.storage().busyRetries());

      JsonObject runtime = new JsonObject();
      runtime.addProperty("flushTimeoutMs", value.runtime().flushTimeoutMs());
      runtime.addProperty("ioThreads", value.runtime().ioThreads());

      JsonObject log = new JsonObject();
      log.addProperty("json", value.log().json());
      log.addProperty("level", value.log().level());

      JsonObject core = new JsonObject();
      core.add("storage", storage);
      core.add("runtime", runtime);
      core.add("log", log);

      JsonObject modules = new JsonObject();
      modules.add("players", toggle(value.modules().players()));
      modules.add("metabolism", toggle(value.modules().metabolism()));

      JsonObject root = new JsonObject();
      root.add("modules", modules);
      root.add("core", core);
      return root;
    }

    private static JsonObject toggle(Toggle toggle) {
      JsonObject obj = new JsonObject();
      obj.addProperty("enabled", toggle.enabled());
      return obj;
    }
  }
}
