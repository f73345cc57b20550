/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import dev.vitalis.api.ErrorCode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads, migrates and saves versioned configuration documents stored as {@code <name>.json5} in
 * one directory.
 *
 * <p>Load rules:
 *
 * <ul>
 *   <li>Missing file: defaults (or the schema's template) are written and returned.
 *   <li>Older version: the original text is copied to {@code <name>.v<N>.backup.json5}, then each
 *       migration runs in order. The migrated document is validated before it replaces the file;
 *       keys the schema does not know about are carried over.
 *   <li>Migration or validation failure: the backup is restored, defaults are used and a {@link
 *       ConfigMigrationFailedException} is recorded. Startup continues.
 *   <li>Newer version than supported: defaults are used in memory and the file is left alone.
 *   <li>Current version: nothing is written.
 * </ul>
 *
 * <p>All writes go to a temp file that is then moved over the target.
 */
public final class ConfigStore {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  /** Top-level key carrying the document version. */
  public static final String VERSION_KEY = "configVersion";

  private final Path directory;
  private final Map<String, Entry<?>> entries = new ConcurrentHashMap<>();

  /**
   * Creates a store rooted at a directory.
   *
   * @param directory config directory, created on first write
   */
  public ConfigStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /** Directory holding every document. */
  public Path directory() {
    return directory;
  }

  /** Location of a document. */
  public Path path(String name) {
    return directory.resolve(name + ".json5");
  }

  /** Location of the pre-migration backup for a given on-disk version. */
  public Path backupPath(String name, int version) {
    return directory.resolve(name + ".v" + version + ".backup.json5");
  }

  /**
   * Registers a schema without loading it. Validates the migration chain immediately.
   *
   * @throws IllegalStateException when the chain has gaps or another schema owns the name
   */
  public synchronized <T> void register(ConfigSchema<T> schema) {
    Objects.requireNonNull(schema, "schema");
    Entry<?> existing = entries.get(schema.name());
    if (existing != null) {
      if (existing.schema != schema) {
        throw new IllegalStateException("config '" + schema.name() + "' already registered");
      }
      return;
    }
    ConfigMigrationRegistry registry =
        new ConfigMigrationRegistry(schema.name(), schema.currentVersion(), schema.migrations());
    entries.put(schema.name(), new Entry<>(schema, registry));
  }

  /**
   * Loads a document, registering its schema on first use.
   *
   * @return typed value; defaults when the file could not be used
   */
  public synchronized <T> T load(ConfigSchema<T> schema) {
    register(schema);
    return schema.type().cast(read(entry(schema), null));
  }

  /** Last loaded value of a document. */
  public <T> T current(ConfigSchema<T> schema) {
    Object value = entry(schema).value;
    if (value == null) {
      throw new IllegalStateException("config '" + schema.name() + "' not loaded");
    }
    return schema.type().cast(value);
  }

  /**
   * Writes a value atomically. Keys present in the previous document but unknown to the schema are
   * preserved.
   */
  public synchronized <T> void save(ConfigSchema<T> schema, T value) {
    Objects.requireNonNull(value, "value");
    register(schema);
    Entry<?> entry = entry(schema);
    JsonObject merged = entry.raw != null ? entry.raw.deepCopy() : schema.defaults();
    Json5.deepMerge(merged, schema.encode(value));
    merged.addProperty(VERSION_KEY, schema.currentVersion());
    T decoded = schema.decode(merged);
    Path path = path(schema.name());
    try {
      writeAtomically(path, Json5.toJson(merged));
    } catch (IOException e) {
      throw new RuntimeException("Failed to write config: " + path, e);
    }
    entry.set(merged, decoded);
  }

  /**
   * Re-reads a document and notifies its reload callbacks. When the file became unusable the last
   * good value is kept.
   *
   * @param name document name
   * @return the value now in effect
   * @throws IllegalArgumentException when no schema with that name is registered
   */
  public synchronized Object reload(String name) {
    Entry<?> entry = entries.get(name);
    if (entry == null) {
      throw new IllegalArgumentException("unknown config: " + name);
    }
    return reloadEntry(entry);
  }

  /** Typed variant of {@link #reload(String)}. */
  public synchronized <T> T reload(ConfigSchema<T> schema) {
    register(schema);
    return schema.type().cast(reloadEntry(entry(schema)));
  }

  /** Reloads every registered document. */
  public synchronized void reloadAll() {
    for (Entry<?> entry : List.copyOf(entries.values())) {
      reloadEntry(entry);
    }
  }

  /**
   * Registers a callback invoked after each reload of a document.
   *
   * @return handle whose {@code close()} removes the callback
   */
  public <T> AutoCloseable onReload(ConfigSchema<T> schema, Consumer<T> callback) {
    Objects.requireNonNull(callback, "callback");
    register(schema);
    return entry(schema).listen(schema.type(), callback);
  }

  /** Failure recorded by the most recent load or reload of a document. */
  public Optional<ConfigMigrationFailedException> lastFailure(String name) {
    Entry<?> entry = entries.get(name);
    return entry == null ? Optional.empty() : Optional.ofNullable(entry.lastFailure);
  }

  /** Names of all registered documents. */
  public List<String> names() {
    return List.copyOf(entries.keySet());
  }

  private <T> T reloadEntry(Entry<T> entry) {
    T value = read(entry, entry.value);
    for (Consumer<T> callback : entry.callbacks) {
      try {
        callback.accept(value);
      } catch (RuntimeException e) {
        LOG.warn(
            "(vitalis) config={} reload callback failed: {}",
            entry.schema.name(),
            e.getMessage(),
            e);
      }
    }
    LOG.info("(vitalis) config={} reloaded", entry.schema.name());
    return value;
  }

  /** Entry registered for exactly this schema instance; its values are of {@code schema.type()}. */
  private Entry<?> entry(ConfigSchema<?> schema) {
    Entry<?> entry = entries.get(schema.name());
    if (entry == null || entry.schema != schema) {
      throw new IllegalStateException("config '" + schema.name() + "' not registered");
    }
    return entry;
  }

  private <T> T read(Entry<T> entry, T lastGood) {
    ConfigSchema<T> schema = entry.schema;
    String name = schema.name();
    Path path = path(name);
    entry.lastFailure = null;
    if (schema.template() != null) {
      ConfigTemplateWriter.writeExample(
          directory.resolve(name + ".json5.example"), schema.template());
    }
    try {
      if (!Files.exists(path)) {
        String text = schema.template() != null ? schema.template() : Json5.toJson(stamped(schema));
        writeAtomically(path, text);
        LOG.info("(vitalis) config={} written with defaults to {}", name, path);
        return accept(entry, Json5.parse(text));
      }

      String text = Files.readString(path, StandardCharsets.UTF_8);
      JsonObject document;
      try {
        document = Json5.parse(text);
      } catch (JsonParseException | IllegalStateException e) {
        return fallback(entry, lastGood, 0, "document is not valid JSON5", e);
      }

      int version;
      try {
        version = versionOf(document);
      } catch (RuntimeException e) {
        return fallback(entry, lastGood, 0, "configVersion is not an integer", e);
      }
      int current = schema.currentVersion();
      if (version > current) {
        return fallback(
            entry,
            lastGood,
            version,
            "document v"
                + version
                + " is newer than supported v"
                + current
                + "; file left untouched",
            null);
      }
      if (version == current) {
        try {
          return accept(entry, document);
        } catch (RuntimeException e) {
          return fallback(entry, lastGood, version, "validation failed: " + e.getMessage(), e);
        }
      }
      return migrate(entry, path, text, document, version, lastGood);
    } catch (IOException e) {
      return fallback(entry, lastGood, 0, "I/O failure: " + e.getMessage(), e);
    }
  }

  private <T> T migrate(
      Entry<T> entry, Path path, String original, JsonObject document, int from, T lastGood) {
    ConfigSchema<T> schema = entry.schema;
    String name = schema.name();
    int to = schema.currentVersion();
    Path backup = backupPath(name, from);
    try {
      writeAtomically(backup, original);
    } catch (IOException e) {
      return fallback(entry, lastGood, from, "could not write backup " + backup, e);
    }
    LOG.info("(vitalis) config={} v{} backed up to {}", name, from, backup);

    try {
      JsonObject migrated = entry.registry.migrate(document, from, to);
      T value = schema.decode(migrated);
      writeAtomically(path, Json5.toJson(migrated));
      entry.raw = migrated;
      entry.value = value;
      return value;
    } catch (RuntimeException | IOException e) {
      restore(name, backup, path);
      String reason = "migration v" + from + "->v" + to + " failed: " + e.getMessage();
      return fallback(entry, lastGood, from, reason, e);
    }
  }

  private void restore(String name, Path backup, Path path) {
    try {
      writeAtomically(path, Files.readString(backup, StandardCharsets.UTF_8));
      LOG.info("(vitalis) config={} restored from {}", name, backup);
    } catch (IOException e) {
      LOG.error(
          "(vitalis) code={} op={} config={} message={}",
          ErrorCode.CONFIG_MIGRATION_FAILED,
          "config.restore",
          name,
          e.getMessage(),
          e);
    }
  }

  private <T> T fallback(Entry<T> entry, T lastGood, int version, String reason, Throwable cause) {
    ConfigSchema<T> schema = entry.schema;
    ConfigMigrationFailedException failure =
        new ConfigMigrationFailedException(
            schema.name(), version, schema.currentVersion(), reason, cause);
    entry.lastFailure = failure;
    LOG.warn(
        "(vitalis) code={} op={} config={} fallback={} message={}",
        failure.code(),
        "config.load",
        schema.name(),
        lastGood != null ? "last-good" : "defaults",
        failure.getMessage());
    if (lastGood != null) {
      return lastGood;
    }
    return accept(entry, stamped(schema));
  }

  private <T> T accept(Entry<T> entry, JsonObject document) {
    T value = entry.schema.decode(document);
    entry.raw = document;
    entry.value = value;
    return value;
  }

  private static JsonObject stamped(ConfigSchema<?> schema) {
    JsonObject defaults = schema.defaults();
    defaults.addProperty(VERSION_KEY, schema.currentVersion());
    return defaults;
  }

  private static int versionOf(JsonObject document) {
    JsonElement version = document.get(VERSION_KEY);
    if (version == null || version.isJsonNull()) {
      return 1;
    }
    return version.getAsInt();
  }

  static void writeAtomically(Path path, String text) throws IOException {
    Path target = path.toAbsolutePath();
    Path parent = target.getParent();
    Files.createDirectories(parent);
    Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      Files.writeString(tmp, text, StandardCharsets.UTF_8);
      try {
        Files.move(
            tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private static final class Entry<T> {
    private final ConfigSchema<T> schema;
    private final ConfigMigrationRegistry registry;
    private final List<Consumer<T>> callbacks = new CopyOnWriteArrayList<>();
    private volatile T value;
    private volatile JsonObject raw;
    private volatile ConfigMigrationFailedException lastFailure;

    private Entry(ConfigSchema<T> schema, ConfigMigrationRegistry registry) {
      this.schema = schema;
      this.registry = registry;
    }

    private void set(JsonObject document, Object decoded) {
      value = schema.type().cast(decoded);
      raw = document;
    }

    private <V> AutoCloseable listen(Class<V> type, Consumer<V> callback) {
      Consumer<T> typed = current -> callback.accept(type.cast(current));
      callbacks.add(typed);
      return () -> callbacks.remove(typed);
    }
  }
}
