/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import dev.vitalis.api.ErrorCode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigStoreTest {

  private static final String V1_DOCUMENT = "// tuning\n{ configVersion: 1, rate: 480.0 }\n";

  /** Two-version document whose only migration doubles {@code rate}. */
  private static final class RateSchema implements ConfigSchema<Double> {
    private final UnaryOperator<JsonObject> transform;

    RateSchema() {
      this(
          doc -> {
            doc.addProperty("rate", doc.get("rate").getAsDouble() * 2);
            return doc;
          });
    }

    RateSchema(UnaryOperator<JsonObject> transform) {
      this.transform = transform;
    }

    @Override
    public String name() {
      return "rates";
    }

    @Override
    public Class<Double> type() {
      return Double.class;
    }

    @Override
    public int currentVersion() {
      return 2;
    }

    @Override
    public JsonObject defaults() {
      JsonObject doc = new JsonObject();
      doc.addProperty("rate", 100.0);
      return doc;
    }

    @Override
    public List<ConfigMigration> migrations() {
      return List.of(new ConfigMigration(1, 2, "double rate", transform));
    }

    @Override
    public Double decode(JsonObject document) {
      double rate = document.get("rate").getAsDouble();
      if (rate < 0) {
        throw new IllegalStateException("rates.rate must be non-negative");
      }
      return rate;
    }

    @Override
    public JsonObject encode(Double value) {
      JsonObject doc = new JsonObject();
      doc.addProperty("rate", value);
      return doc;
    }
  }

  @Test
  void missingDocumentIsWrittenWithDefaults(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    RateSchema schema = new RateSchema();

    assertEquals(100.0, store.load(schema));
    JsonObject written = Json5.parse(Files.readString(store.path("rates")));
    assertEquals(2, written.get(ConfigStore.VERSION_KEY).getAsInt());
    assertTrue(store.lastFailure("rates").isEmpty());
  }

  @Test
  void migratesOldDocumentAndKeepsBackup(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    Files.writeString(store.path("rates"), V1_DOCUMENT, StandardCharsets.UTF_8);

    assertEquals(960.0, store.load(new RateSchema()));

    JsonObject migrated = Json5.parse(Files.readString(store.path("rates")));
    assertEquals(2, migrated.get(ConfigStore.VERSION_KEY).getAsInt());
    assertEquals(960.0, migrated.get("rate").getAsDouble());
    assertEquals(V1_DOCUMENT, Files.readString(store.backupPath("rates", 1)));
    assertTrue(store.lastFailure("rates").isEmpty());
  }

  @Test
  void currentDocumentIsLeftAlone(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    String current = "{ configVersion: 2, rate: 12.5 }";
    Files.writeString(store.path("rates"), current, StandardCharsets.UTF_8);

    RateSchema schema = new RateSchema();

    assertEquals(12.5, store.load(schema));
    assertEquals(12.5, store.load(schema));

    assertEquals(current, Files.readString(store.path("rates")));
    assertFalse(Files.exists(store.backupPath("rates", 2)));
  }

  @Test
  void migratingACurrentDocumentChangesNothing() {
    RateSchema schema = new RateSchema();
    ConfigMigrationRegistry registry =
        new ConfigMigrationRegistry(schema.name(), schema.currentVersion(), schema.migrations());
    JsonObject migrated =
        registry.migrate(Json5.parse("{ configVersion: 1, rate: 480.0, note: \"x\" }"), 1, 2);

    JsonObject again = registry.migrate(migrated, 2, 2);

    assertEquals(migrated, again);
    assertEquals(2, again.get(ConfigStore.VERSION_KEY).getAsInt());
    assertEquals(960.0, again.get("rate").getAsDouble());
  }

  @Test
  void newerDocumentFallsBackWithoutTouchingFile(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    String future = "{ configVersion: 9, rate: 1.0, somethingNew: true }";
    Files.writeString(store.path("rates"), future, StandardCharsets.UTF_8);

    assertEquals(100.0, store.load(new RateSchema()));

    assertEquals(future, Files.readString(store.path("rates")));
    ConfigMigrationFailedException failure = store.lastFailure("rates").orElseThrow();
    assertEquals(ErrorCode.CONFIG_MIGRATION_FAILED, failure.code());
    assertEquals(9, failure.fromVersion());
  }

  @Test
  void failedMigrationRestoresBackupAndUsesDefaults(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    Files.writeString(store.path("rates"), V1_DOCUMENT, StandardCharsets.UTF_8);
    RateSchema negative =
        new RateSchema(
            doc -> {
              doc.addProperty("rate", -1.0);
              return doc;
            });

    assertEquals(100.0, store.load(negative));

    assertEquals(V1_DOCUMENT, Files.readString(store.path("rates")));
    ConfigMigrationFailedException failure = store.lastFailure("rates").orElseThrow();
    assertEquals(1, failure.fromVersion());
    assertEquals(2, failure.targetVersion());
  }

  @Test
  void gapIsRejectedAtRegistration() {
    ConfigSchema<JsonObject> gapped =
        new ConfigSchema<>() {
          @Override
          public String name() {
            return "gapped";
          }

          @Override
          public Class<JsonObject> type() {
            return JsonObject.class;
          }

          @Override
          public int currentVersion() {
            return 3;
          }

          @Override
          public JsonObject defaults() {
            return new JsonObject();
          }

          @Override
          public List<ConfigMigration> migrations() {
            return List.of(new ConfigMigration(2, 3, "late", UnaryOperator.identity()));
          }

          @Override
          public JsonObject decode(JsonObject document) {
            return document;
          }

          @Override
          public JsonObject encode(JsonObject value) {
            return value;
          }
        };

    assertThrows(
        IllegalStateException.class, () -> new ConfigStore(Path.of("unused")).register(gapped));
  }

  @Test
  void typedLookupsAreBoundToTheRegisteredSchemaInstance(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    RateSchema schema = new RateSchema();
    Files.writeString(store.path("rates"), "{ configVersion: 2, rate: 12.5 }");

    Double loaded = store.load(schema);
    List<Double> seen = new ArrayList<>();
    store.onReload(schema, seen::add);
    Double reloaded = store.reload(schema);

    assertEquals(12.5, loaded);
    assertEquals(12.5, reloaded);
    assertEquals(List.of(12.5), seen);
    assertEquals(12.5, store.current(schema));
    RateSchema lookalike = new RateSchema();
    assertThrows(IllegalStateException.class, () -> store.current(lookalike));
    assertThrows(IllegalStateException.class, () -> store.onReload(lookalike, seen::add));
  }

  @Test
  void saveKeepsUnknownKeys(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    Files.writeString(
        store.path("rates"),
        "{ configVersion: 2, rate: 5.0, operatorNote: \"keep me\" }",
        StandardCharsets.UTF_8);
    RateSchema schema = new RateSchema();
    store.load(schema);

    store.save(schema, 7.5);

    JsonObject saved = Json5.parse(Files.readString(store.path("rates")));
    assertEquals(7.5, saved.get("rate").getAsDouble());
    assertEquals("keep me", saved.get("operatorNote").getAsString());
    assertEquals(7.5, store.current(schema));
    try (var files = Files.list(dir)) {
      assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
    }
  }

  @Test
  void reloadNotifiesCallbacksUntilClosed(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    RateSchema schema = new RateSchema();
    Files.writeString(store.path("rates"), "{ configVersion: 2, rate: 1.0 }");
    store.load(schema);
    List<Double> seen = new ArrayList<>();
    AutoCloseable handle = store.onReload(schema, seen::add);

    Files.writeString(store.path("rates"), "{ configVersion: 2, rate: 2.0 }");
    assertEquals(2.0, store.reload("rates"));
    handle.close();
    Files.writeString(store.path("rates"), "{ configVersion: 2, rate: 3.0 }");
    store.reloadAll();

    assertEquals(List.of(2.0), seen);
    assertEquals(3.0, store.current(schema));
    assertThrows(IllegalArgumentException.class, () -> store.reload("unknown"));
  }

  @Test
  void invalidReloadKeepsLastGoodValue(@TempDir Path dir) throws Exception {
    ConfigStore store = new ConfigStore(dir);
    RateSchema schema = new RateSchema();
    Files.writeString(store.path("rates"), "{ configVersion: 2, rate: 4.0 }");
    store.load(schema);

    Files.writeString(store.path("rates"), "{ configVersion: 2, rate: -4.0 }");
    assertEquals(4.0, store.reload(schema));
    assertTrue(store.lastFailure("rates").isPresent());
  }
}
