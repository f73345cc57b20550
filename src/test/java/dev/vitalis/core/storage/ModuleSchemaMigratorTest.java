/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.core.Config;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModuleSchemaMigratorTest {

  private static SqliteWorldStorage open(Path dir) {
    return SqliteWorldStorage.open(UUID.randomUUID(), new Config.Storage(dir, 1_000, 2, 1));
  }

  @Test
  void appliesOnlyPendingStepsInOrder(@TempDir Path dir) {
    List<Integer> applied = new ArrayList<>();
    List<SchemaStep> steps =
        List.of(
            new SchemaStep(
                1,
                "create",
                (c, schema) -> {
                  applied.add(1);
                  schema.execute("CREATE TABLE sample (id TEXT PRIMARY KEY)");
                }),
            new SchemaStep(
                2,
                "add column",
                (c, schema) -> {
                  applied.add(2);
                  schema.addColumnIfMissing("sample", "extra", "INTEGER NOT NULL DEFAULT 0");
                }));

    try (SqliteWorldStorage storage = open(dir)) {
      assertEquals(1, ModuleSchemaMigrator.migrate(storage, "sample", steps.subList(0, 1)));
      assertEquals(List.of(1), applied);
      assertEquals(1, storage.getModuleSchemaVersion("sample"));

      assertEquals(2, ModuleSchemaMigrator.migrate(storage, "sample", steps));
      assertEquals(2, ModuleSchemaMigrator.migrate(storage, "sample", steps));
      assertEquals(List.of(1, 2), applied);
      assertEquals(2, storage.getModuleSchemaVersion("sample"));
      boolean extra = storage.read(c -> new SchemaHelperImpl(c).hasColumn("sample", "extra"));
      assertTrue(extra);
    }
  }

  @Test
  void failingStepKeepsPreviousVersion(@TempDir Path dir) {
    List<SchemaStep> steps =
        List.of(
            new SchemaStep(
                1, "create", (c, schema) -> schema.execute("CREATE TABLE sample (id TEXT)")),
            new SchemaStep(
                2,
                "broken",
                (c, schema) -> {
                  schema.execute("CREATE TABLE half_done (id TEXT)");
                  throw new SQLException("step exploded");
                }));

    try (SqliteWorldStorage storage = open(dir)) {
      StorageException error =
          assertThrows(
              StorageException.class, () -> ModuleSchemaMigrator.migrate(storage, "sample", steps));
      assertEquals(ErrorCode.STORAGE_FAILURE, error.code());
      assertEquals(1, storage.getModuleSchemaVersion("sample"));
      boolean leftover = storage.read(c -> new SchemaHelperImpl(c).tableExists("half_done"));
      assertFalse(leftover);
    }
  }

  @Test
  void newerStoredVersionIsSchemaMismatch(@TempDir Path dir) {
    List<SchemaStep> steps =
        List.of(new SchemaStep(1, "create", (c, schema) -> schema.execute("SELECT 1")));
    try (SqliteWorldStorage storage = open(dir)) {
      storage.setModuleSchemaVersion("sample", 5);

      StorageException error =
          assertThrows(
              StorageException.class, () -> ModuleSchemaMigrator.migrate(storage, "sample", steps));
      assertEquals(ErrorCode.SCHEMA_MISMATCH, error.code());
      assertEquals(5, storage.getModuleSchemaVersion("sample"));
    }
  }

  @Test
  void stepsMustBeNumberedWithoutGaps(@TempDir Path dir) {
    List<SchemaStep> steps =
        List.of(
            new SchemaStep(1, "one", (c, schema) -> {}),
            new SchemaStep(3, "three", (c, schema) -> {}));
    try (SqliteWorldStorage storage = open(dir)) {
      assertThrows(
          IllegalArgumentException.class,
          () -> ModuleSchemaMigrator.migrate(storage, "sample", steps));
      assertEquals(0, storage.getModuleSchemaVersion("sample"));
    }
  }
}
