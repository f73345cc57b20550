/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.core.Config;
import dev.vitalis.core.storage.SqliteWorldStorage;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link MetabolismRepository}. */
final class MetabolismRepositoryTest {

  private static SqliteWorldStorage open(Path dir, UUID world) {
    return SqliteWorldStorage.open(world, new Config.Storage(dir, 1_000, 2, 3));
  }

  @Test
  void freshWorldMigratesToLatest(@TempDir Path dir) {
    try (SqliteWorldStorage storage = open(dir, UUID.randomUUID())) {
      MetabolismRepository repository = new MetabolismRepository(storage);

      assertEquals(2, repository.migrate());
      assertEquals(2, storage.getModuleSchemaVersion(MetabolismModule.ID));
      assertEquals(2, repository.migrate());
      assertTrue(repository.load(UUID.randomUUID()).isEmpty());
    }
  }

  @Test
  void savedValuesReloadBitIdentical(@TempDir Path dir) {
    UUID world = UUID.randomUUID();
    UUID player = UUID.randomUUID();
    double hunger = 100.0 - 1.0 / 3.0;
    try (SqliteWorldStorage storage = open(dir, world)) {
      MetabolismRepository repository = new MetabolismRepository(storage);
      repository.migrate();
      repository.save(player, Map.of("hunger", 12.0, "thirst", 40.0), 1_000L);
      repository.save(player, Map.of("hunger", hunger), 2_000L);
    }

    try (SqliteWorldStorage storage = open(dir, world)) {
      MetabolismRepository repository = new MetabolismRepository(storage);
      repository.migrate();
      Map<String, Double> loaded = repository.load(player).orElseThrow();

      assertEquals(2, loaded.size());
      assertEquals(
          Double.doubleToRawLongBits(hunger), Double.doubleToRawLongBits(loaded.get("hunger")));
      assertEquals(40.0, loaded.get("thirst"));
    }
  }

  @Test
  void emptySaveWritesNothing(@TempDir Path dir) {
    try (SqliteWorldStorage storage = open(dir, UUID.randomUUID())) {
      MetabolismRepository repository = new MetabolismRepository(storage);
      repository.migrate();
      UUID player = UUID.randomUUID();

      repository.save(player, Map.of(), 1_000L);

      assertFalse(repository.load(player).isPresent());
    }
  }

  @Test
  void legacyWideTableIsImported(@TempDir Path dir) {
    UUID player = UUID.randomUUID();
    try (SqliteWorldStorage storage = open(dir, UUID.randomUUID())) {
      storage.execute(
          "CREATE TABLE "
              + MetabolismRepository.TABLE
              + " (player_id TEXT PRIMARY KEY, hunger REAL, thirst REAL, energy REAL)");
      storage.execute(
          "INSERT INTO "
              + MetabolismRepository.TABLE
              + "(player_id, hunger, thirst, energy) VALUES(?, ?, ?, NULL)",
          player.toString(),
          61.5,
          22.0);
      MetabolismRepository repository = new MetabolismRepository(storage);

      assertEquals(2, repository.migrate());

      Map<String, Double> loaded = repository.load(player).orElseThrow();
      assertEquals(Map.of("hunger", 61.5, "thirst", 22.0), loaded);
    }
  }

  @Test
  void unknownLayoutIsRejected(@TempDir Path dir) {
    try (SqliteWorldStorage storage = open(dir, UUID.randomUUID())) {
      storage.execute(
          "CREATE TABLE " + MetabolismRepository.TABLE + " (id INTEGER PRIMARY KEY, payload TEXT)");
      MetabolismRepository repository = new MetabolismRepository(storage);

      StorageException error = assertThrows(StorageException.class, repository::migrate);

      assertEquals(ErrorCode.SCHEMA_MISMATCH, error.code());
      assertEquals(0, storage.getModuleSchemaVersion(MetabolismModule.ID));
    }
  }
}
