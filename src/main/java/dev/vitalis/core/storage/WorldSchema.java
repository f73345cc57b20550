/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.api.storage.WorldStorage;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Embedded bootstrap schema shared by every world database. */
final class WorldSchema {
  static final String PLAYERS_DDL =
      """
      CREATE TABLE IF NOT EXISTS players (
        id TEXT PRIMARY KEY,
        first_seen INTEGER NOT NULL,
        last_seen INTEGER NOT NULL
      )
      """;

  static final String MODULE_VERSIONS_DDL =
      """
      CREATE TABLE IF NOT EXISTS module_schema_versions (
        module_id TEXT PRIMARY KEY,
        version INTEGER NOT NULL
      )
      """;

  private WorldSchema() {}

  /**
   * Creates the bootstrap tables when missing and verifies existing ones carry the expected
   * columns. Runs in a single transaction.
   *
   * @throws StorageException with {@link ErrorCode#SCHEMA_MISMATCH} when an existing table
   *     conflicts
   */
  static void bootstrap(WorldStorage storage) {
    storage.transaction(
        c -> {
          SchemaHelperImpl schema = new SchemaHelperImpl(c);
          schema.execute(PLAYERS_DDL);
          schema.execute(MODULE_VERSIONS_DDL);
          verify(storage, schema, "players", List.of("id", "first_seen", "last_seen"));
          verify(storage, schema, "module_schema_versions", List.of("module_id", "version"));
          return null;
        });
  }

  private static void verify(
      WorldStorage storage, SchemaHelperImpl schema, String table, List<String> expected)
      throws SQLException {
    Set<String> missing = new LinkedHashSet<>(expected);
    missing.removeAll(schema.columns(table));
    if (!missing.isEmpty()) {
      throw new StorageException(
          ErrorCode.SCHEMA_MISMATCH,
          "world "
              + storage.worldId()
              + " table '"
              + table
              + "' exists without expected columns "
              + missing);
    }
  }
}
