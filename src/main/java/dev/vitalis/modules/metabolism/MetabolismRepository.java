/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.metabolism;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.api.storage.SchemaHelper;
import dev.vitalis.api.storage.WorldStorage;
import dev.vitalis.core.storage.ModuleSchemaMigrator;
import dev.vitalis.core.storage.SchemaStep;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists stat vectors of one world in the narrow {@code metabolism_stats} table (one row per
 * player and stat).
 *
 * <p>Schema history:
 *
 * <ol>
 *   <li>create the table, importing the legacy wide layout ({@code hunger}, {@code thirst}, {@code
 *       energy} columns) when found
 *   <li>add {@code updated_at}
 * </ol>
 */
public final class MetabolismRepository {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  static final String TABLE = "metabolism_stats";
  private static final String LEGACY_TABLE = "metabolism_stats_legacy";
  private static final List<String> LEGACY_COLUMNS = List.of("hunger", "thirst", "energy");

  private static final String CREATE_TABLE =
      """
      CREATE TABLE metabolism_stats (
        player_id TEXT NOT NULL,
        world_id TEXT NOT NULL,
        stat_name TEXT NOT NULL,
        value REAL NOT NULL,
        PRIMARY KEY (player_id, stat_name)
      )
      """;

  private static final String UPSERT =
      """
      INSERT INTO metabolism_stats(player_id, world_id, stat_name, value, updated_at)
      VALUES(?, ?, ?, ?, ?)
      ON CONFLICT(player_id, stat_name) DO UPDATE SET
        value = excluded.value,
        updated_at = excluded.updated_at
      """;

  private final WorldStorage storage;

  public MetabolismRepository(WorldStorage storage) {
    this.storage = Objects.requireNonNull(storage, "storage");
  }

  /**
   * Brings this world's tables to the current schema.
   *
   * @return schema version now in effect
   * @throws StorageException {@code SCHEMA_MISMATCH} for unknown layouts or newer versions
   */
  public int migrate() {
    return ModuleSchemaMigrator.migrate(storage, MetabolismModule.ID, steps());
  }

  List<SchemaStep> steps() {
    return List.of(
        new SchemaStep(1, "create metabolism_stats (import legacy wide table)", this::createTable),
        new SchemaStep(
            2,
            "add metabolism_stats.updated_at",
            (c, schema) ->
                schema.addColumnIfMissing(TABLE, "updated_at", "INTEGER NOT NULL DEFAULT 0")));
  }

  private void createTable(Connection c, SchemaHelper schema) throws SQLException {
    if (!schema.tableExists(TABLE)) {
      schema.execute(CREATE_TABLE);
      return;
    }
    Set<String> columns = schema.columns(TABLE);
    if (columns.contains("stat_name")) {
      return;
    }
    if (!columns.contains("player_id") || LEGACY_COLUMNS.stream().noneMatch(columns::contains)) {
      throw new StorageException(
          ErrorCode.SCHEMA_MISMATCH,
          "unexpected metabolism_stats layout " + columns + " in world " + storage.worldId());
    }
    schema.execute("ALTER TABLE " + TABLE + " RENAME TO " + LEGACY_TABLE);
    schema.execute(CREATE_TABLE);
    int imported = 0;
    for (String column : LEGACY_COLUMNS) {
      if (!columns.contains(column)) {
        continue;
      }
      try (PreparedStatement ps =
          c.prepareStatement(
              "INSERT INTO metabolism_stats(player_id, world_id, stat_name, value) "
                  + "SELECT player_id, ?, ?, "
                  + column
                  + " FROM "
                  + LEGACY_TABLE
                  + " WHERE "
                  + column
                  + " IS NOT NULL")) {
        ps.setString(1, storage.worldId().toString());
        ps.setString(2, column);
        imported += ps.executeUpdate();
      }
    }
    schema.execute("DROP TABLE " + LEGACY_TABLE);
    LOG.info(
        "(vitalis) world={} module={} imported {} legacy stat rows",
        storage.worldId(),
        MetabolismModule.ID,
        imported);
  }

  /**
   * Reads a player's stored values.
   *
   * @return values by stat name, or empty when nothing was stored for the player
   */
  public Optional<Map<String, Double>> load(UUID playerId) {
    Objects.requireNonNull(playerId, "playerId");
    return storage.read(
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "SELECT stat_name, value FROM metabolism_stats WHERE player_id = ?")) {
            ps.setString(1, playerId.toString());
            Map<String, Double> values = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                values.put(rs.getString(1), rs.getDouble(2));
              }
            }
            return values.isEmpty() ? Optional.empty() : Optional.of(values);
          }
        });
  }

  /** Upserts every value of a player in one transaction, retrying busy errors. */
  public void save(UUID playerId, Map<String, Double> values, long nowMillis) {
    Objects.requireNonNull(playerId, "playerId");
    if (values.isEmpty()) {
      return;
    }
    storage.withRetry(
        "metabolism.save",
        () ->
            storage.transaction(
                c -> {
                  try (PreparedStatement ps = c.prepareStatement(UPSERT)) {
                    for (Map.Entry<String, Double> entry : values.entrySet()) {
                      ps.setString(1, playerId.toString());
                      ps.setString(2, storage.worldId().toString());
                      ps.setString(3, entry.getKey());
                      ps.setDouble(4, entry.getValue());
                      ps.setLong(5, nowMillis);
                      ps.addBatch();
                    }
                    ps.executeBatch();
                  }
                  return null;
                }));
  }
}
