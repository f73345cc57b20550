/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import dev.vitalis.api.Players.PlayerRecord;
import dev.vitalis.api.storage.WorldStorage;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/** Reads and writes the bootstrap {@code players} table of one world. */
public final class PlayerDirectory {
  private static final String UPSERT =
      """
      INSERT INTO players(id, first_seen, last_seen) VALUES(?, ?, ?)
      ON CONFLICT(id) DO UPDATE SET last_seen = MAX(players.last_seen, excluded.last_seen)
      """;

  private final WorldStorage storage;

  public PlayerDirectory(WorldStorage storage) {
    this.storage = Objects.requireNonNull(storage, "storage");
  }

  /** Creates the row on first session; otherwise refreshes {@code last_seen}. */
  public void recordJoin(UUID playerId, long nowMillis) {
    touch("players.join", playerId, nowMillis);
  }

  /** Refreshes {@code last_seen}; creates the row if the join was never recorded. */
  public void recordLeave(UUID playerId, long nowMillis) {
    touch("players.leave", playerId, nowMillis);
  }

  /** Directory row of a player, if any. */
  public Optional<PlayerRecord> find(UUID playerId) {
    Objects.requireNonNull(playerId, "playerId");
    return storage.read(
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement("SELECT first_seen, last_seen FROM players WHERE id = ?")) {
            ps.setString(1, playerId.toString());
            try (ResultSet rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.empty();
              }
              return Optional.of(new PlayerRecord(playerId, rs.getLong(1), rs.getLong(2)));
            }
          }
        });
  }

  private void touch(String op, UUID playerId, long nowMillis) {
    Objects.requireNonNull(playerId, "playerId");
    storage.withRetry(op, () -> storage.execute(UPSERT, playerId, nowMillis, nowMillis));
  }
}
