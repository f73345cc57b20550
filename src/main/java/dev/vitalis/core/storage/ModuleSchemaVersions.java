/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Reads and writes rows of {@code module_schema_versions} on a caller-supplied connection. */
final class ModuleSchemaVersions {

  private ModuleSchemaVersions() {}

  static int read(Connection c, String moduleId) throws SQLException {
    try (PreparedStatement ps =
        c.prepareStatement("SELECT version FROM module_schema_versions WHERE module_id = ?")) {
      ps.setString(1, moduleId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getInt(1) : 0;
      }
    }
  }

  static void write(Connection c, String moduleId, int version) throws SQLException {
    int current = read(c, moduleId);
    if (version < current) {
      throw new IllegalArgumentException(
          "schema version for module '"
              + moduleId
              + "' cannot move backwards from "
              + current
              + " to "
              + version);
    }
    try (PreparedStatement ps =
        c.prepareStatement(
            """
            INSERT INTO module_schema_versions(module_id, version) VALUES(?, ?)
            ON CONFLICT(module_id) DO UPDATE SET version = excluded.version
            """)) {
      ps.setString(1, moduleId);
      ps.setInt(2, version);
      ps.executeUpdate();
    }
  }
}
