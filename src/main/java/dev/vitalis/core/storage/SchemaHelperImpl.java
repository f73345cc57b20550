/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import dev.vitalis.api.storage.SchemaHelper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/** SQLite implementation backed by {@code sqlite_master} and {@code PRAGMA table_info}. */
final class SchemaHelperImpl implements SchemaHelper {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

  private final Connection connection;

  SchemaHelperImpl(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public boolean tableExists(String table) throws SQLException {
    return masterEntryExists("table", table);
  }

  @Override
  public Set<String> columns(String table) throws SQLException {
    Set<String> columns = new LinkedHashSet<>();
    try (Statement st = connection.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA table_info(" + identifier(table) + ")")) {
      while (rs.next()) {
        columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
      }
    }
    return columns;
  }

  @Override
  public boolean hasColumn(String table, String column) throws SQLException {
    return columns(table).contains(column.toLowerCase(Locale.ROOT));
  }

  @Override
  public void addColumnIfMissing(String table, String column, String columnDef)
      throws SQLException {
    if (hasColumn(table, column)) {
      return;
    }
    execute(
        "ALTER TABLE " + identifier(table) + " ADD COLUMN " + identifier(column) + " " + columnDef);
  }

  @Override
  public void ensureIndex(String indexName, String createIndexSql) throws SQLException {
    if (masterEntryExists("index", indexName)) {
      return;
    }
    execute(createIndexSql);
  }

  @Override
  public void execute(String sql) throws SQLException {
    try (Statement st = connection.createStatement()) {
      st.execute(sql);
    }
  }

  private boolean masterEntryExists(String type, String name) throws SQLException {
    try (PreparedStatement ps =
        connection.prepareStatement(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = ? AND name = ?")) {
      ps.setString(1, type);
      ps.setString(2, name);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() && rs.getInt(1) > 0;
      }
    }
  }

  private static String identifier(String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid SQL identifier: " + name);
    }
    return name;
  }
}
