/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api.storage;

import java.sql.SQLException;
import java.util.Set;

/**
 * Idempotent DDL helpers bound to the connection of a running migration transaction.
 *
 * <p>All statements run on that connection so they commit or roll back together with the
 * migration step that issued them.
 */
public interface SchemaHelper {

  /**
   * Whether a table exists.
   *
   * @param table table name
   */
  boolean tableExists(String table) throws SQLException;

  /**
   * Column names of a table, lowercase.
   *
   * @param table table name
   * @return column names, empty when the table does not exist
   */
  Set<String> columns(String table) throws SQLException;

  /** Whether a column exists. */
  boolean hasColumn(String table, String column) throws SQLException;

  /**
   * Adds a column when missing.
   *
   * @param table table name
   * @param column column name
   * @param columnDef column type and constraints, e.g. {@code "INTEGER NOT NULL DEFAULT 0"}
   */
  void addColumnIfMissing(String table, String column, String columnDef) throws SQLException;

  /**
   * Creates an index when missing.
   *
   * @param indexName index name
   * @param createIndexSql full {@code CREATE INDEX} statement
   */
  void ensureIndex(String indexName, String createIndexSql) throws SQLException;

  /** Runs an arbitrary DDL statement. */
  void execute(String sql) throws SQLException;
}
