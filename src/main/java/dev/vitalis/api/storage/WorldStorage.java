/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api.storage;

import dev.vitalis.api.StorageException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Transactional store owned by exactly one world.
 *
 * <p>Handles are safe for concurrent use. Reads run concurrently; {@link #execute} and {@link
 * #transaction} are serialized per world and fail with {@code STORAGE_BUSY} once the configured
 * write timeout elapses. Every failure surfaces as an unchecked {@link StorageException}.
 */
public interface WorldStorage extends AutoCloseable {

  /** World that owns this store. */
  UUID worldId();

  /**
   * Executes a single mutating statement.
   *
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters
   * @return update count
   */
  int execute(String sql, Object... params);

  /**
   * Runs a read-only body on a pooled connection without taking the writer slot.
   *
   * @param body callback
   * @return callback result
   */
  <T> T read(SqlFunction<T> body);

  /**
   * Runs a body inside one transaction. Commits when the body returns, rolls back when it throws.
   * Required for any change touching more than one table.
   *
   * @param body callback receiving the transaction's connection
   * @return callback result
   */
  <T> T transaction(SqlFunction<T> body);

  /**
   * Schema version applied for a module.
   *
   * @param moduleId module identifier
   * @return stored version, {@code 0} when the module never migrated in this world
   */
  int getModuleSchemaVersion(String moduleId);

  /**
   * Records a module schema version. Versions never decrease.
   *
   * @param moduleId module identifier
   * @param version new version
   * @throws IllegalArgumentException when {@code version} is lower than the stored one
   */
  void setModuleSchemaVersion(String moduleId, int version);

  /**
   * Retries a storage action while it fails with a retryable error.
   *
   * @param op operation label used in logs
   * @param action action to run
   * @return action result
   */
  <T> T withRetry(String op, StorageAction<T> action);

  /** Whether {@link #close()} has not been called yet. */
  boolean isOpen();

  /** Checkpoints the write-ahead log and releases all connections. Idempotent. */
  @Override
  void close();

  /** Callback that works on a JDBC connection. */
  @FunctionalInterface
  interface SqlFunction<T> {
    T apply(Connection connection) throws SQLException;
  }

  /** Storage call wrapped by {@link #withRetry}. */
  @FunctionalInterface
  interface StorageAction<T> {
    T run();
  }
}
