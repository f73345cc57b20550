/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.api.storage.WorldStorage;
import dev.vitalis.core.Config;
import dev.vitalis.core.SqlErrorCodes;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WorldStorage} backed by one SQLite file per world in WAL mode, pooled through Hikari.
 *
 * <p>SQLite admits a single writer, so writes in this process are funnelled through a fair lock
 * acquired with the configured timeout. Readers borrow their own pooled connection and see the
 * last committed state while a write is in progress.
 */
public final class SqliteWorldStorage implements WorldStorage {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  /** Database file name inside each world directory. */
  public static final String FILE_NAME = "vitalis.db";

  private static final byte[] SQLITE_HEADER =
      "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

  private final UUID worldId;
  private final Path file;
  private final HikariDataSource pool;
  private final ReentrantLock writer = new ReentrantLock(true);
  private final long writeTimeoutMs;
  private final int busyRetries;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile boolean poolClosed;

  private SqliteWorldStorage(
      UUID worldId, Path file, HikariDataSource pool, Config.Storage settings) {
    this.worldId = worldId;
    this.file = file;
    this.pool = pool;
    this.writeTimeoutMs = settings.writeTimeoutMs();
    this.busyRetries = Math.max(1, settings.busyRetries());
  }

  /**
   * Opens (creating when absent) the database of a world and applies the bootstrap schema.
   *
   * @param worldId world UUID
   * @param settings storage settings
   * @return open storage
   * @throws StorageException {@code STORAGE_CORRUPT} for unreadable files, {@code
   *     SCHEMA_MISMATCH} for conflicting bootstrap tables, {@code STORAGE_FAILURE} otherwise
   */
  public static SqliteWorldStorage open(UUID worldId, Config.Storage settings) {
    Objects.requireNonNull(worldId, "worldId");
    Objects.requireNonNull(settings, "settings");
    Path dir = settings.dataDir().resolve(worldId.toString());
    Path file = dir.resolve(FILE_NAME);
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new StorageException(
          ErrorCode.STORAGE_FAILURE, "cannot create world directory " + dir, e);
    }
    verifyReadable(worldId, file);

    HikariDataSource pool = new HikariDataSource(poolConfig(worldId, file, settings));
    SqliteWorldStorage storage = new SqliteWorldStorage(worldId, file, pool, settings);
    try {
      WorldSchema.bootstrap(storage);
    } catch (RuntimeException e) {
      storage.close();
      throw e;
    }
    LOG.info("(vitalis) world={} storage opened at {}", worldId, file);
    return storage;
  }

  private static HikariConfig poolConfig(UUID worldId, Path file, Config.Storage settings) {
    HikariConfig hc = new HikariConfig();
    hc.setDriverClassName("org.sqlite.JDBC");
    hc.setJdbcUrl("jdbc:sqlite:" + file.toAbsolutePath());
    hc.setPoolName("vitalis-" + worldId);
    hc.setMaximumPoolSize(settings.poolSize());
    hc.setMinimumIdle(1);
    hc.setConnectionTimeout(Math.max(250L, settings.writeTimeoutMs()));
    hc.setAutoCommit(true);
    hc.setInitializationFailTimeout(-1);
    hc.addDataSourceProperty("journal_mode", "WAL");
    hc.addDataSourceProperty("synchronous", "NORMAL");
    hc.addDataSourceProperty("busy_timeout", String.valueOf(settings.writeTimeoutMs()));
    return hc;
  }

  /** Rejects files that are not SQLite databases or fail {@code PRAGMA quick_check}. */
  private static void verifyReadable(UUID worldId, Path file) {
    try {
      if (!Files.exists(file) || Files.size(file) == 0) {
        return;
      }
      byte[] header = new byte[SQLITE_HEADER.length];
      int read;
      try (InputStream in = Files.newInputStream(file)) {
        read = in.readNBytes(header, 0, header.length);
      }
      if (read < header.length || !Arrays.equals(header, SQLITE_HEADER)) {
        throw corrupt(worldId, file, "file is not a database", null);
      }
    } catch (IOException e) {
      throw new StorageException(ErrorCode.STORAGE_FAILURE, "cannot read " + file, e);
    }

    try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
        Statement st = c.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA quick_check")) {
      String result = rs.next() ? rs.getString(1) : null;
      if (!"ok".equalsIgnoreCase(result)) {
        throw corrupt(worldId, file, "quick_check reported " + result, null);
      }
    } catch (SQLException e) {
      ErrorCode code = SqlErrorCodes.classify(e);
      if (code == ErrorCode.STORAGE_CORRUPT) {
        throw corrupt(worldId, file, e.getMessage(), e);
      }
      throw new StorageException(code, "cannot open " + file + ": " + e.getMessage(), e);
    }
  }

  private static StorageException corrupt(UUID worldId, Path file, String detail, Throwable cause) {
    LOG.error(
        "(vitalis) code={} op={} world={} file={} message={}",
        ErrorCode.STORAGE_CORRUPT,
        "storage.open",
        worldId,
        file,
        detail);
    return new StorageException(
        ErrorCode.STORAGE_CORRUPT, "world " + worldId + " database unreadable: " + detail, cause);
  }

  @Override
  public UUID worldId() {
    return worldId;
  }

  /** Database file backing this world. */
  public Path file() {
    return file;
  }

  @Override
  public int execute(String sql, Object... params) {
    Objects.requireNonNull(sql, "sql");
    return write(
        "storage.execute",
        false,
        c -> {
          try (PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
          }
        });
  }

  @Override
  public <T> T read(SqlFunction<T> body) {
    Objects.requireNonNull(body, "body");
    ensureOpen("storage.read");
    try (Connection c = pool.getConnection()) {
      return body.apply(c);
    } catch (SQLException e) {
      throw translate("storage.read", e);
    }
  }

  @Override
  public <T> T transaction(SqlFunction<T> body) {
    Objects.requireNonNull(body, "body");
    return write("storage.transaction", true, body);
  }

  @Override
  public int getModuleSchemaVersion(String moduleId) {
    Objects.requireNonNull(moduleId, "moduleId");
    return read(c -> ModuleSchemaVersions.read(c, moduleId));
  }

  @Override
  public void setModuleSchemaVersion(String moduleId, int version) {
    Objects.requireNonNull(moduleId, "moduleId");
    transaction(
        c -> {
          ModuleSchemaVersions.write(c, moduleId, version);
          return null;
        });
  }

  @Override
  public <T> T withRetry(String op, StorageAction<T> action) {
    StorageException last = null;
    for (int attempt = 1; attempt <= busyRetries; attempt++) {
      try {
        return action.run();
      } catch (StorageException e) {
        if (!e.retryable()) {
          throw e;
        }
        last = e;
        LOG.warn(
            "(vitalis) code={} op={} world={} attempt={} message={}",
            e.code(),
            op,
            worldId,
            attempt,
            e.getMessage());
        if (attempt < busyRetries) {
          try {
            Thread.sleep(50L * attempt);
          } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
      }
    }
    throw last;
  }

  @Override
  public boolean isOpen() {
    return !closed.get();
  }

  /**
   * Stops accepting new work, lets writers already waiting for the writer slot finish (bounded by
   * the write timeout), checkpoints the WAL and closes the pool. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    boolean acquired = false;
    try {
      acquired = writer.tryLock(writeTimeoutMs, TimeUnit.MILLISECONDS);
      if (!acquired) {
        LOG.warn(
            "(vitalis) code={} op={} world={} message={}",
            ErrorCode.STORAGE_BUSY,
            "storage.close",
            worldId,
            "writer still active after " + writeTimeoutMs + "ms; closing anyway");
      }
      checkpoint();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("(vitalis) world={} interrupted while closing storage", worldId);
    } finally {
      poolClosed = true;
      if (acquired) {
        writer.unlock();
      }
      pool.close();
      LOG.info("(vitalis) world={} storage closed", worldId);
    }
  }

  private void checkpoint() {
    try (Connection c = pool.getConnection();
        Statement st = c.createStatement()) {
      st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
    } catch (SQLException e) {
      LOG.warn(
          "(vitalis) code={} op={} world={} message={}",
          SqlErrorCodes.classify(e),
          "storage.checkpoint",
          worldId,
          e.getMessage());
    }
  }

  private <T> T write(String op, boolean transactional, SqlFunction<T> body) {
    ensureOpen(op);
    acquireWriter(op);
    try {
      if (poolClosed) {
        throw closedError(op);
      }
      try (Connection c = pool.getConnection()) {
        if (!transactional) {
          return body.apply(c);
        }
        c.setAutoCommit(false);
        try {
          T result = body.apply(c);
          c.commit();
          return result;
        } catch (SQLException | RuntimeException e) {
          rollback(c, op, e);
          throw e;
        } finally {
          c.setAutoCommit(true);
        }
      } catch (SQLException e) {
        throw translate(op, e);
      }
    } finally {
      writer.unlock();
    }
  }

  private void acquireWriter(String op) {
    boolean acquired;
    try {
      acquired = writer.tryLock(writeTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StorageException(
          ErrorCode.STORAGE_BUSY, "interrupted waiting for writer of world " + worldId, e);
    }
    if (!acquired) {
      LOG.warn(
          "(vitalis) code={} op={} world={} timeoutMs={} message={}",
          ErrorCode.STORAGE_BUSY,
          op,
          worldId,
          writeTimeoutMs,
          "writer slot not acquired");
      throw new StorageException(
          ErrorCode.STORAGE_BUSY,
          "world " + worldId + " writer busy for more than " + writeTimeoutMs + "ms");
    }
  }

  private void rollback(Connection c, String op, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException rollbackError) {
      cause.addSuppressed(rollbackError);
      LOG.warn(
          "(vitalis) op={} world={} rollback failed: {}",
          op,
          worldId,
          rollbackError.getMessage());
    }
  }

  private void ensureOpen(String op) {
    if (closed.get()) {
      throw closedError(op);
    }
  }

  private StorageException closedError(String op) {
    return new StorageException(
        ErrorCode.STORAGE_CLOSED, op + " on closed storage of world " + worldId);
  }

  private StorageException translate(String op, SQLException e) {
    ErrorCode code = SqlErrorCodes.classify(e);
    LOG.warn(
        "(vitalis) code={} op={} world={} message={} vendor={}",
        code,
        op,
        worldId,
        e.getMessage(),
        e.getErrorCode());
    return new StorageException(code, op + " failed: " + e.getMessage(), e);
  }

  private static void bind(PreparedStatement ps, Object... params) throws SQLException {
    if (params == null) {
      return;
    }
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param instanceof UUID uuid) {
        ps.setString(i + 1, uuid.toString());
      } else if (param instanceof Double d) {
        ps.setDouble(i + 1, d);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
