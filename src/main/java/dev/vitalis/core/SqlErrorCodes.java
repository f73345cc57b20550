/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import dev.vitalis.api.ErrorCode;
import java.sql.SQLException;
import java.util.Locale;

/** Utility that maps SQLite {@link SQLException} instances to Vitalis {@link ErrorCode}s. */
public final class SqlErrorCodes {
  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;
  private static final int SQLITE_CORRUPT = 11;
  private static final int SQLITE_NOTADB = 26;

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception into one of the canonical {@link ErrorCode} values.
   *
   * <p>Extended result codes are reduced to their primary code first, so {@code
   * SQLITE_BUSY_SNAPSHOT} classifies like {@code SQLITE_BUSY}.
   *
   * @param e SQL exception thrown by sqlite-jdbc or the connection pool
   * @return mapped {@link ErrorCode}, defaulting to {@link ErrorCode#STORAGE_FAILURE}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.STORAGE_FAILURE;
    }
    switch (e.getErrorCode() & 0xFF) {
      case SQLITE_BUSY:
      case SQLITE_LOCKED:
        return ErrorCode.STORAGE_BUSY;
      case SQLITE_CORRUPT:
      case SQLITE_NOTADB:
        return ErrorCode.STORAGE_CORRUPT;
      default:
        break;
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("sqlite_busy")
          || lower.contains("sqlite_locked")
          || lower.contains("database is locked")) {
        return ErrorCode.STORAGE_BUSY;
      }
      if (lower.contains("sqlite_corrupt")
          || lower.contains("sqlite_notadb")
          || lower.contains("malformed")
          || lower.contains("not a database")) {
        return ErrorCode.STORAGE_CORRUPT;
      }
    }
    SQLException next = e.getNextException();
    if (next != null && next != e) {
      return classify(next);
    }
    if (e.getCause() instanceof SQLException cause && cause != e) {
      return classify(cause);
    }
    return ErrorCode.STORAGE_FAILURE;
  }
}
