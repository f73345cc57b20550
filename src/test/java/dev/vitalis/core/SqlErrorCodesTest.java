/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.vitalis.api.ErrorCode;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SqlErrorCodes}. */
final class SqlErrorCodesTest {

  @Test
  void busyAndLockedMapToStorageBusy() {
    assertEquals(ErrorCode.STORAGE_BUSY, SqlErrorCodes.classify(new SQLException("busy", null, 5)));
    assertEquals(
        ErrorCode.STORAGE_BUSY, SqlErrorCodes.classify(new SQLException("locked", null, 6)));
  }

  @Test
  void extendedResultCodesReduceToPrimaryCode() {
    // SQLITE_BUSY_SNAPSHOT
    assertEquals(
        ErrorCode.STORAGE_BUSY, SqlErrorCodes.classify(new SQLException("snapshot", null, 517)));
  }

  @Test
  void corruptAndNotADatabaseMapToStorageCorrupt() {
    assertEquals(
        ErrorCode.STORAGE_CORRUPT, SqlErrorCodes.classify(new SQLException("corrupt", null, 11)));
    assertEquals(
        ErrorCode.STORAGE_CORRUPT, SqlErrorCodes.classify(new SQLException("notadb", null, 26)));
  }

  @Test
  void messageIsInspectedWhenVendorCodeIsMissing() {
    assertEquals(
        ErrorCode.STORAGE_BUSY,
        SqlErrorCodes.classify(new SQLException("[SQLITE_BUSY] The database file is locked")));
    assertEquals(
        ErrorCode.STORAGE_CORRUPT,
        SqlErrorCodes.classify(new SQLException("database disk image is malformed")));
  }

  @Test
  void chainedExceptionsAreFollowed() {
    SQLException outer = new SQLException("batch failed");
    outer.setNextException(new SQLException("locked", null, 6));
    assertEquals(ErrorCode.STORAGE_BUSY, SqlErrorCodes.classify(outer));

    SQLException wrapped = new SQLException("wrapper", new SQLException("corrupt", null, 11));
    assertEquals(ErrorCode.STORAGE_CORRUPT, SqlErrorCodes.classify(wrapped));
  }

  @Test
  void unknownFailuresDefaultToStorageFailure() {
    SQLException constraint = new SQLException("constraint", null, 19);
    assertEquals(ErrorCode.STORAGE_FAILURE, SqlErrorCodes.classify(constraint));
    assertEquals(ErrorCode.STORAGE_FAILURE, SqlErrorCodes.classify(null));
  }
}
