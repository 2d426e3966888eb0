package raffle.jdbc;

import org.h2.api.ErrorCode;
import org.junit.jupiter.api.Test;
import raffle.ErrorKind;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class SqlErrorsTest {

  @Test
  void duplicateKeyIsConflict() {
    assertEquals(ErrorKind.CONFLICT, SqlErrors.classify(
        new SQLException("Unique index violation", "23505", ErrorCode.DUPLICATE_KEY_1)));
    assertEquals(ErrorKind.CONFLICT, SqlErrors.classify(new SQLException("dup", "23505")));
  }

  @Test
  void integrityAndDataErrorsAreValidation() {
    assertEquals(ErrorKind.VALIDATION, SqlErrors.classify(
        new SQLException("Check constraint violated", "23513", ErrorCode.CHECK_CONSTRAINT_VIOLATED_1)));
    assertEquals(ErrorKind.VALIDATION, SqlErrors.classify(
        new SQLException("NULL not allowed", "23502", ErrorCode.NULL_NOT_ALLOWED)));
    assertEquals(ErrorKind.VALIDATION, SqlErrors.classify(new SQLException("too long", "22001")));
  }

  @Test
  void lockingErrorsAreTransient() {
    assertEquals(ErrorKind.TRANSIENT, SqlErrors.classify(
        new SQLException("Timeout trying to lock table", "HYT00", ErrorCode.LOCK_TIMEOUT_1)));
    assertEquals(ErrorKind.TRANSIENT, SqlErrors.classify(
        new SQLException("Deadlock", "40001", ErrorCode.DEADLOCK_1)));
    assertEquals(ErrorKind.TRANSIENT, SqlErrors.classify(
        new SQLException("Concurrent update", "90131", ErrorCode.CONCURRENT_UPDATE_1)));
  }

  @Test
  void corruptionAndSchemaErrorsAreFatal() {
    assertEquals(ErrorKind.FATAL, SqlErrors.classify(
        new SQLException("File corrupted", "90030", ErrorCode.FILE_CORRUPTED_1)));
    assertEquals(ErrorKind.FATAL, SqlErrors.classify(
        new SQLException("Unsupported file format", "90048", ErrorCode.FILE_VERSION_ERROR_1)));
    assertEquals(ErrorKind.FATAL, SqlErrors.classify(
        new SQLException("Table not found", "42S02", ErrorCode.TABLE_OR_VIEW_NOT_FOUND_1)));
    assertEquals(ErrorKind.FATAL, SqlErrors.classify(
        new SQLException("Column not found", "42S22", ErrorCode.COLUMN_NOT_FOUND_1)));
  }

  @Test
  void poolTimeoutIsResourceExhausted() {
    assertEquals(ErrorKind.RESOURCE_EXHAUSTED,
        SqlErrors.classify(new ResourceExhaustedException("no connection")));
  }

  @Test
  void otherTransientExceptionsAreTransient() {
    assertEquals(ErrorKind.TRANSIENT,
        SqlErrors.classify(new SQLTransientConnectionException("connection reset")));
  }

  @Test
  void unknownErrorsDefaultToTransient() {
    assertEquals(ErrorKind.TRANSIENT, SqlErrors.classify(new SQLException("something odd")));
  }

  @Test
  void causeChainIsExamined() {
    SQLException root = new SQLException("Unique index violation", "23505", ErrorCode.DUPLICATE_KEY_1);
    assertEquals(ErrorKind.CONFLICT, SqlErrors.classify(new SQLException("batch failed", root)));

    SQLException head = new SQLException("batch failed");
    head.setNextException(new SQLException("File corrupted", "90030", ErrorCode.FILE_CORRUPTED_1));
    assertEquals(ErrorKind.FATAL, SqlErrors.classify(head));
  }

  @Test
  void describeKeepsFirstLine() {
    SQLException e = new SQLException("Unique index violation\nSQL statement:\nINSERT ...");
    assertEquals("Unique index violation", SqlErrors.describe(e));
    assertEquals("SQLException", SqlErrors.describe(new SQLException()));
    assertEquals(500, SqlErrors.describe(new SQLException("x".repeat(2000))).length());
  }
}
