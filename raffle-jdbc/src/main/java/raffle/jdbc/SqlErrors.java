package raffle.jdbc;

import org.h2.api.ErrorCode;
import raffle.ErrorKind;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps driver exceptions onto {@link ErrorKind}.
 *
 * <p>The exception, its cause chain and any chained next-exceptions are examined; the first
 * recognised H2 error code or SQL state wins. Unrecognised errors are {@link ErrorKind#TRANSIENT}.
 */
public final class SqlErrors {
  private static final int MAX_MESSAGE_LENGTH = 500;

  public static ErrorKind classify(SQLException e) {
    for (SQLException sql : chain(e)) {
      if (sql instanceof ResourceExhaustedException) {
        return ErrorKind.RESOURCE_EXHAUSTED;
      }
      ErrorKind byCode = byErrorCode(sql.getErrorCode());
      if (byCode != null) {
        return byCode;
      }
      ErrorKind byState = bySqlState(sql.getSQLState());
      if (byState != null) {
        return byState;
      }
      if (sql instanceof SQLTransientException) {
        return ErrorKind.TRANSIENT;
      }
    }
    return ErrorKind.TRANSIENT;
  }

  /** First line of the driver message, bounded in length. */
  public static String describe(SQLException e) {
    String message = e.getMessage();
    if (message == null || message.isBlank()) {
      return e.getClass().getSimpleName();
    }
    int newline = message.indexOf('\n');
    if (newline > 0) {
      message = message.substring(0, newline);
    }
    return message.length() <= MAX_MESSAGE_LENGTH
        ? message
        : message.substring(0, MAX_MESSAGE_LENGTH);
  }

  private static ErrorKind byErrorCode(int code) {
    switch (code) {
      case ErrorCode.DUPLICATE_KEY_1:
        return ErrorKind.CONFLICT;
      case ErrorCode.LOCK_TIMEOUT_1:
      case ErrorCode.DEADLOCK_1:
      case ErrorCode.CONCURRENT_UPDATE_1:
        return ErrorKind.TRANSIENT;
      case ErrorCode.FILE_CORRUPTED_1:
      case ErrorCode.FILE_VERSION_ERROR_1:
      case ErrorCode.TABLE_OR_VIEW_NOT_FOUND_1:
      case ErrorCode.TABLE_OR_VIEW_NOT_FOUND_DATABASE_EMPTY_1:
      case ErrorCode.COLUMN_NOT_FOUND_1:
        return ErrorKind.FATAL;
      default:
        return null;
    }
  }

  private static ErrorKind bySqlState(String state) {
    if (state == null || state.length() < 2) {
      return null;
    }
    if (state.equals("23505")) {
      return ErrorKind.CONFLICT;
    }
    if (state.equals("40001")) {
      return ErrorKind.TRANSIENT;
    }
    String clazz = state.substring(0, 2);
    switch (clazz) {
      case "22":
      case "23":
        return ErrorKind.VALIDATION;
      case "42":
        return ErrorKind.FATAL;
      default:
        return null;
    }
  }

  private static List<SQLException> chain(SQLException e) {
    List<SQLException> out = new ArrayList<>();
    Throwable t = e;
    while (t != null && out.size() < 16) {
      if (t instanceof SQLException sql) {
        out.add(sql);
        SQLException next = sql.getNextException();
        if (next != null && next != sql && !out.contains(next)) {
          out.add(next);
        }
      }
      if (t.getCause() == t) {
        break;
      }
      t = t.getCause();
    }
    return out;
  }

  private SqlErrors() {}
}
